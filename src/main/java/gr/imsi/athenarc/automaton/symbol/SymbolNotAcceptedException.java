package gr.imsi.athenarc.automaton.symbol;

/**
 * Thrown when a read character is not in the input alphabet of the automaton.
 */
public class SymbolNotAcceptedException extends Exception {

    private final char symbol;

    public SymbolNotAcceptedException(char symbol) {
        super("Automaton doesn't accept symbol: " + symbol);
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }
}
