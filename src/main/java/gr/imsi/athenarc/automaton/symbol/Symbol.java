package gr.imsi.athenarc.automaton.symbol;

/**
 * Input alphabet of the automaton.
 * Every symbol is read from exactly one input character.
 */
public enum Symbol {
    ZERO('0'),
    ONE('1'),
    TWO('2'),
    THREE('3');

    private final char character;

    Symbol(char character) {
        this.character = character;
    }

    /**
     * Gets the symbol read from the given character.
     *
     * @param character The input character
     * @return The matching symbol
     * @throws SymbolNotAcceptedException if the character is not part of the alphabet
     */
    public static Symbol of(char character) throws SymbolNotAcceptedException {
        switch (character) {
            case '0':
                return ZERO;
            case '1':
                return ONE;
            case '2':
                return TWO;
            case '3':
                return THREE;
            default:
                throw new SymbolNotAcceptedException(character);
        }
    }

    public char character() {
        return character;
    }

    @Override
    public String toString() {
        return String.valueOf(character);
    }
}
