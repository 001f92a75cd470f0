package gr.imsi.athenarc.automaton.io;

import java.io.PrintStream;
import java.util.Map;
import java.util.SortedSet;

import gr.imsi.athenarc.automaton.nfa.AutomatonListener;
import gr.imsi.athenarc.automaton.nfa.Path;
import gr.imsi.athenarc.automaton.nfa.TransitionTable;
import gr.imsi.athenarc.automaton.symbol.Symbol;

/**
 * Writes automaton reports as plain text lines.
 */
public class ConsoleReporter implements AutomatonListener {

    private final PrintStream out;

    public ConsoleReporter(PrintStream out) {
        this.out = out;
    }

    public ConsoleReporter() {
        this(System.out);
    }

    @Override
    public void symbolRead(Symbol symbol) {
        out.println("Reading symbol: " + symbol);
    }

    @Override
    public void statesChanged(SortedSet<Integer> states) {
        out.println("Current automaton states: " + TransitionTable.formatStates(states));
    }

    @Override
    public void accepted(Map<Symbol, Integer> tripletOccurrences) {
        tripletOccurrences.forEach((symbol, occurrences) ->
            out.println("Symbol " + symbol + " was tripled " + occurrences + " times already"));
    }

    @Override
    public void finalState(int state, boolean accepting) {
        out.println("Final automaton state: q" + state + " (" + (accepting ? "accepting" : "rejecting") + ")");
    }

    @Override
    public void finalPath(Path path) {
        out.println("State change path: " + path);
    }

    public void tokenRead(String token) {
        out.println(System.lineSeparator() + "Reading token: " + token);
    }

    public void message(String message) {
        out.println(message);
    }
}
