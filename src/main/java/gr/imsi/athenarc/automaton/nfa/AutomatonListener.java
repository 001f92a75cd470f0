package gr.imsi.athenarc.automaton.nfa;

import java.util.Map;
import java.util.SortedSet;

import gr.imsi.athenarc.automaton.symbol.Symbol;

/**
 * Receives the reports an {@link Automaton} produces while it runs.
 */
public interface AutomatonListener {

    void symbolRead(Symbol symbol);

    /**
     * Called with the distinct last states of all live paths, after construction
     * and after every consumed symbol while the automaton is not on hold.
     */
    void statesChanged(SortedSet<Integer> states);

    /**
     * Called when a transition leaves the automaton in an accepting configuration.
     *
     * @param tripletOccurrences triplet counts per symbol, only symbols seen at least once
     */
    void accepted(Map<Symbol, Integer> tripletOccurrences);

    void finalState(int state, boolean accepting);

    void finalPath(Path path);

    AutomatonListener NO_OP = new AutomatonListener() {
        @Override
        public void symbolRead(Symbol symbol) {
        }

        @Override
        public void statesChanged(SortedSet<Integer> states) {
        }

        @Override
        public void accepted(Map<Symbol, Integer> tripletOccurrences) {
        }

        @Override
        public void finalState(int state, boolean accepting) {
        }

        @Override
        public void finalPath(Path path) {
        }
    };
}
