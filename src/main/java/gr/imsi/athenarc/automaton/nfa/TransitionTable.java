package gr.imsi.athenarc.automaton.nfa;

import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ImmutableTable;

import gr.imsi.athenarc.automaton.symbol.Symbol;

/**
 * Immutable transition function of an NFA together with its accepting states.
 * A missing entry and an empty successor set both mean "no transition".
 */
public class TransitionTable {

    static final String DELTA_CHARACTER = "δ";
    static final String NOOP_CHARACTER = "✕";

    private final ImmutableTable<Integer, Symbol, ImmutableSet<Integer>> transitions;
    private final ImmutableSet<Integer> acceptingStates;
    private final ImmutableSortedSet<Integer> states;

    private TransitionTable(Builder builder) {
        this.transitions = builder.transitions.build();
        this.acceptingStates = builder.acceptingStates.build();
        ImmutableSortedSet.Builder<Integer> allStates = ImmutableSortedSet.naturalOrder();
        allStates.add(Automaton.INITIAL_STATE);
        allStates.addAll(transitions.rowKeySet());
        transitions.values().forEach(allStates::addAll);
        allStates.addAll(acceptingStates);
        this.states = allStates.build();
    }

    /**
     * Gets the successor states of a state on a symbol.
     *
     * @return the successors, empty if there is no transition
     */
    public ImmutableSet<Integer> successors(int state, Symbol symbol) {
        ImmutableSet<Integer> successors = transitions.get(state, symbol);
        return successors == null ? ImmutableSet.of() : successors;
    }

    public boolean isAccepting(int state) {
        return acceptingStates.contains(state);
    }

    public ImmutableSet<Integer> getAcceptingStates() {
        return acceptingStates;
    }

    /** All state ids mentioned by the table, in ascending order. */
    public ImmutableSortedSet<Integer> getStates() {
        return states;
    }

    /**
     * Builds the printable grid of the table: a header row with the symbols,
     * then one row per state with its successors for every symbol.
     */
    public String[][] toMatrix() {
        Symbol[] symbols = Symbol.values();
        String[][] matrix = new String[states.size() + 1][symbols.length + 1];
        matrix[0][0] = DELTA_CHARACTER;
        for (int column = 0; column < symbols.length; column++) {
            matrix[0][column + 1] = symbols[column].toString();
        }
        int row = 1;
        for (int state : states) {
            matrix[row][0] = formatStates(ImmutableSet.of(state));
            for (int column = 0; column < symbols.length; column++) {
                String cell = formatStates(successors(state, symbols[column]));
                matrix[row][column + 1] = cell.isEmpty() ? NOOP_CHARACTER : cell;
            }
            row++;
        }
        return matrix;
    }

    /**
     * Formats states as {@code q0} or {@code {q0, q1}}. Empty and singleton
     * collections are written without braces.
     */
    public static String formatStates(Collection<Integer> states) {
        SortedSet<Integer> sorted = new TreeSet<>(states);
        StringBuilder sb = new StringBuilder();
        boolean braces = sorted.size() > 1;
        if (braces) {
            sb.append('{');
        }
        String separator = "";
        for (int state : sorted) {
            sb.append(separator).append('q').append(state);
            separator = ", ";
        }
        if (braces) {
            sb.append('}');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "TransitionTable{states=" + states + ", accepting=" + acceptingStates + "}";
    }

    public static class Builder {
        private final ImmutableTable.Builder<Integer, Symbol, ImmutableSet<Integer>> transitions = ImmutableTable.builder();
        private final ImmutableSet.Builder<Integer> acceptingStates = ImmutableSet.builder();

        public Builder transition(int state, Symbol symbol, Integer... targets) {
            Preconditions.checkArgument(state >= 0, "State id cannot be negative: %s", state);
            Preconditions.checkNotNull(symbol, "Symbol cannot be null");
            for (Integer target : targets) {
                Preconditions.checkArgument(target != null && target >= 0, "Invalid target state: %s", target);
            }
            transitions.put(state, symbol, ImmutableSet.copyOf(targets));
            return this;
        }

        /** Adds the same successors for every symbol of the alphabet. */
        public Builder anySymbol(int state, Integer... targets) {
            for (Symbol symbol : Symbol.values()) {
                transition(state, symbol, targets);
            }
            return this;
        }

        public Builder accepting(Integer... states) {
            for (Integer state : states) {
                Preconditions.checkArgument(state != null && state >= 0, "Invalid accepting state: %s", state);
                acceptingStates.add(state);
            }
            return this;
        }

        public TransitionTable build() {
            return new TransitionTable(this);
        }
    }
}
