package gr.imsi.athenarc.automaton.nfa;

import java.util.EnumMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

import gr.imsi.athenarc.automaton.symbol.Symbol;

/**
 * Counts consecutive reads of the same symbol. Only successful transitions
 * are recorded. Every read from the third consecutive one onwards counts
 * as a triplet occurrence of that symbol.
 */
public class OccurrenceCounter {

    static final int TRIPLET_LENGTH = 3;

    private final Map<Symbol, Integer> streakOccurrences = new EnumMap<>(Symbol.class);
    private final Map<Symbol, Integer> tripletOccurrences = new EnumMap<>(Symbol.class);

    public void record(Symbol symbol) {
        streakOccurrences.keySet().removeIf(other -> other != symbol);
        int streak = streakOccurrences.merge(symbol, 1, Integer::sum);
        if (streak >= TRIPLET_LENGTH) {
            tripletOccurrences.merge(symbol, 1, Integer::sum);
        }
    }

    public int streakOf(Symbol symbol) {
        return streakOccurrences.getOrDefault(symbol, 0);
    }

    public int tripletsOf(Symbol symbol) {
        return tripletOccurrences.getOrDefault(symbol, 0);
    }

    public ImmutableMap<Symbol, Integer> getStreakOccurrences() {
        return ImmutableMap.copyOf(streakOccurrences);
    }

    public ImmutableMap<Symbol, Integer> getTripletOccurrences() {
        return ImmutableMap.copyOf(tripletOccurrences);
    }
}
