package gr.imsi.athenarc.automaton.nfa;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * One concrete run of the automaton: the states visited so far,
 * starting at the initial state.
 */
public final class Path {

    private static final Joiner ARROW_JOINER = Joiner.on("→");

    private final ImmutableList<Integer> states;
    private final int sum;

    private Path(ImmutableList<Integer> states) {
        this.states = states;
        this.sum = states.stream().mapToInt(Integer::intValue).sum();
    }

    public static Path of(Integer... states) {
        Preconditions.checkArgument(states.length > 0, "A path visits at least one state");
        return new Path(ImmutableList.copyOf(states));
    }

    /** Creates a new path with the given state appended; this path is left unchanged. */
    public Path append(int state) {
        return new Path(ImmutableList.<Integer>builderWithExpectedSize(states.size() + 1)
            .addAll(states)
            .add(state)
            .build());
    }

    public int last() {
        return states.get(states.size() - 1);
    }

    public int sum() {
        return sum;
    }

    public int length() {
        return states.size();
    }

    public List<Integer> getStates() {
        return states;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Path)) return false;
        return states.equals(((Path) o).states);
    }

    @Override
    public int hashCode() {
        return states.hashCode();
    }

    @Override
    public String toString() {
        return ARROW_JOINER.join(states.stream().map(state -> "q" + state).iterator());
    }
}
