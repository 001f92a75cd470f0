package gr.imsi.athenarc.automaton.nfa;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import gr.imsi.athenarc.automaton.symbol.Symbol;

/**
 * Simulates a non-deterministic finite automaton by keeping every live path.
 * <p>
 * One instance handles one input token. Symbols are consumed strictly in order.
 * Once a symbol kills all live paths at once, the automaton is put on hold and
 * ignores every later symbol. Closing it reports the final state and the path
 * that led there; this happens exactly once.
 */
public class Automaton implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Automaton.class);

    public static final int INITIAL_STATE = 0;

    /** Greatest last state wins, ties go to the greatest sum of visited states. */
    static final Comparator<Path> FINAL_PATH_ORDER = Comparator.comparingInt(Path::last)
        .thenComparingInt(Path::sum);

    private final TransitionTable table;
    private final AutomatonListener listener;
    private final OccurrenceCounter occurrences = new OccurrenceCounter();

    private List<Path> paths = ImmutableList.of(Path.of(INITIAL_STATE));
    private boolean onHold = false;
    private boolean closed = false;

    public Automaton(TransitionTable table, AutomatonListener listener) {
        this.table = Preconditions.checkNotNull(table, "Transition table cannot be null");
        this.listener = Preconditions.checkNotNull(listener, "Listener cannot be null");
        listener.statesChanged(currentStates());
    }

    public Automaton(TransitionTable table) {
        this(table, AutomatonListener.NO_OP);
    }

    /**
     * Consumes a symbol and moves every live path to its successors.
     *
     * @param symbol The next input symbol
     * @return true if, after this symbol, some live path ends in an accepting state
     */
    public boolean consume(Symbol symbol) {
        Preconditions.checkNotNull(symbol, "Symbol cannot be null");
        Preconditions.checkState(!closed, "Automaton is already closed");
        listener.symbolRead(symbol);
        if (onHold) {
            LOG.debug("On hold, ignoring symbol {}", symbol);
            return false;
        }

        List<Path> nextPaths = new ArrayList<>();
        for (Path path : paths) {
            for (int successor : table.successors(path.last(), symbol)) {
                nextPaths.add(path.append(successor));
            }
        }

        if (nextPaths.isEmpty()) {
            onHold = true;
            LOG.debug("No transition from {} on symbol {}, automaton is on hold", currentStates(), symbol);
            listener.statesChanged(currentStates());
            return false;
        }

        paths = ImmutableList.copyOf(nextPaths);
        occurrences.record(symbol);
        LOG.debug("Symbol {} read, {} live paths", symbol, paths.size());

        boolean accepting = isAccepting();
        if (accepting) {
            listener.accepted(occurrences.getTripletOccurrences());
        }
        listener.statesChanged(currentStates());
        return accepting;
    }

    /**
     * Reports the final state, the greatest last state among live paths, and the
     * path that reached it. Later calls are ignored.
     */
    @Override
    public void close() {
        if (closed) {
            LOG.warn("Automaton already closed, skipping final report");
            return;
        }
        closed = true;
        int state = finalState();
        listener.finalState(state, table.isAccepting(state));
        listener.finalPath(finalPath());
    }

    public boolean isAccepting() {
        return paths.stream().anyMatch(path -> table.isAccepting(path.last()));
    }

    /** Distinct last states of all live paths. */
    public SortedSet<Integer> currentStates() {
        SortedSet<Integer> states = new TreeSet<>();
        for (Path path : paths) {
            states.add(path.last());
        }
        return states;
    }

    public int finalState() {
        return currentStates().last();
    }

    public Path finalPath() {
        Path selected = paths.get(0);
        for (Path path : paths) {
            if (FINAL_PATH_ORDER.compare(path, selected) > 0) {
                selected = path;
            }
        }
        return selected;
    }

    public List<Path> getPaths() {
        return paths;
    }

    public boolean isOnHold() {
        return onHold;
    }

    public boolean isClosed() {
        return closed;
    }

    public ImmutableMap<Symbol, Integer> getTripletOccurrences() {
        return occurrences.getTripletOccurrences();
    }

    public ImmutableMap<Symbol, Integer> getStreakOccurrences() {
        return occurrences.getStreakOccurrences();
    }

    public TransitionTable getTable() {
        return table;
    }
}
