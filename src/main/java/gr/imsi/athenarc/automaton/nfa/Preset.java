package gr.imsi.athenarc.automaton.nfa;

import static gr.imsi.athenarc.automaton.symbol.Symbol.ONE;
import static gr.imsi.athenarc.automaton.symbol.Symbol.THREE;
import static gr.imsi.athenarc.automaton.symbol.Symbol.TWO;
import static gr.imsi.athenarc.automaton.symbol.Symbol.ZERO;

/** The fixed transition tables the simulator ships with. */
public enum Preset {

    /**
     * Five states, accepting {2, 3, 4}. Accepts once "22" has been read,
     * and stays accepting if a 3 follows the run of twos.
     */
    FIVE_STATE(new TransitionTable.Builder()
        .transition(0, ZERO, 0).transition(0, ONE, 0).transition(0, TWO, 0, 1).transition(0, THREE, 0)
        .transition(1, ZERO).transition(1, ONE).transition(1, TWO, 2).transition(1, THREE)
        .transition(2, ZERO).transition(2, ONE).transition(2, TWO, 2).transition(2, THREE, 3)
        .anySymbol(3, 4)
        .anySymbol(4, 4)
        .accepting(2, 3, 4)
        .build()),

    /**
     * Ten states, accepting {9}. Accepts any input containing the same
     * symbol three times in a row.
     */
    TEN_STATE(new TransitionTable.Builder()
        .transition(0, ZERO, 0, 1).transition(0, ONE, 0, 2).transition(0, TWO, 0, 3).transition(0, THREE, 0, 4)
        .transition(1, ZERO, 5).transition(1, ONE).transition(1, TWO).transition(1, THREE)
        .transition(2, ZERO).transition(2, ONE, 6).transition(2, TWO).transition(2, THREE)
        .transition(3, ZERO).transition(3, ONE).transition(3, TWO, 7).transition(3, THREE)
        .transition(4, ZERO).transition(4, ONE).transition(4, TWO).transition(4, THREE, 8)
        .transition(5, ZERO, 9).transition(5, ONE).transition(5, TWO).transition(5, THREE)
        .transition(6, ZERO).transition(6, ONE, 9).transition(6, TWO).transition(6, THREE)
        .transition(7, ZERO).transition(7, ONE).transition(7, TWO, 9).transition(7, THREE)
        .transition(8, ZERO).transition(8, ONE).transition(8, TWO).transition(8, THREE, 9)
        .anySymbol(9, 9)
        .accepting(9)
        .build());

    private final TransitionTable table;

    Preset(TransitionTable table) {
        this.table = table;
    }

    public TransitionTable table() {
        return table;
    }
}
