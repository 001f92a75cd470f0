package gr.imsi.athenarc.automaton.nfa;

import static gr.imsi.athenarc.automaton.symbol.Symbol.ONE;
import static gr.imsi.athenarc.automaton.symbol.Symbol.THREE;
import static gr.imsi.athenarc.automaton.symbol.Symbol.TWO;
import static gr.imsi.athenarc.automaton.symbol.Symbol.ZERO;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableSet;

public class TransitionTableTest {

    @Test
    public void testMissingAndEmptyEntriesHaveNoSuccessors() {
        TransitionTable table = new TransitionTable.Builder()
            .transition(0, ZERO, 1)
            .transition(0, ONE)
            .build();

        assertEquals(ImmutableSet.of(1), table.successors(0, ZERO));
        assertTrue(table.successors(0, ONE).isEmpty());
        assertTrue(table.successors(0, TWO).isEmpty());
        assertTrue(table.successors(7, ZERO).isEmpty());
        assertEquals(ImmutableSet.of(0, 1), table.getStates());
    }

    @Test
    public void testBuilderRejectsNegativeStates() {
        assertThrows(IllegalArgumentException.class, () -> new TransitionTable.Builder().transition(-1, ZERO, 0));
        assertThrows(IllegalArgumentException.class, () -> new TransitionTable.Builder().transition(0, ZERO, -2));
        assertThrows(IllegalArgumentException.class, () -> new TransitionTable.Builder().accepting(-1));
        assertThrows(NullPointerException.class, () -> new TransitionTable.Builder().transition(0, null, 1));
    }

    @Test
    public void testPresets() {
        TransitionTable five = Preset.FIVE_STATE.table();
        assertEquals(ImmutableSet.of(0, 1, 2, 3, 4), five.getStates());
        assertEquals(ImmutableSet.of(2, 3, 4), five.getAcceptingStates());
        assertEquals(ImmutableSet.of(0, 1), five.successors(0, TWO));
        assertTrue(five.isAccepting(3));
        assertFalse(five.isAccepting(1));

        TransitionTable ten = Preset.TEN_STATE.table();
        assertEquals(10, ten.getStates().size());
        assertEquals(ImmutableSet.of(9), ten.getAcceptingStates());
        assertEquals(ImmutableSet.of(0, 4), ten.successors(0, THREE));
        assertEquals(ImmutableSet.of(9), ten.successors(8, THREE));
        assertTrue(ten.successors(8, TWO).isEmpty());
    }

    @Test
    public void testFormatStates() {
        assertEquals("", TransitionTable.formatStates(List.of()));
        assertEquals("q4", TransitionTable.formatStates(List.of(4)));
        assertEquals("{q0, q1}", TransitionTable.formatStates(List.of(1, 0, 1)));
    }

    @Test
    public void testToMatrix() {
        String[][] matrix = Preset.TEN_STATE.table().toMatrix();

        assertEquals(11, matrix.length);
        assertArrayEquals(new String[] {"δ", "0", "1", "2", "3"}, matrix[0]);
        assertArrayEquals(new String[] {"q0", "{q0, q1}", "{q0, q2}", "{q0, q3}", "{q0, q4}"}, matrix[1]);
        assertArrayEquals(new String[] {"q1", "q5", "✕", "✕", "✕"}, matrix[2]);
        assertArrayEquals(new String[] {"q9", "q9", "q9", "q9", "q9"}, matrix[10]);
    }
}
