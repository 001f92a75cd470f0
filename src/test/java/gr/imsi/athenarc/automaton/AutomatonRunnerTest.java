package gr.imsi.athenarc.automaton;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.automaton.io.ConsoleReporter;
import gr.imsi.athenarc.automaton.nfa.Path;
import gr.imsi.athenarc.automaton.nfa.Preset;

public class AutomatonRunnerTest {

    private static final String LS = System.lineSeparator();

    private ByteArrayOutputStream bytes;
    private ConsoleReporter reporter;

    @BeforeEach
    void setUp() {
        bytes = new ByteArrayOutputStream();
        reporter = new ConsoleReporter(new PrintStream(bytes, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testAcceptedToken() {
        TokenResult result = new AutomatonRunner(Preset.FIVE_STATE.table(), reporter).run("2223");

        assertEquals(3, result.getFinalState());
        assertTrue(result.isAccepting());
        assertFalse(result.isAborted());
        assertNull(result.getRejectedSymbol());
        assertEquals(Path.of(0, 1, 2, 2, 3), result.getPath());

        String expected = "Current automaton states: q0" + LS
            + "Reading symbol: 2" + LS
            + "Current automaton states: {q0, q1}" + LS
            + "Reading symbol: 2" + LS
            + "Current automaton states: {q0, q1, q2}" + LS
            + "Reading symbol: 2" + LS
            + "Symbol 2 was tripled 1 times already" + LS
            + "Current automaton states: {q0, q1, q2}" + LS
            + "Reading symbol: 3" + LS
            + "Symbol 2 was tripled 1 times already" + LS
            + "Current automaton states: {q0, q3}" + LS
            + "Final automaton state: q3 (accepting)" + LS
            + "State change path: q0→q1→q2→q2→q3" + LS;
        assertEquals(expected, output());
    }

    /**
     * An unknown character stops the token, and the automaton is still closed
     * with what was read before it.
     */
    @Test
    public void testUnacceptedSymbolAbortsToken() {
        TokenResult result = new AutomatonRunner(Preset.TEN_STATE.table(), reporter).run("12x3");

        assertTrue(result.isAborted());
        assertEquals('x', (char) result.getRejectedSymbol());
        assertEquals(3, result.getFinalState());
        assertFalse(result.isAccepting());
        assertEquals(Path.of(0, 0, 3), result.getPath());

        String out = output();
        assertTrue(out.contains("Automaton doesn't accept symbol: x" + LS));
        assertFalse(out.contains("Reading symbol: 3"));
        assertTrue(out.endsWith("Final automaton state: q3 (rejecting)" + LS
            + "State change path: q0→q0→q3" + LS));
    }

    @Test
    public void testRunAllUsesFreshAutomatonPerToken() {
        List<TokenResult> results = new AutomatonRunner(Preset.TEN_STATE.table(), reporter)
            .runAll(List.of("000", "1", "x"));

        assertEquals(3, results.size());
        assertTrue(results.get(0).isAccepting());
        assertEquals(9, results.get(0).getFinalState());
        assertEquals("q0→q1→q5→q9", results.get(0).getPath().toString());

        assertFalse(results.get(1).isAccepting());
        assertEquals(2, results.get(1).getFinalState());

        assertTrue(results.get(2).isAborted());
        assertEquals(0, results.get(2).getFinalState());
        assertEquals(Path.of(0), results.get(2).getPath());

        assertTrue(output().contains(LS + "Reading token: 000" + LS));
        assertTrue(output().contains(LS + "Reading token: x" + LS));
    }
}
