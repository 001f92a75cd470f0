package gr.imsi.athenarc.automaton;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.automaton.io.ConsoleReporter;
import gr.imsi.athenarc.automaton.nfa.Automaton;
import gr.imsi.athenarc.automaton.nfa.TransitionTable;
import gr.imsi.athenarc.automaton.symbol.Symbol;
import gr.imsi.athenarc.automaton.symbol.SymbolNotAcceptedException;

/**
 * Runs a fresh automaton over each token, one token after the other.
 */
public class AutomatonRunner {

    private static final Logger LOG = LoggerFactory.getLogger(AutomatonRunner.class);

    private final TransitionTable table;
    private final ConsoleReporter reporter;

    public AutomatonRunner(TransitionTable table, ConsoleReporter reporter) {
        this.table = table;
        this.reporter = reporter;
    }

    public List<TokenResult> runAll(List<String> tokens) {
        List<TokenResult> results = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            reporter.tokenRead(token);
            results.add(run(token));
        }
        return results;
    }

    /**
     * Feeds the characters of a token to a new automaton, left to right.
     * A character outside the alphabet stops the token; the automaton is
     * still closed with the state it reached.
     */
    public TokenResult run(String token) {
        try (Automaton automaton = new Automaton(table, reporter)) {
            Character rejected = null;
            try {
                for (char character : token.toCharArray()) {
                    automaton.consume(Symbol.of(character));
                }
            } catch (SymbolNotAcceptedException e) {
                LOG.debug("Token '{}' aborted at character '{}'", token, e.getSymbol());
                reporter.message(e.getMessage());
                rejected = e.getSymbol();
            }
            int finalState = automaton.finalState();
            return new TokenResult(token, finalState, table.isAccepting(finalState),
                automaton.finalPath(), automaton.isOnHold(), rejected);
        }
    }
}
