package gr.imsi.athenarc.automaton;

import org.jetbrains.annotations.Nullable;

import gr.imsi.athenarc.automaton.nfa.Path;

/**
 * Outcome of running the automaton over one token.
 */
public class TokenResult {
    private final String token;
    private final int finalState;
    private final boolean accepting;
    private final Path path;
    private final boolean onHold;
    @Nullable
    private final Character rejectedSymbol;

    public TokenResult(String token, int finalState, boolean accepting, Path path, boolean onHold, @Nullable Character rejectedSymbol) {
        this.token = token;
        this.finalState = finalState;
        this.accepting = accepting;
        this.path = path;
        this.onHold = onHold;
        this.rejectedSymbol = rejectedSymbol;
    }

    public String getToken() {
        return token;
    }

    public int getFinalState() {
        return finalState;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public Path getPath() {
        return path;
    }

    public boolean isOnHold() {
        return onHold;
    }

    /** True if the token contained a character outside the alphabet. */
    public boolean isAborted() {
        return rejectedSymbol != null;
    }

    @Nullable
    public Character getRejectedSymbol() {
        return rejectedSymbol;
    }

    @Override
    public String toString() {
        return "TokenResult{token='" + token + "', finalState=q" + finalState
            + ", accepting=" + accepting + ", path=" + path
            + (rejectedSymbol != null ? ", rejectedSymbol=" + rejectedSymbol : "") + "}";
    }
}
