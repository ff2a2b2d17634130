package io.nullsafe.core.error;

/**
 * Abstract parent for errors raised while walking a syntax tree. These indicate a tree that breaks
 * the host parser's own invariants, not a condition the engine tolerates. Carries the path of the
 * declaration being rewritten.
 */
public abstract class TreeRewriteException extends RewriteException {

    private static final long serialVersionUID = 1L;

    private final String declaration;

    protected TreeRewriteException(String message, String unit, String declaration) {
        super(message, unit, Phase.REWRITE);
        this.declaration = declaration;
    }

    /** Fully-qualified path of the enclosing declaration, or {@code null} at unit level. */
    public String declaration() {
        return declaration;
    }
}
