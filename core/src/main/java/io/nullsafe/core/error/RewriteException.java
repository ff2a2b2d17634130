package io.nullsafe.core.error;

/**
 * Abstract base for all rewrite engine exceptions. Never thrown directly: use the concrete
 * subclasses under {@link ScopeConfigurationException} or {@link TreeRewriteException}.
 */
public abstract class RewriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        CONFIGURATION,
        REWRITE
    }

    private final String unit;
    private final Phase phase;

    protected RewriteException(String message, String unit, Phase phase) {
        super(message);
        this.unit = unit;
        this.phase = phase;
    }

    protected RewriteException(String message, Throwable cause, String unit, Phase phase) {
        super(message, cause);
        this.unit = unit;
        this.phase = phase;
    }

    /** The compilation unit being rewritten, or {@code null} if not tied to one. */
    public String unit() {
        return unit;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
