package io.nullsafe.core.error;

/**
 * Abstract parent for configuration errors: an activation that cannot be registered, or a
 * compilation unit that uses a feature its path never enabled. Reported per unit; does not abort
 * the rewrite of unrelated units. Carries the dot path the error is about.
 */
public abstract class ScopeConfigurationException extends RewriteException {

    private static final long serialVersionUID = 1L;

    private final String path;

    protected ScopeConfigurationException(String message, String unit, String path) {
        super(message, unit, Phase.CONFIGURATION);
        this.path = path;
    }

    /** The activation or declaration path involved. */
    public String path() {
        return path;
    }
}
