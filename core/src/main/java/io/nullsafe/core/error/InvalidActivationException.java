package io.nullsafe.core.error;

/** Thrown when an activation path is not a valid dot path. */
public final class InvalidActivationException extends ScopeConfigurationException {

    private static final long serialVersionUID = 1L;

    public InvalidActivationException(String message, String path) {
        super(message, null, path);
    }
}
