package io.nullsafe.cli.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, an activation that cannot
 * be registered, or an unreadable unit file. Provides a descriptive message suitable for build
 * error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
