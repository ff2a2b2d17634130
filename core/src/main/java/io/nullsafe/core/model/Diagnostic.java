package io.nullsafe.core.model;

import java.util.Objects;

/**
 * A build-time warning that does not stop the build.
 *
 * @param message    human-readable description
 * @param activation the activation the message is about, or null
 */
public record Diagnostic(String message, ScopeActivation activation) {

    public Diagnostic {
        Objects.requireNonNull(message, "message must not be null");
    }
}
