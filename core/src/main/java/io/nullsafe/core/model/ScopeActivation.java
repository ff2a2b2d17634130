package io.nullsafe.core.model;

import java.util.Objects;

/**
 * One registration enabling a feature for a dot path and, if {@code recursive}, for everything
 * beneath it.
 *
 * <p>
 * Immutable, thread-safe: created at configuration time.
 *
 * @param path      dot path of a package, type or function ({@code ""} for the root package)
 * @param recursive whether descendants of {@code path} are covered too
 * @param feature   the enabled feature
 */
public record ScopeActivation(String path, boolean recursive, Feature feature) {

    /** Canonical constructor: validates required fields. */
    public ScopeActivation {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(feature, "feature must not be null");
    }

    @Override
    public String toString() {
        return feature.key() + "@" + (path.isEmpty() ? "<root>" : path) + (recursive ? " (recursive)" : "");
    }
}
