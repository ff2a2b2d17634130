package io.nullsafe.core.error;

import io.nullsafe.core.model.Feature;

/**
 * Thrown when a compilation unit uses syntax that only a feature can rewrite (a safe-navigation
 * marker) inside a declaration for which no activation enables that feature.
 */
public final class FeatureNotEnabledException extends ScopeConfigurationException {

    private static final long serialVersionUID = 1L;

    private final Feature feature;

    public FeatureNotEnabledException(String message, String unit, String path, Feature feature) {
        super(message, unit, path);
        this.feature = feature;
    }

    /** The feature that would have been needed. */
    public Feature feature() {
        return feature;
    }
}
