package io.nullsafe.core.scope;

import io.nullsafe.core.model.Feature;
import io.nullsafe.core.model.ScopeActivation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a declaration path falls inside an activated scope for a feature.
 *
 * <p>
 * An activation matches a path when its own path is equal to it, or when the activation is
 * recursive and its path is a segment-wise prefix of it ({@code app} covers {@code app.util.job}
 * but not {@code application}). The root path {@code ""} prefixes every path. Any matching
 * activation enables the feature; there is no way to disable one.
 *
 * <p>
 * Thread-safe and stateless beyond the immutable {@link ActivationSet}.
 */
public final class ScopeResolver {

    private final ActivationSet activations;

    public ScopeResolver(ActivationSet activations) {
        this.activations = Objects.requireNonNull(activations, "activations must not be null");
    }

    public ActivationSet activations() {
        return activations;
    }

    /**
     * Returns true if some activation of {@code feature} matches {@code path}.
     *
     * @param path    fully-qualified dot path of a package, type or function
     * @param feature the requested feature
     */
    public boolean isEnabled(String path, Feature feature) {
        for (ScopeActivation activation : activations.forFeature(feature)) {
            if (matches(activation, path)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns every activation of {@code feature} that matches {@code path}, in registration
     * order. Empty if the feature is disabled there.
     */
    public List<ScopeActivation> matching(String path, Feature feature) {
        List<ScopeActivation> result = new ArrayList<>();
        for (ScopeActivation activation : activations.forFeature(feature)) {
            if (matches(activation, path)) {
                result.add(activation);
            }
        }
        return result;
    }

    static boolean matches(ScopeActivation activation, String path) {
        String scope = activation.path();
        if (scope.equals(path)) {
            return true;
        }
        if (!activation.recursive()) {
            return false;
        }
        return isPrefix(scope, path);
    }

    /** Segment-wise prefix test: {@code "a.b"} prefixes {@code "a.b.c"} but not {@code "a.bc"}. */
    static boolean isPrefix(String prefix, String path) {
        if (prefix.isEmpty()) {
            return true;
        }
        return path.length() > prefix.length() && path.startsWith(prefix) && path.charAt(prefix.length()) == '.';
    }
}
