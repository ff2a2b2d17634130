package io.nullsafe.core.scope;

import io.nullsafe.core.error.InvalidActivationException;
import io.nullsafe.core.model.Feature;
import io.nullsafe.core.model.ScopeActivation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable set of {@link ScopeActivation}s, written once at configuration time and only read
 * while units are rewritten.
 *
 * <p>
 * Activations are indexed by feature; within a feature they keep registration order.
 * Registering the same activation twice keeps one copy.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class ActivationSet {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private final List<ScopeActivation> all;
    private final Map<Feature, List<ScopeActivation>> byFeature;

    private ActivationSet(Set<ScopeActivation> activations) {
        this.all = List.copyOf(activations);
        Map<Feature, List<ScopeActivation>> index = new EnumMap<>(Feature.class);
        for (Feature feature : Feature.values()) {
            List<ScopeActivation> forFeature = new ArrayList<>();
            for (ScopeActivation activation : activations) {
                if (activation.feature() == feature) {
                    forFeature.add(activation);
                }
            }
            index.put(feature, Collections.unmodifiableList(forFeature));
        }
        this.byFeature = Collections.unmodifiableMap(index);
    }

    /** An empty set: every feature is disabled everywhere. */
    public static ActivationSet empty() {
        return new ActivationSet(Set.of());
    }

    /** Creates a set from already-constructed activations, validating each path. */
    public static ActivationSet of(List<ScopeActivation> activations) {
        Builder builder = builder();
        activations.forEach(builder::add);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** All activations, in registration order. */
    public List<ScopeActivation> all() {
        return all;
    }

    /** Activations for one feature, in registration order. */
    public List<ScopeActivation> forFeature(Feature feature) {
        return byFeature.get(feature);
    }

    public int size() {
        return all.size();
    }

    public boolean isEmpty() {
        return all.isEmpty();
    }

    /**
     * Validates a dot path: {@code ""} (root) or identifier segments separated by single dots.
     *
     * @throws InvalidActivationException if the path is malformed
     */
    static String validatePath(String path) {
        if (path == null) {
            throw new InvalidActivationException("Activation path must not be null", null);
        }
        String trimmed = path.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        for (String segment : trimmed.split("\\.", -1)) {
            if (!SEGMENT.matcher(segment).matches()) {
                throw new InvalidActivationException(
                        "Invalid activation path '" + path + "': segment '" + segment + "' is not an identifier", path);
            }
        }
        return trimmed;
    }

    /**
     * Builder for an {@link ActivationSet}. Not thread-safe; the built set is.
     */
    public static final class Builder {

        private final Set<ScopeActivation> activations = new LinkedHashSet<>();

        Builder() {}

        /**
         * Enables {@code feature} for {@code path}, and for its descendants if {@code recursive}.
         *
         * @throws InvalidActivationException if {@code path} is malformed
         */
        public Builder activate(String path, boolean recursive, Feature feature) {
            activations.add(new ScopeActivation(validatePath(path), recursive, feature));
            return this;
        }

        /** Enables every feature for {@code path}. */
        public Builder activateAll(String path, boolean recursive) {
            for (Feature feature : Feature.values()) {
                activate(path, recursive, feature);
            }
            return this;
        }

        public Builder add(ScopeActivation activation) {
            return activate(activation.path(), activation.recursive(), activation.feature());
        }

        public ActivationSet build() {
            return new ActivationSet(activations);
        }
    }
}
