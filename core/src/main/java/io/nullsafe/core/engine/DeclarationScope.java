package io.nullsafe.core.engine;

import io.nullsafe.core.model.Feature;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * What the driver knows about the declaration it is currently inside: its fully-qualified path,
 * the features enabled for it, and whether it is visible outside its unit.
 *
 * <p>
 * Features are inherited: a declaration has every feature of its enclosing declaration plus the
 * ones activations enable for its own path. Immutable.
 */
final class DeclarationScope {

    private final String path;
    private final Set<Feature> features;
    private final boolean exposed;

    private DeclarationScope(String path, Set<Feature> features, boolean exposed) {
        this.path = path;
        this.features = Collections.unmodifiableSet(features);
        this.exposed = exposed;
    }

    static DeclarationScope forPackage(String packagePath, Set<Feature> features) {
        return new DeclarationScope(packagePath, copy(features), true);
    }

    /**
     * Scope of a declaration nested in this one.
     *
     * @param name        the declaration's simple name
     * @param ownFeatures features enabled for the nested declaration's own path
     * @param isPublic    whether the declaration itself is declared public
     */
    DeclarationScope child(String name, Set<Feature> ownFeatures, boolean isPublic) {
        Set<Feature> merged = copy(features);
        merged.addAll(ownFeatures);
        return new DeclarationScope(SyntaxNodes.qualify(path, name), merged, exposed && isPublic);
    }

    /** Scope for code nested in a function body: same path and features, never exposed. */
    DeclarationScope local() {
        return exposed ? new DeclarationScope(path, copy(features), false) : this;
    }

    String path() {
        return path;
    }

    boolean isEnabled(Feature feature) {
        return features.contains(feature);
    }

    boolean isExposed() {
        return exposed;
    }

    private static Set<Feature> copy(Set<Feature> features) {
        return features.isEmpty() ? EnumSet.noneOf(Feature.class) : EnumSet.copyOf(features);
    }
}
