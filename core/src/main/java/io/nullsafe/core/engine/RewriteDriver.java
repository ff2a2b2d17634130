package io.nullsafe.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nullsafe.core.error.FeatureNotEnabledException;
import io.nullsafe.core.error.MalformedTreeException;
import io.nullsafe.core.model.Feature;
import io.nullsafe.core.model.RewriteResult;
import io.nullsafe.core.model.ScopeActivation;
import io.nullsafe.core.scope.ScopeResolver;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites one compilation unit in a single post-order pass.
 *
 * <p>
 * The driver tracks the declaration chain (package, types, function or field), asks the
 * {@link ScopeResolver} once per declaration which features apply, and hands matching nodes to
 * the {@link SafeNavigationExpander}, {@link ApiGuardInjector} and {@link SequenceWrapper}.
 * Children are rewritten before their parent; a replaced node is never visited again. Everything
 * else in the tree keeps its identity and field order.
 *
 * <p>
 * Thread-safe: holds no per-unit state. Two threads must not rewrite the same tree at once.
 */
public final class RewriteDriver {

    private static final Logger LOG = LoggerFactory.getLogger(RewriteDriver.class);

    private final ScopeResolver resolver;
    private final Consumer<ScopeActivation> matchListener;
    private final SafeNavigationExpander navigationExpander = new SafeNavigationExpander();
    private final ApiGuardInjector guardInjector = new ApiGuardInjector();
    private final SequenceWrapper sequenceWrapper = new SequenceWrapper();

    public RewriteDriver(ScopeResolver resolver) {
        this(resolver, activation -> {});
    }

    /**
     * @param resolver      scope resolver over the build's activations
     * @param matchListener told about every activation that enables a feature for a declaration
     */
    public RewriteDriver(ScopeResolver resolver, Consumer<ScopeActivation> matchListener) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.matchListener = Objects.requireNonNull(matchListener, "matchListener must not be null");
    }

    /**
     * Rewrites {@code unit} in place.
     *
     * @param unit a {@code Unit} node
     * @return counts of what was rewritten
     * @throws FeatureNotEnabledException if a safe-navigation marker appears where navigation is
     *                                    not enabled
     * @throws MalformedTreeException     if the tree breaks the node format
     */
    public RewriteResult rewrite(ObjectNode unit) {
        String unitName = unitName(unit);
        if (!SyntaxNodes.isKind(unit, SyntaxNodes.UNIT)) {
            throw new MalformedTreeException(
                    "Expected a Unit node but found '" + SyntaxNodes.kind(unit) + "'", unitName, null);
        }
        String packagePath = unit.path(SyntaxNodes.PACKAGE).asText("");
        RewriteContext ctx = new RewriteContext(unitName);
        DeclarationScope packageScope = DeclarationScope.forPackage(packagePath, featuresFor(packagePath));

        JsonNode declarations = unit.get(SyntaxNodes.DECLARATIONS);
        if (declarations != null) {
            if (!declarations.isArray()) {
                throw new MalformedTreeException("'declarations' must be an array", unitName, null);
            }
            visitDeclarations((ArrayNode) declarations, packageScope, ctx);
        }

        LOG.debug("Rewrote unit {}: {} navigation(s), {} guard(s), {} sequence(s)",
                unitName, ctx.navigations(), ctx.guards(), ctx.sequences());
        return new RewriteResult(unitName, unit, ctx.navigations(), ctx.guards(), ctx.sequences());
    }

    /** {@code Unit.name}, else the package, else {@code "<unit>"}. */
    static String unitName(JsonNode unit) {
        String name = SyntaxNodes.text(unit, SyntaxNodes.NAME_FIELD);
        if (name != null && !name.isEmpty()) {
            return name;
        }
        String packagePath = SyntaxNodes.text(unit, SyntaxNodes.PACKAGE);
        return packagePath != null && !packagePath.isEmpty() ? packagePath : "<unit>";
    }

    // --- Declarations ---

    private void visitDeclarations(ArrayNode declarations, DeclarationScope parent, RewriteContext ctx) {
        for (int i = 0; i < declarations.size(); i++) {
            JsonNode declaration = declarations.get(i);
            if (SyntaxNodes.kind(declaration) == null) {
                throw new MalformedTreeException(
                        "Declaration " + i + " has no kind", ctx.unitName(), parent.path());
            }
            JsonNode replacement = visitDeclaration((ObjectNode) declaration, parent, ctx);
            if (replacement != declaration) {
                declarations.set(i, replacement);
            }
        }
    }

    /** Visits a declaration; returns the node to keep in its slot (only differs for wrapped expressions). */
    private JsonNode visitDeclaration(ObjectNode declaration, DeclarationScope parent, RewriteContext ctx) {
        String kind = SyntaxNodes.kind(declaration);
        switch (kind) {
            case SyntaxNodes.TYPE -> {
                DeclarationScope scope = enter(declaration, parent, ctx);
                JsonNode members = declaration.get(SyntaxNodes.MEMBERS);
                if (members != null && members.isArray()) {
                    visitDeclarations((ArrayNode) members, scope, ctx);
                }
                return declaration;
            }
            case SyntaxNodes.FUNCTION -> {
                DeclarationScope scope = enter(declaration, parent, ctx);
                rewriteChildren(declaration, scope.local(), ctx);
                if (scope.isEnabled(Feature.API_GUARD) && scope.isExposed()) {
                    ctx.countGuards(guardInjector.inject(declaration, scope, ctx));
                }
                return declaration;
            }
            case SyntaxNodes.VAR -> {
                DeclarationScope scope = enter(declaration, parent, ctx);
                rewriteChildren(declaration, scope.local(), ctx);
                return declaration;
            }
            default -> {
                return rewrite(declaration, parent, ctx);
            }
        }
    }

    private DeclarationScope enter(ObjectNode declaration, DeclarationScope parent, RewriteContext ctx) {
        String name = SyntaxNodes.text(declaration, SyntaxNodes.NAME_FIELD);
        if (name == null || name.isEmpty()) {
            throw new MalformedTreeException(
                    SyntaxNodes.kind(declaration) + " declaration without a name", ctx.unitName(), parent.path());
        }
        String path = SyntaxNodes.qualify(parent.path(), name);
        boolean isPublic = SyntaxNodes.PUBLIC.equals(SyntaxNodes.text(declaration, SyntaxNodes.VISIBILITY));
        return parent.child(name, featuresFor(path), isPublic);
    }

    private Set<Feature> featuresFor(String path) {
        Set<Feature> features = EnumSet.noneOf(Feature.class);
        for (Feature feature : Feature.values()) {
            List<ScopeActivation> matches = resolver.matching(path, feature);
            if (!matches.isEmpty()) {
                features.add(feature);
                matches.forEach(matchListener);
            }
        }
        return features;
    }

    // --- Expressions and statements ---

    /**
     * Rewrites {@code node} and its subtree.
     *
     * @return the node to put in {@code node}'s slot: {@code node} itself, or its replacement
     */
    private JsonNode rewrite(JsonNode node, DeclarationScope scope, RewriteContext ctx) {
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                JsonNode child = array.get(i);
                JsonNode replacement = rewrite(child, scope, ctx);
                if (replacement != child) {
                    array.set(i, replacement);
                }
            }
            return node;
        }
        if (!node.isObject()) {
            return node;
        }

        ObjectNode object = (ObjectNode) node;
        String kind = SyntaxNodes.kind(object);
        if (SyntaxNodes.TYPE.equals(kind) || SyntaxNodes.FUNCTION.equals(kind)) {
            // Local declaration inside a body: inherits the path of its enclosing declaration.
            visitDeclaration(object, scope.local(), ctx);
            return object;
        }
        if (SequenceWrapper.isWrapper(object)) {
            for (JsonNode literal : object.path(SyntaxNodes.ARGS)) {
                if (literal.isObject()) {
                    rewriteChildren((ObjectNode) literal, scope, ctx);
                }
            }
            return object;
        }

        rewriteChildren(object, scope, ctx);

        if (SyntaxNodes.isSafeAccess(object)) {
            if (!scope.isEnabled(Feature.NAVIGATION)) {
                throw new FeatureNotEnabledException(
                        "Safe navigation '?." + SyntaxNodes.text(object, SyntaxNodes.NAME_FIELD) + "' used in "
                                + scope.path() + " but navigation is not enabled for that path",
                        ctx.unitName(),
                        scope.path(),
                        Feature.NAVIGATION);
            }
            return navigationExpander.expand(object, scope, ctx);
        }
        if (SyntaxNodes.SEQ.equals(kind) && scope.isEnabled(Feature.SEQUENCE_WRAP)) {
            return sequenceWrapper.wrap(object, scope, ctx);
        }
        return object;
    }

    private void rewriteChildren(ObjectNode object, DeclarationScope scope, RewriteContext ctx) {
        List<String> fields = new ArrayList<>();
        object.fieldNames().forEachRemaining(fields::add);
        for (String field : fields) {
            if (SyntaxNodes.TYPE_FIELD.equals(field) || SyntaxNodes.ELEMENT_TYPE.equals(field)) {
                continue;
            }
            JsonNode child = object.get(field);
            if (!child.isContainerNode()) {
                continue;
            }
            JsonNode replacement = rewrite(child, scope, ctx);
            if (replacement != child) {
                object.set(field, replacement);
            }
        }
    }
}
