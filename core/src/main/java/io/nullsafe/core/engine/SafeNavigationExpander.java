package io.nullsafe.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nullsafe.core.error.MalformedTreeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands a safe-navigation access ({@code target?.name} or {@code target?.name(args)}) into
 *
 * <pre>
 * Let $navN = target in ($navN == null ? null : $navN.name)
 * </pre>
 *
 * <p>
 * The receiver is evaluated once into the temporary; on null neither the access nor a call's
 * arguments are evaluated. The original access node is reused as the non-null branch with its
 * target replaced by the temporary, so only the wrapper nodes are new.
 *
 * <p>
 * Callers expand children first. For {@code a?.b?.c} the inner access is already a {@code Let}
 * by the time the outer one is expanded, so a null at any link propagates through all later
 * links.
 *
 * <p>
 * Thread-safe: stateless.
 */
final class SafeNavigationExpander {

    private static final Logger LOG = LoggerFactory.getLogger(SafeNavigationExpander.class);

    /**
     * Expands one safe access node.
     *
     * @param access a {@code Member} or {@code Call} node with {@code safe: true}
     * @param scope  the enclosing declaration
     * @param ctx    the unit's rewrite context
     * @return the replacement {@code Let} node
     */
    ObjectNode expand(ObjectNode access, DeclarationScope scope, RewriteContext ctx) {
        JsonNode target = access.get(SyntaxNodes.TARGET);
        if (target == null || !target.isObject()) {
            throw new MalformedTreeException(
                    "Safe " + SyntaxNodes.kind(access) + " '" + SyntaxNodes.text(access, SyntaxNodes.NAME_FIELD)
                            + "' has no target",
                    ctx.unitName(),
                    scope.path());
        }

        String temp = ctx.newTemporary();
        access.set(SyntaxNodes.TARGET, SyntaxNodes.name(temp));
        access.remove(SyntaxNodes.SAFE);

        ObjectNode resultType = SyntaxNodes.asNullable(access.get(SyntaxNodes.TYPE_FIELD));
        ObjectNode whenNull = SyntaxNodes.nullLiteral();
        if (resultType != null) {
            whenNull.set(SyntaxNodes.TYPE_FIELD, resultType);
        }

        ObjectNode test = SyntaxNodes.binary("==", SyntaxNodes.name(temp), SyntaxNodes.nullLiteral());
        ObjectNode let = SyntaxNodes.let(temp, target, SyntaxNodes.conditional(test, whenNull, access));
        if (resultType != null) {
            let.set(SyntaxNodes.TYPE_FIELD, resultType.deepCopy());
        }

        ctx.countNavigation();
        LOG.debug("Expanded safe {} '{}' in {} (temporary {})",
                SyntaxNodes.kind(access), SyntaxNodes.text(access, SyntaxNodes.NAME_FIELD), scope.path(), temp);
        return let;
    }
}
