package io.nullsafe.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nullsafe.core.error.MalformedTreeException;
import io.nullsafe.runtime.Guards;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inserts boundary guards at the start of an exposed function's body, one per parameter whose
 * declared type is non-nullable, in parameter order. Each guard is a statement
 *
 * <pre>
 * io.nullsafe.runtime.Guards.checkArgument(p, "p", "&lt;function path&gt;", "&lt;unit&gt;:&lt;line&gt;")
 * </pre>
 *
 * <p>
 * Parameters without a declared type are not guarded. A function with nothing to guard, or
 * without a body, is left untouched. A guard already present for a parameter (from an earlier
 * pass over the same tree) is not inserted twice.
 *
 * <p>
 * Thread-safe: stateless.
 */
final class ApiGuardInjector {

    private static final Logger LOG = LoggerFactory.getLogger(ApiGuardInjector.class);

    /**
     * Guards one function.
     *
     * @param function a {@code Function} node
     * @param scope    the function's own scope
     * @param ctx      the unit's rewrite context
     * @return number of guards inserted
     */
    int inject(ObjectNode function, DeclarationScope scope, RewriteContext ctx) {
        JsonNode body = function.get(SyntaxNodes.BODY);
        if (body == null || !body.isObject()) {
            return 0;
        }
        JsonNode statementsNode = body.get(SyntaxNodes.STATEMENTS);
        ArrayNode statements = statementsNode != null && statementsNode.isArray() ? (ArrayNode) statementsNode : null;

        Set<String> alreadyGuarded = statements == null ? Set.of() : existingGuards(statements);
        String location = location(function, ctx);
        List<ObjectNode> guards = new ArrayList<>();
        for (JsonNode param : function.path(SyntaxNodes.PARAMS)) {
            String name = SyntaxNodes.text(param, SyntaxNodes.NAME_FIELD);
            if (name == null) {
                throw new MalformedTreeException("Parameter without a name", ctx.unitName(), scope.path());
            }
            Boolean nullable = SyntaxNodes.declaredNullable(param.get(SyntaxNodes.TYPE_FIELD));
            if (nullable == null || nullable || alreadyGuarded.contains(name)) {
                continue;
            }
            guards.add(guard(name, scope.path(), location));
        }
        if (guards.isEmpty()) {
            return 0;
        }
        if (statements == null) {
            throw new MalformedTreeException(
                    "Function body has no 'statements' array", ctx.unitName(), scope.path());
        }

        for (int i = 0; i < guards.size(); i++) {
            statements.insert(i, guards.get(i));
        }
        LOG.debug("Inserted {} boundary guard(s) into {}", guards.size(), scope.path());
        return guards.size();
    }

    private static ObjectNode guard(String parameter, String function, String location) {
        ObjectNode call = SyntaxNodes.staticCall(
                Guards.CHECK_ARGUMENT,
                SyntaxNodes.name(parameter),
                SyntaxNodes.literal(parameter),
                SyntaxNodes.literal(function),
                SyntaxNodes.literal(location));
        return SyntaxNodes.exprStatement(call);
    }

    /** Parameter names named by synthetic guard statements at the head of the body. */
    private static Set<String> existingGuards(ArrayNode statements) {
        Set<String> guarded = new HashSet<>();
        for (JsonNode statement : statements) {
            JsonNode expr = statement.path("expr");
            if (!SyntaxNodes.isSynthetic(statement)
                    || !Guards.CHECK_ARGUMENT.equals(SyntaxNodes.text(expr, SyntaxNodes.NAME_FIELD))) {
                break;
            }
            guarded.add(expr.path(SyntaxNodes.ARGS).path(1).path("value").asText());
        }
        return guarded;
    }

    private static String location(ObjectNode function, RewriteContext ctx) {
        JsonNode line = function.get(SyntaxNodes.LINE);
        return line != null && line.canConvertToInt() ? ctx.unitName() + ":" + line.asInt() : ctx.unitName();
    }
}
