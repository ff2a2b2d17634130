package io.nullsafe.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Node kinds, field names and the fixed templates the rewrites build.
 *
 * <p>
 * A syntax tree is a JSON object tree; every node has a {@code kind}. Templates are the only
 * nodes the engine creates from scratch and all of them carry {@code "synthetic": true}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class SyntaxNodes {

    // --- Kinds ---
    public static final String UNIT = "Unit";
    public static final String TYPE = "Type";
    public static final String FUNCTION = "Function";
    public static final String VAR = "Var";
    public static final String BLOCK = "Block";
    public static final String EXPR = "Expr";
    public static final String NAME = "Name";
    public static final String LITERAL = "Literal";
    public static final String NULL = "Null";
    public static final String MEMBER = "Member";
    public static final String CALL = "Call";
    public static final String BINARY = "Binary";
    public static final String CONDITIONAL = "Conditional";
    public static final String SEQ = "Seq";
    public static final String LET = "Let";

    // --- Fields ---
    public static final String KIND = "kind";
    public static final String NAME_FIELD = "name";
    public static final String PACKAGE = "package";
    public static final String DECLARATIONS = "declarations";
    public static final String MEMBERS = "members";
    public static final String VISIBILITY = "visibility";
    public static final String PARAMS = "params";
    public static final String BODY = "body";
    public static final String STATEMENTS = "statements";
    public static final String LINE = "line";
    public static final String TARGET = "target";
    public static final String ARGS = "args";
    public static final String SAFE = "safe";
    public static final String TYPE_FIELD = "type";
    public static final String NULLABLE = "nullable";
    public static final String ELEMENT_TYPE = "elementType";
    public static final String SYNTHETIC = "synthetic";

    public static final String PUBLIC = "public";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SyntaxNodes() {}

    /** The node's kind, or null if it is not an object or has no kind. */
    public static String kind(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode kind = node.get(KIND);
        return kind != null && kind.isTextual() ? kind.asText() : null;
    }

    public static boolean isKind(JsonNode node, String kind) {
        return kind.equals(kind(node));
    }

    /** True for a {@code Member} or {@code Call} carrying the safe-navigation marker. */
    public static boolean isSafeAccess(JsonNode node) {
        String kind = kind(node);
        return (MEMBER.equals(kind) || CALL.equals(kind)) && node.path(SAFE).asBoolean(false);
    }

    public static boolean isSynthetic(JsonNode node) {
        return node != null && node.path(SYNTHETIC).asBoolean(false);
    }

    /** Text of a field, or null when absent or not textual. */
    public static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    /**
     * Whether a type descriptor declares a nullable type. A missing descriptor is reported as
     * {@code null}: the type is not declared.
     */
    public static Boolean declaredNullable(JsonNode type) {
        if (type == null || !type.isObject()) {
            return null;
        }
        return type.path(NULLABLE).asBoolean(false);
    }

    /** Dot-joins a parent path and a name; the root path contributes nothing. */
    public static String qualify(String parent, String name) {
        return parent.isEmpty() ? name : parent + "." + name;
    }

    // --- Templates ---

    public static ObjectNode name(String name) {
        return node(NAME).put(NAME_FIELD, name);
    }

    public static ObjectNode literal(String value) {
        return node(LITERAL).put("value", value);
    }

    public static ObjectNode nullLiteral() {
        return node(NULL);
    }

    public static ObjectNode binary(String op, JsonNode left, JsonNode right) {
        ObjectNode node = node(BINARY).put("op", op);
        node.set("left", left);
        node.set("right", right);
        return node;
    }

    public static ObjectNode conditional(JsonNode test, JsonNode then, JsonNode otherwise) {
        ObjectNode node = node(CONDITIONAL);
        node.set("test", test);
        node.set("then", then);
        node.set("else", otherwise);
        return node;
    }

    public static ObjectNode let(String name, JsonNode init, JsonNode body) {
        ObjectNode node = node(LET).put(NAME_FIELD, name);
        node.set("init", init);
        node.set(BODY, body);
        return node;
    }

    /** A call to a qualified static function (no receiver). */
    public static ObjectNode staticCall(String qualifiedName, JsonNode... args) {
        ObjectNode node = node(CALL).put(NAME_FIELD, qualifiedName);
        ArrayNode array = node.putArray(ARGS);
        for (JsonNode arg : args) {
            array.add(arg);
        }
        return node;
    }

    public static ObjectNode exprStatement(JsonNode expr) {
        ObjectNode node = node(EXPR);
        node.set("expr", expr);
        return node;
    }

    /** Copy of a type descriptor with {@code nullable} forced to true, or null if none given. */
    public static ObjectNode asNullable(JsonNode type) {
        if (type == null || !type.isObject()) {
            return null;
        }
        ObjectNode copy = ((ObjectNode) type).deepCopy();
        copy.put(NULLABLE, true);
        return copy;
    }

    static ObjectNode typeRef(String name, boolean nullable) {
        return NODES.objectNode().put(NAME_FIELD, name).put(NULLABLE, nullable);
    }

    private static ObjectNode node(String kind) {
        return NODES.objectNode().put(KIND, kind).put(SYNTHETIC, true);
    }
}
