package io.nullsafe.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nullsafe.runtime.SafeSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a sequence literal in a call to {@link SafeSequence#copyOf(java.util.List)}, so the value it
 * constructs answers out-of-range reads with an absent value instead of failing or returning
 * null. The literal itself, and therefore element order and count, is kept as the call's only
 * argument.
 *
 * <p>
 * Thread-safe: stateless.
 */
final class SequenceWrapper {

    private static final Logger LOG = LoggerFactory.getLogger(SequenceWrapper.class);

    static final String SAFE_SEQUENCE_TYPE = SafeSequence.class.getName();

    /** True for a call this wrapper produced (its literal must not be wrapped again). */
    static boolean isWrapper(JsonNode node) {
        return SyntaxNodes.isKind(node, SyntaxNodes.CALL)
                && SyntaxNodes.isSynthetic(node)
                && SafeSequence.FACTORY.equals(SyntaxNodes.text(node, SyntaxNodes.NAME_FIELD));
    }

    ObjectNode wrap(ObjectNode literal, DeclarationScope scope, RewriteContext ctx) {
        ObjectNode call = SyntaxNodes.staticCall(SafeSequence.FACTORY, literal);
        ObjectNode type = SyntaxNodes.typeRef(SAFE_SEQUENCE_TYPE, false);
        JsonNode elementType = literal.get(SyntaxNodes.ELEMENT_TYPE);
        if (elementType != null && elementType.isObject()) {
            type.putArray("params").add(elementType.deepCopy());
        }
        call.set(SyntaxNodes.TYPE_FIELD, type);

        ctx.countSequence();
        LOG.debug("Wrapped sequence literal of {} element(s) in {}",
                literal.path("elements").size(), scope.path());
        return call;
    }
}
