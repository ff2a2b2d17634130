package io.nullsafe.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nullsafe.core.error.RewriteException;
import java.util.Objects;

/**
 * A unit whose rewrite stopped with an error. Several units may share a name (units without
 * {@code Unit.name} are named after their package), so the tree itself identifies the unit.
 *
 * @param unitName name of the unit, as in {@link RewriteResult#unitName()}
 * @param unit     the unit tree; may be partly rewritten
 * @param error    the error that stopped the rewrite
 */
public record UnitFailure(String unitName, ObjectNode unit, RewriteException error) {

    public UnitFailure {
        Objects.requireNonNull(unitName, "unitName must not be null");
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(error, "error must not be null");
    }
}
