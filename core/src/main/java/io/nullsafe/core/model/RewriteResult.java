package io.nullsafe.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Outcome of rewriting one compilation unit.
 *
 * @param unitName    name of the unit ({@code Unit.name}, or its package if unnamed)
 * @param unit        the unit tree, mutated in place
 * @param navigations number of safe-navigation markers expanded
 * @param guards      number of boundary guards inserted
 * @param sequences   number of sequence literals wrapped
 */
public record RewriteResult(String unitName, ObjectNode unit, int navigations, int guards, int sequences) {

    public RewriteResult {
        Objects.requireNonNull(unitName, "unitName must not be null");
        Objects.requireNonNull(unit, "unit must not be null");
    }

    /** Returns true if the rewrite left the tree untouched. */
    public boolean isUnchanged() {
        return navigations == 0 && guards == 0 && sequences == 0;
    }

    /** Total number of rewrites applied. */
    public int total() {
        return navigations + guards + sequences;
    }
}
