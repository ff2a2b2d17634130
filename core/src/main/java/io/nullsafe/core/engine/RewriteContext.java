package io.nullsafe.core.engine;

/**
 * Mutable per-unit state of one driver pass: the unit's name, the temporary counter that keeps
 * navigation temporaries unique within the unit, and rewrite counts. Confined to the thread
 * rewriting the unit.
 */
final class RewriteContext {

    static final String TEMP_PREFIX = "$nav";

    private final String unitName;
    private int nextTemp;
    private int navigations;
    private int guards;
    private int sequences;

    RewriteContext(String unitName) {
        this.unitName = unitName;
    }

    String unitName() {
        return unitName;
    }

    String newTemporary() {
        return TEMP_PREFIX + nextTemp++;
    }

    void countNavigation() {
        navigations++;
    }

    void countGuards(int count) {
        guards += count;
    }

    void countSequence() {
        sequences++;
    }

    int navigations() {
        return navigations;
    }

    int guards() {
        return guards;
    }

    int sequences() {
        return sequences;
    }
}
