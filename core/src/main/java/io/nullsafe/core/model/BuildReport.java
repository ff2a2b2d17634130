package io.nullsafe.core.model;

import java.util.List;

/**
 * Summary of a build session: the units that were rewritten, the units that failed, and
 * configuration diagnostics raised once for the whole build.
 *
 * <p>
 * Immutable: collections are copied on construction.
 *
 * @param results     successfully rewritten units, in completion order
 * @param failures    one entry per failed unit, in completion order
 * @param diagnostics build-wide diagnostics (e.g. activations that matched nothing)
 */
public record BuildReport(List<RewriteResult> results, List<UnitFailure> failures, List<Diagnostic> diagnostics) {

    public BuildReport {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
        diagnostics = List.copyOf(diagnostics);
    }

    /** Returns true if no unit failed. Diagnostics alone do not make a build unsuccessful. */
    public boolean isSuccessful() {
        return failures.isEmpty();
    }
}
