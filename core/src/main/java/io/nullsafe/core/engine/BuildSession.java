package io.nullsafe.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nullsafe.core.error.RewriteException;
import io.nullsafe.core.model.BuildReport;
import io.nullsafe.core.model.Diagnostic;
import io.nullsafe.core.model.RewriteResult;
import io.nullsafe.core.model.ScopeActivation;
import io.nullsafe.core.model.UnitFailure;
import io.nullsafe.core.scope.ActivationSet;
import io.nullsafe.core.scope.ScopeResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * One build's worth of rewrites over a fixed {@link ActivationSet}.
 *
 * <p>
 * Each unit is rewritten independently. A {@link RewriteException} stops only the unit that
 * raised it; it is recorded and the build carries on with the others. {@link #finish()} reports,
 * once, every activation that never matched a declaration in any unit.
 *
 * <p>
 * Thread-safe: {@link #rewrite(ObjectNode)} may be called concurrently for distinct units.
 */
public final class BuildSession {

    private static final Logger LOG = LoggerFactory.getLogger(BuildSession.class);

    /** MDC key holding the unit being rewritten. */
    public static final String MDC_UNIT = "unit";

    private final ActivationSet activations;
    private final RewriteDriver driver;
    private final Set<ScopeActivation> matched = ConcurrentHashMap.newKeySet();
    private final Queue<RewriteResult> results = new ConcurrentLinkedQueue<>();
    private final Queue<UnitFailure> failures = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean finished = new AtomicBoolean();

    public BuildSession(ActivationSet activations) {
        this.activations = Objects.requireNonNull(activations, "activations must not be null");
        this.driver = new RewriteDriver(new ScopeResolver(activations), matched::add);
    }

    public ActivationSet activations() {
        return activations;
    }

    /**
     * Rewrites one unit in place.
     *
     * @return the result, or empty if the unit failed (the failure is kept for the report)
     */
    public Optional<RewriteResult> rewrite(ObjectNode unit) {
        String unitName = RewriteDriver.unitName(unit);
        MDC.put(MDC_UNIT, unitName);
        try {
            RewriteResult result = driver.rewrite(unit);
            results.add(result);
            LOG.info("Rewrote {}: {} navigation(s), {} guard(s), {} sequence(s)",
                    unitName, result.navigations(), result.guards(), result.sequences());
            return Optional.of(result);
        } catch (RewriteException e) {
            failures.add(new UnitFailure(unitName, unit, e));
            LOG.error("Rewrite of {} failed ({}): {}", unitName, e.phase(), e.getMessage());
            return Optional.empty();
        } finally {
            MDC.remove(MDC_UNIT);
        }
    }

    /**
     * Rewrites every unit on {@code executor} and waits for all of them, then finishes the session.
     *
     * @throws IllegalStateException if interrupted while waiting
     */
    public BuildReport rewriteAll(List<ObjectNode> units, ExecutorService executor) {
        List<Future<Optional<RewriteResult>>> pending = new ArrayList<>();
        for (ObjectNode unit : units) {
            pending.add(executor.submit(() -> rewrite(unit)));
        }
        for (Future<Optional<RewriteResult>> future : pending) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for unit rewrites", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Unit rewrite failed", cause);
            }
        }
        return finish();
    }

    /** Rewrites every unit on the calling thread, then finishes the session. */
    public BuildReport rewriteAll(List<ObjectNode> units) {
        units.forEach(this::rewrite);
        return finish();
    }

    /**
     * Builds the report. Activations that enabled nothing in any rewritten unit become warning
     * diagnostics; they are logged on the first call only.
     */
    public BuildReport finish() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ScopeActivation activation : activations.all()) {
            if (!matched.contains(activation)) {
                diagnostics.add(new Diagnostic(
                        "Activation " + activation + " does not match any declaration",
                        activation));
            }
        }
        if (finished.compareAndSet(false, true)) {
            diagnostics.forEach(d -> LOG.warn(d.message()));
            LOG.info("Build finished: {} unit(s) rewritten, {} failed, {} diagnostic(s)",
                    results.size(), failures.size(), diagnostics.size());
        }
        return new BuildReport(new ArrayList<>(results), new ArrayList<>(failures), diagnostics);
    }
}
