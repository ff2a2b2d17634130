package io.nullsafe.cli;

import io.nullsafe.core.model.BuildReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the command-line build step.
 *
 * <p>
 * Delegates to {@link NullsafeApp#run(String[])}. Exits with status 1 if the build cannot start
 * (bad arguments, unreadable configuration or unit file) and with status 2 if any unit failed to
 * rewrite.
 */
public final class NullsafeMain {

    private static final Logger LOG = LoggerFactory.getLogger(NullsafeMain.class);

    static final int EXIT_STARTUP_FAILURE = 1;
    static final int EXIT_UNIT_FAILURES = 2;

    private NullsafeMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config nullsafe.yaml src/Main.json})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        BuildReport report;
        try {
            report = NullsafeApp.run(args);
        } catch (Exception e) {
            LOG.error("Build failed: {}", e.getMessage(), e);
            System.exit(EXIT_STARTUP_FAILURE);
            return;
        }
        int status = exitStatus(report);
        if (status != 0) {
            LOG.error("{} unit(s) failed", report.failures().size());
            System.exit(status);
        }
    }

    static int exitStatus(BuildReport report) {
        return report.isSuccessful() ? 0 : EXIT_UNIT_FAILURES;
    }
}
