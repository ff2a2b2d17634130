package io.nullsafe.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nullsafe.cli.config.CliConfig;
import io.nullsafe.cli.config.ConfigLoadException;
import io.nullsafe.cli.config.ConfigLoader;
import io.nullsafe.core.engine.BuildSession;
import io.nullsafe.core.model.BuildReport;
import io.nullsafe.core.model.RewriteResult;
import io.nullsafe.core.model.UnitFailure;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one build from the command line.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Parse the command line</li>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback from {@code logging.format} and {@code logging.level}</li>
 * <li>Read every unit file; any unreadable file stops the build before rewriting</li>
 * <li>Rewrite all units in one {@link BuildSession}</li>
 * <li>Write each successfully rewritten unit; failed units are left untouched</li>
 * </ol>
 *
 * <p>
 * Separate from {@link NullsafeMain} so tests can drive a build without going through
 * {@code main()}.
 */
public final class NullsafeApp {

    private static final Logger LOG = LoggerFactory.getLogger(NullsafeApp.class);

    private static final ObjectMapper JSON = new ObjectMapper();

    private NullsafeApp() {
        // utility class
    }

    /** Runs a build with overrides from {@link System#getenv}. */
    public static BuildReport run(String[] args) {
        return run(args, System::getenv);
    }

    /**
     * Runs a build.
     *
     * @param args      command-line arguments
     * @param envLookup environment lookup for configuration overrides
     * @return the build report; unit-level failures are in {@link BuildReport#failures()}
     * @throws CliUsageException   if the command line is invalid
     * @throws ConfigLoadException if the configuration or a unit file cannot be read
     */
    public static BuildReport run(String[] args, Function<String, String> envLookup) {
        CliOptions options = CliOptions.parse(args);
        CliConfig config = ConfigLoader.load(options.configPath(), envLookup);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}: {} activation(s)", options.configPath(), config.activations().size());
        return run(options, config);
    }

    /** Runs a build with already-loaded configuration. Leaves logging setup to the caller. */
    static BuildReport run(CliOptions options, CliConfig config) {
        checkDistinctOutputs(options);

        Map<ObjectNode, Path> sources = new IdentityHashMap<>();
        List<ObjectNode> units = new ArrayList<>();
        for (Path file : options.units()) {
            ObjectNode unit = readUnit(file);
            sources.put(unit, file);
            units.add(unit);
        }

        BuildSession session = new BuildSession(config.activations());
        BuildReport report;
        if (config.parallelism() > 1) {
            ExecutorService executor = Executors.newFixedThreadPool(config.parallelism());
            try {
                report = session.rewriteAll(units, executor);
            } finally {
                executor.shutdown();
            }
        } else {
            report = session.rewriteAll(units);
        }

        if (options.outDir() != null) {
            createDirectories(options.outDir());
        }
        for (RewriteResult result : report.results()) {
            writeUnit(result.unit(), options.outputFor(sources.get(result.unit())));
        }
        for (UnitFailure failure : report.failures()) {
            LOG.error("Not written: {} ({}): {}",
                    sources.get(failure.unit()), failure.unitName(), failure.error().getMessage());
        }
        LOG.info("Wrote {} unit(s) to {}",
                report.results().size(), options.outDir() == null ? "their source files" : options.outDir());
        return report;
    }

    static ObjectNode readUnit(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigLoadException("Unit file not found: " + file);
        }
        JsonNode tree;
        try {
            tree = JSON.readTree(file.toFile());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse unit file: " + file, e);
        }
        if (tree == null || !tree.isObject()) {
            throw new ConfigLoadException("Unit file does not hold a JSON object: " + file);
        }
        return (ObjectNode) tree;
    }

    private static void writeUnit(ObjectNode unit, Path target) {
        try {
            JSON.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), unit);
            LOG.debug("Wrote {}", target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create output directory " + dir, e);
        }
    }

    /** Two inputs with the same file name would overwrite each other in a shared output directory. */
    private static void checkDistinctOutputs(CliOptions options) {
        Map<Path, Path> seen = new HashMap<>();
        for (Path unit : options.units()) {
            Path previous = seen.put(options.outputFor(unit).toAbsolutePath().normalize(), unit);
            if (previous != null) {
                throw new CliUsageException("Units " + previous + " and " + unit + " would both be written to "
                        + options.outputFor(unit));
            }
        }
    }
}
