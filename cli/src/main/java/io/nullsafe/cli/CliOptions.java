package io.nullsafe.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line: {@code [--config <file>] [--out <dir>] <unit.json>...}.
 *
 * @param configPath activation config file (default {@code nullsafe.yaml})
 * @param outDir     directory for rewritten units, or {@code null} to overwrite inputs in place
 * @param units      unit files to rewrite, in command-line order
 */
public record CliOptions(Path configPath, Path outDir, List<Path> units) {

    static final String DEFAULT_CONFIG_FILE = "nullsafe.yaml";

    static final String USAGE = "Usage: nullsafe [--config <file>] [--out <dir>] <unit.json>...";

    public CliOptions {
        units = List.copyOf(units);
    }

    /**
     * Parses command-line arguments.
     *
     * @throws CliUsageException if an option lacks its value, an option is unknown, or no unit
     *                           file is given
     */
    public static CliOptions parse(String[] args) {
        Path configPath = Path.of(DEFAULT_CONFIG_FILE);
        Path outDir = null;
        List<Path> units = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> configPath = Path.of(valueOf(args, ++i, arg));
                case "--out" -> outDir = Path.of(valueOf(args, ++i, arg));
                default -> {
                    if (arg.startsWith("--")) {
                        throw new CliUsageException("Unknown option '" + arg + "'. " + USAGE);
                    }
                    units.add(Path.of(arg));
                }
            }
        }
        if (units.isEmpty()) {
            throw new CliUsageException("No unit files given. " + USAGE);
        }
        return new CliOptions(configPath, outDir, units);
    }

    /** Where the rewritten form of {@code unit} is written. */
    public Path outputFor(Path unit) {
        return outDir == null ? unit : outDir.resolve(unit.getFileName());
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new CliUsageException(option + " requires a path argument");
        }
        return args[index];
    }
}
