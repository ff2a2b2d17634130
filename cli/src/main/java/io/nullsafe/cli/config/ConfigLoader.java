package io.nullsafe.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.nullsafe.core.error.InvalidActivationException;
import io.nullsafe.core.model.Feature;
import io.nullsafe.core.scope.ActivationSet;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link CliConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>
 * Expected shape:
 *
 * <pre>
 * activations:
 *   - path: app
 *     recursive: true
 *     features: [navigation, api-guard, sequence-wrap]
 * parallelism: 1
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>
 * {@code path} may be {@code ""} for the root package; {@code recursive} defaults to
 * {@code false}. Missing top-level keys receive the defaults from {@link CliConfig.Builder}.
 *
 * <p>
 * Environment overlay: {@code NULLSAFE_LOG_LEVEL}, {@code NULLSAFE_LOG_FORMAT} and
 * {@code NULLSAFE_PARALLELISM} take precedence over YAML values. A variable counts as set only if
 * it is defined and its trimmed value is non-empty.
 */
public final class ConfigLoader {

    static final String ENV_LOG_LEVEL = "NULLSAFE_LOG_LEVEL";
    static final String ENV_LOG_FORMAT = "NULLSAFE_LOG_FORMAT";
    static final String ENV_PARALLELISM = "NULLSAFE_PARALLELISM";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link CliConfig} from the given YAML file, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or declares an
     *                             invalid activation
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link CliConfig} from the given YAML file, applying overrides from the supplied
     * lookup. The lookup returns {@code null} for an undefined variable.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or declares an
     *                             invalid activation
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(configPath.toFile());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root != null && !root.isMissingNode() && !root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }

        try {
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (InvalidActivationException e) {
            throw new ConfigLoadException(
                    "Invalid activation in " + configPath + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CliConfig.Builder builder = CliConfig.builder();

        // --- YAML mapping ---

        builder.activations(parseActivations(root.path("activations")));
        if (root.has("parallelism")) builder.parallelism(requireInt(root.get("parallelism"), "parallelism"));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, ENV_LOG_LEVEL, builder::loggingLevel);
        envString(envLookup, ENV_LOG_FORMAT, builder::loggingFormat);
        envInt(envLookup, ENV_PARALLELISM, builder::parallelism);

        return builder.build();
    }

    private static ActivationSet parseActivations(JsonNode activations) {
        if (activations.isMissingNode() || activations.isNull()) {
            return ActivationSet.empty();
        }
        if (!activations.isArray()) {
            throw new IllegalArgumentException("'activations' must be a list");
        }
        ActivationSet.Builder builder = ActivationSet.builder();
        for (int i = 0; i < activations.size(); i++) {
            JsonNode entry = activations.get(i);
            if (!entry.has("path")) {
                throw new IllegalArgumentException("activations[" + i + "]: missing required 'path'");
            }
            String path = entry.get("path").isNull() ? "" : entry.get("path").asText();
            boolean recursive = entry.path("recursive").asBoolean(false);
            List<Feature> features = parseFeatures(entry.path("features"), i);
            for (Feature feature : features) {
                builder.activate(path, recursive, feature);
            }
        }
        return builder.build();
    }

    private static List<Feature> parseFeatures(JsonNode features, int index) {
        List<Feature> parsed = new ArrayList<>();
        if (features.isTextual()) {
            parsed.add(Feature.fromKey(features.asText()));
        } else if (features.isArray()) {
            for (JsonNode feature : features) {
                parsed.add(Feature.fromKey(feature.asText()));
            }
        }
        if (parsed.isEmpty()) {
            throw new IllegalArgumentException("activations[" + index + "]: 'features' must name at least one feature");
        }
        return parsed;
    }

    private static int requireInt(JsonNode node, String field) {
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException("'" + field + "' must be an integer, got '" + node.asText() + "'");
        }
        return node.asInt();
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }
}
