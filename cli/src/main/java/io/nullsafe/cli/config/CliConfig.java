package io.nullsafe.cli.config;

import io.nullsafe.core.scope.ActivationSet;
import java.util.Objects;

/**
 * Root configuration for a command-line build.
 *
 * <p>
 * Use {@link #builder()} to construct instances; every field has a default.
 *
 * @param activations   scope activations for the build (default: none)
 * @param parallelism   number of units rewritten at once (default 1)
 * @param loggingFormat {@code text} or {@code json} (default {@code text})
 * @param loggingLevel  root log level (default {@code INFO})
 */
public record CliConfig(ActivationSet activations, int parallelism, String loggingFormat, String loggingLevel) {

    public CliConfig {
        Objects.requireNonNull(activations, "activations must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        Objects.requireNonNull(loggingFormat, "loggingFormat must not be null");
        Objects.requireNonNull(loggingLevel, "loggingLevel must not be null");
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {

        private ActivationSet activations = ActivationSet.empty();
        private int parallelism = 1;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder activations(ActivationSet activations) {
            this.activations = activations;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            return new CliConfig(activations, parallelism, loggingFormat, loggingLevel);
        }
    }
}
