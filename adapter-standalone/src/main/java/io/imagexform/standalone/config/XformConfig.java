package io.imagexform.standalone.config;

import java.util.Locale;
import java.util.Set;

/**
 * Configuration of the standalone host. Use {@link #builder()}; every field has a default.
 *
 * @param engineType         engine to run pipelines with: {@code java2d} or {@code magick}
 * @param magickExecutable   ImageMagick command ({@code magick} for 7, {@code convert} for 6)
 * @param magickTimeoutMs    maximum duration of one ImageMagick invocation in ms
 * @param pipelineDefinition path of the YAML pipeline definition; may be null when given on the
 *                           command line instead
 * @param loggingFormat      {@code json} or {@code text}
 * @param loggingLevel       root log level
 */
public record XformConfig(
        String engineType,
        String magickExecutable,
        long magickTimeoutMs,
        String pipelineDefinition,
        String loggingFormat,
        String loggingLevel) {

    /** Supported {@link #engineType()} values. */
    public static final Set<String> ENGINE_TYPES = Set.of("java2d", "magick");

    /** Supported {@link #loggingFormat()} values. */
    public static final Set<String> LOGGING_FORMATS = Set.of("json", "text");

    /** Creates a new builder with the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link XformConfig}. */
    public static final class Builder {
        private String engineType = "java2d";
        private String magickExecutable = "magick";
        private long magickTimeoutMs = 60_000;
        private String pipelineDefinition;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder engineType(String engineType) {
            this.engineType = engineType;
            return this;
        }

        public Builder magickExecutable(String magickExecutable) {
            this.magickExecutable = magickExecutable;
            return this;
        }

        public Builder magickTimeoutMs(long magickTimeoutMs) {
            this.magickTimeoutMs = magickTimeoutMs;
            return this;
        }

        public Builder pipelineDefinition(String pipelineDefinition) {
            this.pipelineDefinition = pipelineDefinition;
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

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if the engine type or logging format is unknown, or the
         *     timeout is not positive
         */
        public XformConfig build() {
            String engine = engineType == null ? null : engineType.toLowerCase(Locale.ROOT);
            if (engine == null || !ENGINE_TYPES.contains(engine)) {
                throw new ConfigLoadException(
                        "engine.type must be one of " + ENGINE_TYPES + ", got '" + engineType + "'");
            }
            String format = loggingFormat == null ? null : loggingFormat.toLowerCase(Locale.ROOT);
            if (format == null || !LOGGING_FORMATS.contains(format)) {
                throw new ConfigLoadException(
                        "logging.format must be one of " + LOGGING_FORMATS + ", got '" + loggingFormat + "'");
            }
            if (magickTimeoutMs <= 0) {
                throw new ConfigLoadException("engine.magick.timeout-ms must be positive, got " + magickTimeoutMs);
            }
            if (magickExecutable == null || magickExecutable.isBlank()) {
                throw new ConfigLoadException("engine.magick.executable must not be blank");
            }
            return new XformConfig(engine, magickExecutable, magickTimeoutMs, pipelineDefinition, format, loggingLevel);
        }
    }
}
