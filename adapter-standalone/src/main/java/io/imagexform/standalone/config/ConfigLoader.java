package io.imagexform.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.LongConsumer;

/**
 * Loads {@link XformConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * engine:
 *   type: magick
 *   magick:
 *     executable: convert
 *     timeout-ms: 30000
 * pipeline:
 *   definition: thumbnails.yaml
 * logging:
 *   format: json
 *   level: DEBUG
 * </pre>
 *
 * <p>
 * Every key can be overridden by an environment variable ({@code ENGINE_TYPE},
 * {@code MAGICK_EXECUTABLE}, {@code MAGICK_TIMEOUT_MS}, {@code PIPELINE_DEFINITION},
 * {@code LOG_FORMAT}, {@code LOG_LEVEL}). A variable is "set" if and only if it is defined and
 * its trimmed value is non-empty; otherwise the YAML value or the default stands.
 */
public final class ConfigLoader {

    /** Config file looked up in the working directory when {@code --config} is absent. */
    public static final String DEFAULT_CONFIG_FILE = "image-xform.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("engine", "pipeline", "logging");

    private ConfigLoader() {
        // utility class
    }

    /** Loads the file, applying overrides from {@link System#getenv}. */
    public static XformConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the file, applying overrides from the given lookup. A {@code null} path means "no
     * file": defaults plus environment.
     *
     * @param envLookup maps a variable name to its value, {@code null} when undefined
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static XformConfig load(Path configPath, Function<String, String> envLookup) {
        XformConfig.Builder builder = XformConfig.builder();
        if (configPath != null) {
            if (!Files.exists(configPath)) {
                throw new ConfigLoadException("Configuration file not found: " + configPath
                        + ". Use --config <path> to specify a config file.");
            }
            try (InputStream in = Files.newInputStream(configPath)) {
                JsonNode root = YAML_MAPPER.readTree(in);
                if (root != null && !root.isMissingNode() && !root.isNull()) {
                    mapYaml(root, builder, configPath);
                }
            } catch (IOException e) {
                throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
            }
        }
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    /**
     * Resolves the config file from {@code --config <path>}. Without the flag, returns
     * {@link #DEFAULT_CONFIG_FILE} if it exists in the working directory, else {@code null}.
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        return Files.exists(fallback) ? fallback : null;
    }

    private static void mapYaml(JsonNode root, XformConfig.Builder builder, Path configPath) {
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext(); ) {
            String key = it.next().getKey();
            if (!KNOWN_ROOT_KEYS.contains(key)) {
                throw new ConfigLoadException("Unknown configuration key '" + key + "' in " + configPath
                        + " (known: " + KNOWN_ROOT_KEYS + ")");
            }
        }

        JsonNode engine = root.path("engine");
        if (engine.has("type")) builder.engineType(engine.get("type").asText());
        JsonNode magick = engine.path("magick");
        if (magick.has("executable")) builder.magickExecutable(magick.get("executable").asText());
        if (magick.has("timeout-ms")) builder.magickTimeoutMs(magick.get("timeout-ms").asLong());

        JsonNode pipeline = root.path("pipeline");
        if (pipeline.has("definition")) builder.pipelineDefinition(pipeline.get("definition").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    private static void applyEnvOverrides(XformConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "ENGINE_TYPE", builder::engineType);
        envString(envLookup, "MAGICK_EXECUTABLE", builder::magickExecutable);
        envLong(envLookup, "MAGICK_TIMEOUT_MS", builder::magickTimeoutMs);
        envString(envLookup, "PIPELINE_DEFINITION", builder::pipelineDefinition);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }
}
