package io.imagexform.core.spec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.imagexform.core.error.PipelineDefinitionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parses YAML pipeline definitions into {@link PipelineDefinition} instances.
 *
 * <pre>
 * format: png
 * loader:
 *   shrink: 2
 * saver:
 *   quality: 85
 * operations:
 *   - resize_to_limit: [400, 400]
 *   - strip: true
 *   - resize_and_pad: [500, 500, {background: white, gravity: north}]
 * </pre>
 *
 * <p>
 * Each entry of {@code operations} is a single-key map; the value follows the fan-out rules of
 * {@link io.imagexform.core.builder.ImagePipeline#apply(List)}. A list whose last element is a map
 * passes that map as the operation's named options.
 *
 * <p>
 * Thread-safe.
 */
public final class PipelineDefinitionParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    // Unknown keys are rejected so that typos surface at load time instead of being ignored.

    /** Recognized top-level keys. */
    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("format", "loader", "saver", "operations");

    /**
     * Parses the YAML file at the given path.
     *
     * @throws PipelineDefinitionException if the file cannot be read, is not valid YAML, or has an
     *     invalid structure
     */
    public PipelineDefinition parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        try (InputStream in = Files.newInputStream(path)) {
            return parse(YAML_MAPPER.readTree(in), source);
        } catch (IOException e) {
            throw new PipelineDefinitionException("Failed to read or parse YAML: " + e.getMessage(), e, source);
        }
    }

    /** Parses a YAML document held in a string; {@code source} names it in error messages. */
    public PipelineDefinition parse(String yaml, String source) {
        try {
            return parse(YAML_MAPPER.readTree(yaml), source);
        } catch (IOException e) {
            throw new PipelineDefinitionException("Failed to parse YAML: " + e.getMessage(), e, source);
        }
    }

    private PipelineDefinition parse(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new PipelineDefinition(null, Map.of(), Map.of(), List.of());
        }
        if (!root.isObject()) {
            throw new PipelineDefinitionException("Pipeline definition must be a YAML mapping", source);
        }
        rejectUnknownKeys(root, source);

        String format = null;
        JsonNode formatNode = root.get("format");
        if (formatNode != null && !formatNode.isNull()) {
            if (!formatNode.isTextual()) {
                throw new PipelineDefinitionException("'format' must be a string", source);
            }
            format = formatNode.asText();
        }

        return new PipelineDefinition(
                format,
                optionsBlock(root, "loader", source),
                optionsBlock(root, "saver", source),
                operations(root.get("operations"), source));
    }

    private static void rejectUnknownKeys(JsonNode root, String source) {
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_ROOT_KEYS.contains(name)) {
                throw new PipelineDefinitionException(
                        "Unknown key '" + name + "' (expected one of " + KNOWN_ROOT_KEYS + ")", source);
            }
        }
    }

    private static Map<String, Object> optionsBlock(JsonNode root, String name, String source) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new PipelineDefinitionException("'" + name + "' must be a YAML mapping", source);
        }
        return Collections.unmodifiableMap(YAML_MAPPER.convertValue(node, MAP_TYPE));
    }

    private static List<Map.Entry<String, Object>> operations(JsonNode node, String source) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new PipelineDefinitionException("'operations' must be a YAML list", source);
        }
        List<Map.Entry<String, Object>> operations = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            if (entry.isTextual()) {
                operations.add(new AbstractMap.SimpleImmutableEntry<>(entry.asText(), null));
                continue;
            }
            if (!entry.isObject() || entry.size() != 1) {
                throw new PipelineDefinitionException(
                        "operations[" + i + "] must be an operation name or a single-key mapping", source);
            }
            String name = entry.fieldNames().next();
            Object argument = YAML_MAPPER.convertValue(entry.get(name), Object.class);
            operations.add(new AbstractMap.SimpleImmutableEntry<>(name, argument));
        }
        return Collections.unmodifiableList(operations);
    }
}
