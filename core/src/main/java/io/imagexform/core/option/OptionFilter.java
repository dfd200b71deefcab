package io.imagexform.core.option;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Option negotiation between a caller and an engine: flattens nested option groups into
 * {@code namespace:key} atoms and keeps only the options the engine accepts.
 *
 * <p>
 * An accepted set names plain options ({@code quality}), single atoms ({@code jpeg:size}), whole
 * namespaces ({@code jpeg:*}) or every namespace at once ({@link #ANY_NAMESPACE}).
 */
public final class OptionFilter {

    /** Accepted-set entry that admits every {@code namespace:key} atom. */
    public static final String ANY_NAMESPACE = "*:*";

    private OptionFilter() {
        // utility class
    }

    /**
     * Replaces every map-valued option the engine does not accept under its own name with the
     * atoms of its group. {@code {jpeg: {fancy_upsampling: off}}} with separator {@code '-'}
     * becomes {@code {"jpeg:fancy-upsampling": off}}. Plain options keep their key and position.
     */
    public static Map<String, Object> flattenGroups(Map<String, Object> options, Set<String> accepted, char separator) {
        Map<String, Object> expanded = new LinkedHashMap<>();
        options.forEach((key, value) -> {
            if (value instanceof Map<?, ?> group && !accepted.contains(key)) {
                collect(normalizeKey(key, separator) + ":", group, separator, expanded);
            } else {
                expanded.put(key, value);
            }
        });
        return expanded;
    }

    /**
     * Returns the entries of {@code options} whose key is accepted, in their original order.
     * Unknown keys are dropped, not rejected.
     */
    public static Map<String, Object> select(Map<String, Object> options, Set<String> accepted) {
        if (options.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> selected = new LinkedHashMap<>();
        options.forEach((key, value) -> {
            if (isAccepted(key, accepted)) {
                selected.put(key, value);
            }
        });
        return Collections.unmodifiableMap(selected);
    }

    /** Keys of {@code options} that are not accepted. */
    public static List<String> rejected(Map<String, Object> options, Set<String> accepted) {
        List<String> rejected = new ArrayList<>();
        for (String key : options.keySet()) {
            if (!isAccepted(key, accepted)) {
                rejected.add(key);
            }
        }
        return rejected;
    }

    static boolean isAccepted(String key, Set<String> accepted) {
        if (accepted.contains(key)) {
            return true;
        }
        int colon = key.indexOf(':');
        if (colon <= 0) {
            return false;
        }
        return accepted.contains(ANY_NAMESPACE) || accepted.contains(key.substring(0, colon) + ":*");
    }

    /**
     * Flattens a nested option group into atoms. {@code {jpeg: {fancy_upsampling: off}}} with
     * separator {@code '-'} becomes {@code ["jpeg:fancy-upsampling=off"]}. Underscores in keys are
     * replaced by the separator; nesting deeper than one level keeps joining with {@code ':'}.
     */
    public static List<String> flatten(Map<String, ?> group, char separator) {
        Map<String, Object> atoms = new LinkedHashMap<>();
        collect("", group, separator, atoms);
        List<String> rendered = new ArrayList<>(atoms.size());
        atoms.forEach((name, value) -> rendered.add(name + "=" + value));
        return rendered;
    }

    /** Normalizes underscores in an option name to the engine's separator. */
    public static String normalizeKey(String key, char separator) {
        return key.replace('_', separator);
    }

    private static void collect(String prefix, Map<?, ?> group, char separator, Map<String, Object> atoms) {
        group.forEach((key, value) -> {
            String name = prefix + normalizeKey(String.valueOf(key), separator);
            if (value instanceof Map<?, ?> nested) {
                collect(name + ":", nested, separator, atoms);
            } else {
                atoms.put(name, value);
            }
        });
    }
}
