package io.imagexform.magick;

import io.imagexform.core.error.ConfigurationException;
import io.imagexform.core.option.OptionFilter;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders option values as ImageMagick command-line arguments.
 *
 * <ul>
 *   <li>{@code true} or {@code null}: {@code -name}
 *   <li>{@code false}: {@code +name} (the "reset" form)
 *   <li>a list: {@code -name} followed by each element
 *   <li>a map, for {@code define} only: one {@code -define namespace:key=value} pair per leaf
 *   <li>a {@code namespace:key} name: {@code -define namespace:key=value}
 *   <li>anything else: {@code -name value}
 * </ul>
 *
 * Underscores in names become dashes, so {@code auto_orient} renders as {@code -auto-orient}.
 */
final class MagickFlags {

    private MagickFlags() {
        // utility class
    }

    static String flag(String name) {
        return OptionFilter.normalizeKey(name, '-');
    }

    static List<String> render(String name, Object value) {
        if (name.indexOf(':') > 0) {
            return List.of("-define", flag(name) + "=" + format(value));
        }
        String flag = flag(name);
        if (value == null || Boolean.TRUE.equals(value)) {
            return List.of("-" + flag);
        }
        if (Boolean.FALSE.equals(value)) {
            return List.of("+" + flag);
        }
        if (value instanceof Map<?, ?> map) {
            if (!"define".equals(flag)) {
                throw new ConfigurationException("option '" + name + "' does not accept a map value");
            }
            return defines(map);
        }
        List<String> rendered = new ArrayList<>();
        rendered.add("-" + flag);
        if (value instanceof List<?> list) {
            list.forEach(element -> rendered.add(format(element)));
        } else {
            rendered.add(format(value));
        }
        return rendered;
    }

    /** {@code {png: {compression_level: 8}}} renders as {@code -define png:compression-level=8}. */
    static List<String> defines(Map<?, ?> group) {
        Map<String, Object> keyed = new LinkedHashMap<>();
        group.forEach((key, value) -> keyed.put(String.valueOf(key), value));
        List<String> rendered = new ArrayList<>();
        for (String atom : OptionFilter.flatten(keyed, '-')) {
            rendered.add("-define");
            rendered.add(atom);
        }
        return rendered;
    }

    /** Integral numbers without a fractional part, everything else via {@code toString}. */
    static String format(Object value) {
        if ((value instanceof Double || value instanceof Float) && Double.isFinite(((Number) value).doubleValue())) {
            return new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }
}
