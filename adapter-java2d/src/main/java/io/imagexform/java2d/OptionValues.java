package io.imagexform.java2d;

import io.imagexform.core.error.ConfigurationException;
import io.imagexform.core.error.ImageXformException.Phase;
import java.util.Map;

/** Typed reads of loader and saver option values. */
final class OptionValues {

    private OptionValues() {
        // utility class
    }

    static int intValue(Map<String, Object> options, String name, int defaultValue, Phase phase) {
        Object value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            return number.intValue();
        }
        if (value instanceof String string) {
            try {
                return Integer.parseInt(string.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(
                        "option '" + name + "' must be an integer, got '" + string + "'", e, phase);
            }
        }
        throw new ConfigurationException("option '" + name + "' must be an integer, got " + value, phase);
    }

    static boolean booleanValue(Map<String, Object> options, String name, boolean defaultValue, Phase phase) {
        Object value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String string) {
            if ("true".equalsIgnoreCase(string.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(string.trim())) {
                return false;
            }
        }
        throw new ConfigurationException("option '" + name + "' must be true or false, got " + value, phase);
    }
}
