package io.imagexform.core.model;

import io.imagexform.core.error.ConfigurationException;
import io.imagexform.core.error.ImageXformException.Phase;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed read access to the positional arguments and named options of an {@link Operation}.
 * Shape mismatches fail with {@link ConfigurationException} naming the operation.
 */
public final class OperationArgs {

    private final String operation;
    private final List<Object> positional;
    private final Map<String, Object> options;

    public OperationArgs(String operation, List<Object> positional, Map<String, Object> options) {
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.positional = positional == null ? List.of() : positional;
        this.options = options == null ? Map.of() : options;
    }

    /** Wraps the arguments of the given operation. */
    public static OperationArgs of(Operation operation) {
        return new OperationArgs(operation.name(), operation.args(), operation.options());
    }

    public String operation() {
        return operation;
    }

    public List<Object> positional() {
        return positional;
    }

    public Map<String, Object> options() {
        return options;
    }

    public int size() {
        return positional.size();
    }

    /** Positional argument at {@code index}, or {@code null} if absent. */
    public Object get(int index) {
        return index < positional.size() ? positional.get(index) : null;
    }

    /** Positional integer at {@code index}; {@code null} if absent or null. */
    public Integer intOrNull(int index) {
        return toInteger(get(index), "argument " + index);
    }

    /** Positional integer at {@code index}; fails if absent. */
    public int requireInt(int index) {
        Integer value = intOrNull(index);
        if (value == null) {
            throw new ConfigurationException(
                    operation + ": missing required integer argument at position " + index, Phase.TRANSFORM);
        }
        return value;
    }

    /** Positional number at {@code index}; fails if absent. */
    public double requireDouble(int index) {
        Object value = get(index);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String string) {
            try {
                return Double.parseDouble(string.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(
                        operation + ": argument " + index + " is not a number: '" + string + "'", e, Phase.TRANSFORM);
            }
        }
        throw new ConfigurationException(
                operation + ": missing required numeric argument at position " + index, Phase.TRANSFORM);
    }

    /** Positional value at {@code index} as a string, or {@code null}. */
    public String string(int index) {
        Object value = get(index);
        return value == null ? null : value.toString();
    }

    public boolean hasOption(String name) {
        return options.containsKey(name);
    }

    /** Named option, or {@code null}. */
    public Object option(String name) {
        return options.get(name);
    }

    /** Named option as a string, or the default when absent. */
    public String optionString(String name, String defaultValue) {
        Object value = options.get(name);
        return value == null ? defaultValue : value.toString();
    }

    /** Named option as an integer, or {@code null} when absent. */
    public Integer optionInt(String name) {
        return toInteger(options.get(name), "option '" + name + "'");
    }

    private Integer toInteger(Object value, String label) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d != Math.rint(d)) {
                throw new ConfigurationException(
                        operation + ": " + label + " must be an integer, got " + value, Phase.TRANSFORM);
            }
            return (int) d;
        }
        if (value instanceof String string) {
            try {
                return Integer.parseInt(string.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(
                        operation + ": " + label + " is not an integer: '" + string + "'", e, Phase.TRANSFORM);
            }
        }
        throw new ConfigurationException(
                operation + ": " + label + " must be an integer, got " + value.getClass().getSimpleName(),
                Phase.TRANSFORM);
    }
}
