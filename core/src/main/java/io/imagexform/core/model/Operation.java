package io.imagexform.core.model;

import io.imagexform.core.spi.ImageCallback;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a pipeline: an operation name, its positional arguments, its named options and an
 * optional callback. Immutable.
 *
 * <p>
 * Positional arguments may contain {@code null} (an omitted dimension, for instance), so the
 * lists are wrapped rather than copied with {@code List.copyOf}.
 */
public record Operation(String name, List<Object> args, Map<String, Object> options, ImageCallback<?> callback) {

    /** Reserved name: invoke the callback directly on the accumulator. */
    public static final String CUSTOM = "custom";

    public Operation {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("operation name must not be empty");
        }
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    /** Creates an operation without named options or callback. */
    public static Operation of(String name, List<Object> args) {
        return new Operation(name, args, null, null);
    }

    /** Creates the reserved {@code custom} operation. */
    public static Operation custom(ImageCallback<?> callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        return new Operation(CUSTOM, List.of(), null, callback);
    }

    public boolean isCustom() {
        return CUSTOM.equals(name);
    }
}
