package io.imagexform.core.geometry;

import io.imagexform.core.error.GeometryException;
import io.imagexform.core.error.InvalidGravityException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The nine anchor points used to position an element inside a box. Each anchor places the
 * element at {@code (dx * fx, dy * fy)} where {@code dx, dy} is the free space and {@code fx, fy}
 * are 0, ½ or 1.
 */
public enum Gravity {
    CENTER(1, 1, "Center"),
    NORTH(1, 0, "North"),
    NORTH_EAST(2, 0, "NorthEast"),
    EAST(2, 1, "East"),
    SOUTH_EAST(2, 2, "SouthEast"),
    SOUTH(1, 2, "South"),
    SOUTH_WEST(0, 2, "SouthWest"),
    WEST(0, 1, "West"),
    NORTH_WEST(0, 0, "NorthWest");

    // factors in halves: 0 = start, 1 = middle, 2 = end
    private final int halvesX;
    private final int halvesY;
    private final String magickName;

    Gravity(int halvesX, int halvesY, String magickName) {
        this.halvesX = halvesX;
        this.halvesY = halvesY;
        this.magickName = magickName;
    }

    /** The ImageMagick spelling, e.g. {@code NorthWest}. */
    public String magickName() {
        return magickName;
    }

    /** The kebab-case spelling, e.g. {@code north-west}. */
    public String id() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Parses a gravity name. Accepts kebab-case ({@code north-west}), snake case, CamelCase
     * ({@code NorthWest}) and the {@code centre} spelling, case-insensitively. A {@link Gravity}
     * value is returned unchanged.
     *
     * @throws InvalidGravityException for anything else
     */
    public static Gravity parse(Object value) {
        if (value instanceof Gravity gravity) {
            return gravity;
        }
        if (value == null) {
            throw new InvalidGravityException("gravity must not be null (valid: " + validNames() + ")", null);
        }
        String raw = value.toString().trim();
        String key = raw.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
        if ("centre".equals(key)) {
            return CENTER;
        }
        for (Gravity gravity : values()) {
            if (gravity.name().replace("_", "").toLowerCase(Locale.ROOT).equals(key)) {
                return gravity;
            }
        }
        throw new InvalidGravityException("invalid gravity value: '" + raw + "' (valid: " + validNames() + ")", raw);
    }

    /**
     * Top-left offset of a {@code width x height} element placed inside a {@code boxWidth x
     * boxHeight} box. Odd free space is rounded down.
     *
     * @throws GeometryException if the element is larger than the box
     */
    public Offset offset(int boxWidth, int boxHeight, int width, int height) {
        if (width > boxWidth || height > boxHeight) {
            throw new GeometryException("image is larger than specified dimensions: " + width + "x" + height
                    + " does not fit in " + boxWidth + "x" + boxHeight);
        }
        int dx = boxWidth - width;
        int dy = boxHeight - height;
        return new Offset(dx * halvesX / 2, dy * halvesY / 2);
    }

    private static String validNames() {
        return Arrays.stream(values()).map(Gravity::id).collect(Collectors.joining(", "));
    }
}
