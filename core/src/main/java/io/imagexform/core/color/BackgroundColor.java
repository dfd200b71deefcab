package io.imagexform.core.color;

import io.imagexform.core.error.InvalidColorException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Normalizes the background values accepted by the padding and rotation macros into an
 * {@link Rgba}, which each engine then renders in its own format.
 *
 * <p>
 * Accepted inputs:
 * <ul>
 *   <li>the {@code "transparent"} token (also {@code "none"})
 *   <li>a named color ({@link NamedColors})
 *   <li>a hex string: {@code #rgb}, {@code #rrggbb} or {@code #rrggbbaa}
 *   <li>a 3- or 4-component channel array ({@code int[]} or a {@link List} of numbers), each
 *       channel 0..255
 *   <li>an {@link Rgba}, returned unchanged
 * </ul>
 */
public final class BackgroundColor {

    private BackgroundColor() {
        // utility class
    }

    /**
     * Normalizes a background value.
     *
     * @throws InvalidColorException for unrecognized names and arrays of any other arity
     */
    public static Rgba normalize(Object value) {
        if (value == null) {
            throw new InvalidColorException("background color must not be null");
        }
        if (value instanceof Rgba rgba) {
            return rgba;
        }
        if (value instanceof int[] channels) {
            List<Object> list = new ArrayList<>(channels.length);
            for (int channel : channels) {
                list.add(channel);
            }
            return fromChannels(list);
        }
        if (value instanceof List<?> list) {
            return fromChannels(list);
        }
        if (value instanceof CharSequence || value instanceof Enum<?>) {
            return fromString(value.toString());
        }
        throw new InvalidColorException(
                "unsupported background value of type " + value.getClass().getSimpleName() + ": " + value);
    }

    /** Same as {@link #normalize} but maps {@code null} to {@link Rgba#TRANSPARENT}. */
    public static Rgba normalizeOrTransparent(Object value) {
        return value == null ? Rgba.TRANSPARENT : normalize(value);
    }

    private static Rgba fromString(String raw) {
        String value = raw.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if ("transparent".equals(lower) || "none".equals(lower)) {
            return Rgba.TRANSPARENT;
        }
        if (value.startsWith("#")) {
            return fromHex(value);
        }
        return NamedColors.lookup(value)
                .orElseThrow(() -> new InvalidColorException("unknown color name: '" + raw + "'"));
    }

    private static Rgba fromHex(String value) {
        String hex = value.substring(1);
        try {
            switch (hex.length()) {
                case 3:
                    return Rgba.opaque(
                            Integer.parseInt(hex.substring(0, 1), 16) * 17,
                            Integer.parseInt(hex.substring(1, 2), 16) * 17,
                            Integer.parseInt(hex.substring(2, 3), 16) * 17);
                case 6:
                    return Rgba.opaque(
                            Integer.parseInt(hex.substring(0, 2), 16),
                            Integer.parseInt(hex.substring(2, 4), 16),
                            Integer.parseInt(hex.substring(4, 6), 16));
                case 8:
                    return new Rgba(
                            Integer.parseInt(hex.substring(0, 2), 16),
                            Integer.parseInt(hex.substring(2, 4), 16),
                            Integer.parseInt(hex.substring(4, 6), 16),
                            Integer.parseInt(hex.substring(6, 8), 16));
                default:
                    throw new InvalidColorException("invalid hex color: '" + value + "'");
            }
        } catch (NumberFormatException e) {
            throw new InvalidColorException("invalid hex color: '" + value + "'");
        }
    }

    private static Rgba fromChannels(List<?> channels) {
        if (channels.size() != 3 && channels.size() != 4) {
            throw new InvalidColorException(
                    "background color array must have 3 or 4 components, got " + channels.size());
        }
        int[] values = new int[4];
        values[3] = 255;
        for (int i = 0; i < channels.size(); i++) {
            Object channel = channels.get(i);
            if (!(channel instanceof Number number)) {
                throw new InvalidColorException("color channel " + i + " is not a number: " + channel);
            }
            values[i] = (int) Math.round(number.doubleValue());
        }
        return new Rgba(values[0], values[1], values[2], values[3]);
    }
}
