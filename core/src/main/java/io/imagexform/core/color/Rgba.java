package io.imagexform.core.color;

import io.imagexform.core.error.InvalidColorException;
import java.util.Locale;

/**
 * An 8-bit RGBA color. {@code alpha} is 0 (fully transparent) to 255 (opaque).
 */
public record Rgba(int red, int green, int blue, int alpha) {

    /** The transparent background used when none is specified. */
    public static final Rgba TRANSPARENT = new Rgba(255, 255, 255, 0);

    public Rgba {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
        checkChannel("alpha", alpha);
    }

    public static Rgba opaque(int red, int green, int blue) {
        return new Rgba(red, green, blue, 255);
    }

    public boolean isOpaque() {
        return alpha == 255;
    }

    /** ImageMagick color syntax: {@code rgb(r,g,b)} or {@code rgba(r,g,b,a)} with alpha in 0..1. */
    public String toMagick() {
        if (isOpaque()) {
            return "rgb(" + red + "," + green + "," + blue + ")";
        }
        return "rgba(" + red + "," + green + "," + blue + "," + String.format(Locale.ROOT, "%.1f", alpha / 255.0) + ")";
    }

    /** Packed {@code 0xAARRGGBB}, the layout of {@code java.awt.Color#getRGB()}. */
    public int toArgb() {
        return (alpha << 24) | (red << 16) | (green << 8) | blue;
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new InvalidColorException(name + " channel out of range 0..255: " + value);
        }
    }
}
