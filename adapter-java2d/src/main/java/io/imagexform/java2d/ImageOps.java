package io.imagexform.java2d;

import io.imagexform.core.color.Rgba;
import io.imagexform.core.error.GeometryException;
import io.imagexform.core.geometry.Dimensions;
import io.imagexform.core.geometry.Offset;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.util.function.IntUnaryOperator;

/**
 * Pixel-level primitives over {@link BufferedImage}. Every method returns a new image and leaves
 * its input untouched.
 */
final class ImageOps {

    private ImageOps() {
        // utility class
    }

    static BufferedImage scale(BufferedImage src, Dimensions size) {
        if (src.getWidth() == size.width() && src.getHeight() == size.height()) {
            return src;
        }
        BufferedImage dst = new BufferedImage(size.width(), size.height(), typeFor(src));
        Graphics2D g = dst.createGraphics();
        try {
            qualityHints(g);
            g.drawImage(src, 0, 0, size.width(), size.height(), null);
        } finally {
            g.dispose();
        }
        return dst;
    }

    /**
     * Extracts a region.
     *
     * @throws GeometryException if the region is empty or reaches outside the image
     */
    static BufferedImage crop(BufferedImage src, int left, int top, int width, int height) {
        if (left < 0 || top < 0 || width <= 0 || height <= 0
                || left + width > src.getWidth() || top + height > src.getHeight()) {
            throw new GeometryException("crop area " + width + "x" + height + "+" + left + "+" + top
                    + " is outside the " + src.getWidth() + "x" + src.getHeight() + " image");
        }
        BufferedImage dst = new BufferedImage(width, height, typeFor(src));
        Graphics2D g = dst.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(src, 0, 0, width, height, left, top, left + width, top + height, null);
        } finally {
            g.dispose();
        }
        return dst;
    }

    /** Places {@code src} at {@code offset} on a {@code width x height} canvas of {@code background}. */
    static BufferedImage embed(BufferedImage src, int width, int height, Offset offset, Rgba background) {
        BufferedImage dst = new BufferedImage(width, height, canvasType(src, background));
        Graphics2D g = dst.createGraphics();
        try {
            fill(g, width, height, background);
            g.setComposite(AlphaComposite.SrcOver);
            g.drawImage(src, offset.x(), offset.y(), null);
        } finally {
            g.dispose();
        }
        return dst;
    }

    /**
     * Rotates clockwise. Multiples of 90 degrees move pixels without resampling; any other angle
     * grows the canvas to the rotated bounds and fills the uncovered corners with
     * {@code background}.
     */
    static BufferedImage rotate(BufferedImage src, double degrees, Rgba background) {
        double normalized = ((degrees % 360) + 360) % 360;
        if (normalized == 0) {
            return src;
        }
        if (normalized % 90 == 0) {
            return rotateQuadrants(src, (int) (normalized / 90));
        }
        double radians = Math.toRadians(normalized);
        double sin = Math.abs(Math.sin(radians));
        double cos = Math.abs(Math.cos(radians));
        int w = src.getWidth();
        int h = src.getHeight();
        int newW = (int) Math.ceil(w * cos + h * sin - 1e-9);
        int newH = (int) Math.ceil(h * cos + w * sin - 1e-9);

        AffineTransform at = new AffineTransform();
        at.translate(newW / 2.0, newH / 2.0);
        at.rotate(radians);
        at.translate(-w / 2.0, -h / 2.0);

        BufferedImage dst = new BufferedImage(newW, newH, canvasType(src, background));
        Graphics2D g = dst.createGraphics();
        try {
            fill(g, newW, newH, background);
            g.setComposite(AlphaComposite.SrcOver);
            qualityHints(g);
            g.drawImage(src, at, null);
        } finally {
            g.dispose();
        }
        return dst;
    }

    /** Draws {@code overlay} over {@code base} at {@code offset}; parts outside the base are clipped. */
    static BufferedImage composite(BufferedImage base, BufferedImage overlay, Offset offset) {
        BufferedImage dst = new BufferedImage(base.getWidth(), base.getHeight(), typeFor(base));
        Graphics2D g = dst.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(base, 0, 0, null);
            g.setComposite(AlphaComposite.SrcOver);
            g.drawImage(overlay, offset.x(), offset.y(), null);
        } finally {
            g.dispose();
        }
        return dst;
    }

    /** Top-bottom mirror. */
    static BufferedImage flip(BufferedImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        BufferedImage dst = new BufferedImage(w, h, typeFor(src));
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                dst.setRGB(x, h - 1 - y, src.getRGB(x, y));
            }
        }
        return dst;
    }

    /** Left-right mirror. */
    static BufferedImage flop(BufferedImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        BufferedImage dst = new BufferedImage(w, h, typeFor(src));
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                dst.setRGB(w - 1 - x, y, src.getRGB(x, y));
            }
        }
        return dst;
    }

    /** Luma (Rec. 601) in all three channels; alpha is kept. */
    static BufferedImage grayscale(BufferedImage src) {
        return mapPixels(src, argb -> {
            int r = (argb >> 16) & 0xFF;
            int g = (argb >> 8) & 0xFF;
            int b = argb & 0xFF;
            int luma = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
            return (argb & 0xFF000000) | (luma << 16) | (luma << 8) | luma;
        });
    }

    /** Negates the color channels; alpha is kept. */
    static BufferedImage invert(BufferedImage src) {
        return mapPixels(src, argb -> argb ^ 0x00FFFFFF);
    }

    /** Composites the image over an opaque background, for formats without an alpha channel. */
    static BufferedImage flatten(BufferedImage src, Color background) {
        BufferedImage dst = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = dst.createGraphics();
        try {
            g.setColor(background);
            g.fillRect(0, 0, src.getWidth(), src.getHeight());
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return dst;
    }

    static boolean hasAlpha(BufferedImage image) {
        return image.getColorModel().hasAlpha();
    }

    private static BufferedImage rotateQuadrants(BufferedImage src, int quarters) {
        int w = src.getWidth();
        int h = src.getHeight();
        boolean swap = quarters % 2 == 1;
        BufferedImage dst = new BufferedImage(swap ? h : w, swap ? w : h, typeFor(src));
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int argb = src.getRGB(x, y);
                switch (quarters) {
                    case 1 -> dst.setRGB(h - 1 - y, x, argb);
                    case 2 -> dst.setRGB(w - 1 - x, h - 1 - y, argb);
                    default -> dst.setRGB(y, w - 1 - x, argb);
                }
            }
        }
        return dst;
    }

    private static BufferedImage mapPixels(BufferedImage src, IntUnaryOperator op) {
        int w = src.getWidth();
        int h = src.getHeight();
        BufferedImage dst = new BufferedImage(w, h, typeFor(src));
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                dst.setRGB(x, y, op.applyAsInt(src.getRGB(x, y)));
            }
        }
        return dst;
    }

    private static void fill(Graphics2D g, int width, int height, Rgba background) {
        g.setComposite(AlphaComposite.Src);
        g.setColor(new Color(background.toArgb(), true));
        g.fillRect(0, 0, width, height);
    }

    private static void qualityHints(Graphics2D g) {
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
    }

    private static int canvasType(BufferedImage src, Rgba background) {
        return hasAlpha(src) || !background.isOpaque() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
    }

    // packed int layouts keep getRGB/setRGB lossless for 8-bit sources
    private static int typeFor(BufferedImage src) {
        return hasAlpha(src) ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
    }
}
