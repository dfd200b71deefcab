package io.imagexform.core.geometry;

import io.imagexform.core.error.GeometryException;

/**
 * Width and height in pixels, plus the dimension arithmetic shared by every engine: inferring a
 * missing dimension from the native aspect ratio, and the fit/fill scale computations behind the
 * resize macros.
 */
public record Dimensions(int width, int height) {

    public Dimensions {
        if (width <= 0 || height <= 0) {
            throw new GeometryException("dimensions must be positive, got " + width + "x" + height);
        }
    }

    /**
     * Infers a missing dimension proportionally to the native size, rounding up. If both are given
     * they are returned as-is, whether or not they match the native aspect ratio.
     *
     * @throws GeometryException if neither width nor height is given
     */
    public static Dimensions infer(Integer width, Integer height, int nativeWidth, int nativeHeight) {
        if (width == null && height == null) {
            throw new GeometryException("either width or height must be specified");
        }
        if (width == null) {
            return new Dimensions(ceilDiv((long) nativeWidth * height, nativeHeight), height);
        }
        if (height == null) {
            return new Dimensions(width, ceilDiv((long) nativeHeight * width, nativeWidth));
        }
        return new Dimensions(width, height);
    }

    /**
     * Largest size with the native aspect ratio that fits inside the box. The constraining side
     * matches the box exactly.
     */
    public static Dimensions fit(int nativeWidth, int nativeHeight, int boxWidth, int boxHeight) {
        // compare boxWidth/nativeWidth with boxHeight/nativeHeight without floating point
        if ((long) boxWidth * nativeHeight <= (long) boxHeight * nativeWidth) {
            return new Dimensions(boxWidth, Math.max(1, roundDiv((long) nativeHeight * boxWidth, nativeWidth)));
        }
        return new Dimensions(Math.max(1, roundDiv((long) nativeWidth * boxHeight, nativeHeight)), boxHeight);
    }

    /** Like {@link #fit}, but never larger than the native size. */
    public static Dimensions limit(int nativeWidth, int nativeHeight, int boxWidth, int boxHeight) {
        if (nativeWidth <= boxWidth && nativeHeight <= boxHeight) {
            return new Dimensions(nativeWidth, nativeHeight);
        }
        return fit(nativeWidth, nativeHeight, boxWidth, boxHeight);
    }

    /**
     * Smallest size with the native aspect ratio that covers the box. The covering side matches
     * the box exactly; the other side is at least as large as the box.
     */
    public static Dimensions fill(int nativeWidth, int nativeHeight, int boxWidth, int boxHeight) {
        if ((long) boxWidth * nativeHeight >= (long) boxHeight * nativeWidth) {
            return new Dimensions(boxWidth, Math.max(boxHeight, roundDiv((long) nativeHeight * boxWidth, nativeWidth)));
        }
        return new Dimensions(Math.max(boxWidth, roundDiv((long) nativeWidth * boxHeight, nativeHeight)), boxHeight);
    }

    /** {@code true} if this size fits inside the given box. */
    public boolean fitsWithin(int boxWidth, int boxHeight) {
        return width <= boxWidth && height <= boxHeight;
    }

    private static int ceilDiv(long dividend, long divisor) {
        return (int) ((dividend + divisor - 1) / divisor);
    }

    private static int roundDiv(long dividend, long divisor) {
        return (int) ((2 * dividend + divisor) / (2 * divisor));
    }
}
