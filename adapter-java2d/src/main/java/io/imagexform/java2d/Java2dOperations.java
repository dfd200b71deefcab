package io.imagexform.java2d;

import io.imagexform.core.color.BackgroundColor;
import io.imagexform.core.color.Rgba;
import io.imagexform.core.error.ConfigurationException;
import io.imagexform.core.error.ImageXformException.Phase;
import io.imagexform.core.geometry.Dimensions;
import io.imagexform.core.geometry.Gravity;
import io.imagexform.core.geometry.Offset;
import io.imagexform.core.model.OperationArgs;
import io.imagexform.core.model.Source;
import io.imagexform.core.spi.OperationTable;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Map;

/** The macros and pass-through primitives of the Java2D engine. */
final class Java2dOperations {

    private final Java2dLoader loader;

    Java2dOperations(Java2dLoader loader) {
        this.loader = loader;
    }

    OperationTable<BufferedImage> table() {
        return new OperationTable<BufferedImage>()
                .registerMacro("resize_to_limit", (image, args, callback) -> resizeToLimit(image, args))
                .registerMacro("resize_to_fit", (image, args, callback) -> resizeToFit(image, args))
                .registerMacro("resize_to_fill", (image, args, callback) -> resizeToFill(image, args))
                .registerMacro("resize_and_pad", (image, args, callback) -> resizeAndPad(image, args))
                .registerMacro("rotate", (image, args, callback) -> rotate(image, args))
                .registerMacro("crop", (image, args, callback) -> ImageOps.crop(
                        image, args.requireInt(0), args.requireInt(1), args.requireInt(2), args.requireInt(3)))
                .registerMacro("composite", (image, args, callback) -> composite(image, args))
                .registerPrimitive("flip", (image, args) -> ImageOps.flip(image))
                .registerPrimitive("flop", (image, args) -> ImageOps.flop(image))
                .registerPrimitive("grayscale", (image, args) -> ImageOps.grayscale(image))
                .registerPrimitive("invert", (image, args) -> ImageOps.invert(image))
                .registerPrimitive("width", (image, args) -> image.getWidth())
                .registerPrimitive("height", (image, args) -> image.getHeight());
    }

    private static BufferedImage resizeToLimit(BufferedImage image, OperationArgs args) {
        Dimensions box = box(image, args);
        return ImageOps.scale(image, Dimensions.limit(image.getWidth(), image.getHeight(), box.width(), box.height()));
    }

    private static BufferedImage resizeToFit(BufferedImage image, OperationArgs args) {
        Dimensions box = box(image, args);
        return ImageOps.scale(image, Dimensions.fit(image.getWidth(), image.getHeight(), box.width(), box.height()));
    }

    private static BufferedImage resizeToFill(BufferedImage image, OperationArgs args) {
        int width = args.requireInt(0);
        int height = args.requireInt(1);
        Gravity gravity = gravity(args);

        BufferedImage scaled =
                ImageOps.scale(image, Dimensions.fill(image.getWidth(), image.getHeight(), width, height));
        Offset offset = gravity.offset(scaled.getWidth(), scaled.getHeight(), width, height);
        return ImageOps.crop(scaled, offset.x(), offset.y(), width, height);
    }

    private static BufferedImage resizeAndPad(BufferedImage image, OperationArgs args) {
        int width = args.requireInt(0);
        int height = args.requireInt(1);
        Gravity gravity = gravity(args);
        Rgba background = background(args);

        BufferedImage scaled =
                ImageOps.scale(image, Dimensions.fit(image.getWidth(), image.getHeight(), width, height));
        Offset offset = gravity.offset(width, height, scaled.getWidth(), scaled.getHeight());
        return ImageOps.embed(scaled, width, height, offset, background);
    }

    private static BufferedImage rotate(BufferedImage image, OperationArgs args) {
        double degrees = args.requireDouble(0);
        Rgba background = background(args);
        return ImageOps.rotate(image, degrees, background);
    }

    private BufferedImage composite(BufferedImage image, OperationArgs args) {
        BufferedImage overlay = overlay(args.get(0));
        Offset position = new Offset(0, 0);
        if (args.hasOption("gravity")) {
            position = Gravity.parse(args.option("gravity"))
                    .offset(image.getWidth(), image.getHeight(), overlay.getWidth(), overlay.getHeight());
        }
        Object shift = args.option("offset");
        if (shift != null) {
            Offset extra = offset(shift);
            position = new Offset(position.x() + extra.x(), position.y() + extra.y());
        }
        return ImageOps.composite(image, overlay, position);
    }

    private BufferedImage overlay(Object value) {
        if (value instanceof BufferedImage image) {
            return image;
        }
        Source source = Source.of(value);
        if (!source.isPath()) {
            throw new ConfigurationException(
                    "composite: overlay must be an image path or a BufferedImage, got " + value, Phase.TRANSFORM);
        }
        return loader.load(source.path(), Map.of());
    }

    private static Offset offset(Object value) {
        if (value instanceof List<?> list && list.size() == 2
                && list.get(0) instanceof Number x && list.get(1) instanceof Number y) {
            return new Offset(x.intValue(), y.intValue());
        }
        if (value instanceof int[] pair && pair.length == 2) {
            return new Offset(pair[0], pair[1]);
        }
        throw new ConfigurationException("composite: offset must be [x, y], got " + value, Phase.TRANSFORM);
    }

    private static Dimensions box(BufferedImage image, OperationArgs args) {
        return Dimensions.infer(args.intOrNull(0), args.intOrNull(1), image.getWidth(), image.getHeight());
    }

    /** The {@code gravity} option, {@link Gravity#CENTER} when absent; an explicit null is invalid. */
    private static Gravity gravity(OperationArgs args) {
        return args.hasOption("gravity") ? Gravity.parse(args.option("gravity")) : Gravity.CENTER;
    }

    /** The {@code background} option, transparent when absent; an explicit null is invalid. */
    private static Rgba background(OperationArgs args) {
        return args.hasOption("background") ? BackgroundColor.normalize(args.option("background")) : Rgba.TRANSPARENT;
    }
}
