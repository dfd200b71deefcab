package io.imagexform.magick;

import io.imagexform.core.color.BackgroundColor;
import io.imagexform.core.color.Rgba;
import io.imagexform.core.error.ConfigurationException;
import io.imagexform.core.error.GeometryException;
import io.imagexform.core.error.ImageXformException.Phase;
import io.imagexform.core.geometry.Gravity;
import io.imagexform.core.model.OperationArgs;
import io.imagexform.core.model.Source;
import io.imagexform.core.spi.OperationTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The macros of the ImageMagick engine, plus one pass-through primitive per
 * {@linkplain MagickOptions#NAMES known option}. Every operation appends arguments to the command;
 * none of them runs anything.
 */
final class MagickOperations {

    private MagickOperations() {
        // utility class
    }

    static OperationTable<MagickCommand> table() {
        OperationTable<MagickCommand> table = new OperationTable<MagickCommand>()
                .registerMacro("resize_to_limit", (command, args, callback) ->
                        command.option("resize", geometry(args) + ">"))
                .registerMacro("resize_to_fit", (command, args, callback) ->
                        command.option("resize", geometry(args)))
                .registerMacro("resize_to_fill", (command, args, callback) -> resizeToFill(command, args))
                .registerMacro("resize_and_pad", (command, args, callback) -> resizeAndPad(command, args))
                .registerMacro("rotate", (command, args, callback) -> rotate(command, args))
                .registerMacro("crop", (command, args, callback) -> crop(command, args))
                .registerMacro("composite", (command, args, callback) -> composite(command, args))
                .registerMacro("define", (command, args, callback) -> define(command, args))
                .registerMacro("limits", (command, args, callback) -> limits(command, args))
                .registerMacro("append", (command, args, callback) -> command.append(raw(args)));
        for (String name : MagickOptions.NAMES) {
            table.registerPrimitive(name, MagickOperations::passThrough);
        }
        return table;
    }

    private static MagickCommand resizeToFill(MagickCommand command, OperationArgs args) {
        String size = args.requireInt(0) + "x" + args.requireInt(1);
        Gravity gravity = gravity(args);
        return command
                .option("resize", size + "^")
                .option("gravity", gravity.magickName())
                .option("background", Rgba.TRANSPARENT.toMagick())
                .option("extent", size);
    }

    private static MagickCommand resizeAndPad(MagickCommand command, OperationArgs args) {
        String size = args.requireInt(0) + "x" + args.requireInt(1);
        Gravity gravity = gravity(args);
        Rgba background = background(args);
        return command
                .option("resize", size)
                .option("background", background.toMagick())
                .option("gravity", gravity.magickName())
                .option("extent", size);
    }

    private static MagickCommand rotate(MagickCommand command, OperationArgs args) {
        double degrees = args.requireDouble(0);
        if (args.hasOption("background")) {
            command = command.option("background", BackgroundColor.normalize(args.option("background")).toMagick());
        }
        return command.option("rotate", degrees);
    }

    private static MagickCommand crop(MagickCommand command, OperationArgs args) {
        int left = args.requireInt(0);
        int top = args.requireInt(1);
        int width = args.requireInt(2);
        int height = args.requireInt(3);
        if (width <= 0 || height <= 0) {
            throw new GeometryException("crop size must be positive, got " + width + "x" + height);
        }
        return command
                .option("crop", width + "x" + height + offset(left, top))
                .option("repage", Boolean.FALSE);
    }

    private static MagickCommand composite(MagickCommand command, OperationArgs args) {
        Source overlay = Source.of(args.get(0));
        if (!overlay.isPath()) {
            throw new ConfigurationException(
                    "composite: overlay must be an image path, got " + args.get(0), Phase.TRANSFORM);
        }
        MagickCommand next = command.append(overlay.path().toString());
        if (args.hasOption("mode")) {
            next = next.option("compose", args.option("mode"));
        }
        if (args.hasOption("gravity")) {
            next = next.option("gravity", Gravity.parse(args.option("gravity")).magickName());
        }
        Object shift = args.option("offset");
        if (shift != null) {
            if (!(shift instanceof List<?> pair && pair.size() == 2
                    && pair.get(0) instanceof Number x && pair.get(1) instanceof Number y)) {
                throw new ConfigurationException("composite: offset must be [x, y], got " + shift, Phase.TRANSFORM);
            }
            next = next.option("geometry", offset(x.intValue(), y.intValue()));
        }
        return next.option("composite", null);
    }

    private static MagickCommand define(MagickCommand command, OperationArgs args) {
        Object value = mapArgument(args);
        if (value instanceof Map<?, ?> map) {
            return command.append(MagickFlags.defines(map));
        }
        return command.option("define", value);
    }

    private static MagickCommand limits(MagickCommand command, OperationArgs args) {
        if (!(mapArgument(args) instanceof Map<?, ?> limits)) {
            throw new ConfigurationException("limits: expected a map of resource limits", Phase.TRANSFORM);
        }
        List<String> rendered = new ArrayList<>();
        limits.forEach((resource, value) -> {
            rendered.add("-limit");
            rendered.add(MagickFlags.flag(String.valueOf(resource)));
            rendered.add(MagickFlags.format(value));
        });
        return command.append(rendered);
    }

    private static Object passThrough(MagickCommand command, OperationArgs args) {
        String name = args.operation();
        return switch (args.size()) {
            case 0 -> command.option(name, null);
            case 1 -> command.option(name, args.get(0));
            default -> command.option(name, args.positional());
        };
    }

    /** A single map argument arrives as the operation's named options. */
    private static Object mapArgument(OperationArgs args) {
        return args.size() == 0 && !args.options().isEmpty() ? args.options() : args.get(0);
    }

    private static List<String> raw(OperationArgs args) {
        List<String> arguments = new ArrayList<>(args.size());
        args.positional().forEach(argument -> arguments.add(MagickFlags.format(argument)));
        return arguments;
    }

    /** {@code WxH}, leaving out a missing side: {@code 400x}, {@code x300}. */
    static String geometry(OperationArgs args) {
        Integer width = args.intOrNull(0);
        Integer height = args.intOrNull(1);
        if (width == null && height == null) {
            throw new GeometryException("either width or height must be specified");
        }
        return (width == null ? "" : width.toString()) + "x" + (height == null ? "" : height.toString());
    }

    private static String offset(int x, int y) {
        return (x < 0 ? "" : "+") + x + (y < 0 ? "" : "+") + y;
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
