package io.imagexform.magick;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The accumulator of the ImageMagick engine: an immutable, ordered argument list (without the
 * executable). Operations append to it; nothing runs until the pipeline is saved.
 *
 * <pre>{@code
 * MagickCommand.of("photo.jpg").option("resize", "400x400>").append("-strip")
 * }</pre>
 */
public final class MagickCommand {

    private static final MagickCommand EMPTY = new MagickCommand(List.of());

    private final List<String> arguments;

    private MagickCommand(List<String> arguments) {
        this.arguments = arguments;
    }

    public static MagickCommand empty() {
        return EMPTY;
    }

    public static MagickCommand of(String... arguments) {
        return EMPTY.append(arguments);
    }

    /** Appends raw arguments. */
    public MagickCommand append(String... more) {
        return append(Arrays.asList(more));
    }

    /** Appends raw arguments. */
    public MagickCommand append(List<String> more) {
        if (more.isEmpty()) {
            return this;
        }
        List<String> next = new ArrayList<>(arguments.size() + more.size());
        next.addAll(arguments);
        next.addAll(more);
        return new MagickCommand(Collections.unmodifiableList(next));
    }

    /** Appends an option rendered with {@link MagickFlags#render}. */
    public MagickCommand option(String name, Object value) {
        return append(MagickFlags.render(name, value));
    }

    public List<String> arguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof MagickCommand command && arguments.equals(command.arguments);
    }

    @Override
    public int hashCode() {
        return arguments.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" ", arguments);
    }
}
