package io.imagexform.standalone.app;

import java.nio.file.Path;

/**
 * Parsed command-line arguments.
 *
 * <pre>
 * --source photo.jpg [--destination thumb.png] [--definition pipeline.yaml] [--config image-xform.yaml]
 * </pre>
 *
 * @param source      image to process (required)
 * @param destination where to write the result; null writes to a temporary file
 * @param definition  pipeline definition; null falls back to the configured one
 */
public record CommandLine(Path source, Path destination, Path definition) {

    static final String USAGE = "usage: image-xform --source <image> [--destination <file>]"
            + " [--definition <pipeline.yaml>] [--config <image-xform.yaml>]";

    /**
     * Parses the arguments. {@code --config} is accepted and skipped; it is resolved separately.
     *
     * @throws IllegalArgumentException on an unknown flag, a flag without value or a missing source
     */
    public static CommandLine parse(String[] args) {
        Path source = null;
        Path destination = null;
        Path definition = null;
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException(flag + " requires a value. " + USAGE);
            }
            Path value = Path.of(args[++i]);
            switch (flag) {
                case "--source" -> source = value;
                case "--destination" -> destination = value;
                case "--definition" -> definition = value;
                case "--config" -> {
                    // resolved by ConfigLoader
                }
                default -> throw new IllegalArgumentException("unknown argument '" + flag + "'. " + USAGE);
            }
        }
        if (source == null) {
            throw new IllegalArgumentException("--source is required. " + USAGE);
        }
        return new CommandLine(source, destination, definition);
    }
}
