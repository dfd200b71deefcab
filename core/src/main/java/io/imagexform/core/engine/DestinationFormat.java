package io.imagexform.core.engine;

import io.imagexform.core.model.Source;
import java.nio.file.Path;

/**
 * Resolves the output format of an execution. Precedence: explicit format, then the destination
 * path's extension, then the source path's extension, then {@value #DEFAULT_FORMAT}.
 *
 * <p>
 * Computed once per execution; the result names the temporary file and selects the saver
 * options the engine accepts.
 */
public final class DestinationFormat {

    /** Format used when nothing else determines one. */
    public static final String DEFAULT_FORMAT = "jpg";

    private DestinationFormat() {
        // utility class
    }

    public static String resolve(String format, Path destination, Source source) {
        if (format != null && !format.isBlank()) {
            return format;
        }
        String fromDestination = extension(destination);
        if (fromDestination != null) {
            return fromDestination;
        }
        String fromSource = source != null && source.isPath() ? extension(source.path()) : null;
        if (fromSource != null) {
            return fromSource;
        }
        return DEFAULT_FORMAT;
    }

    /** The extension of the path's file name without the dot, or {@code null} if it has none. */
    public static String extension(Path path) {
        if (path == null || path.getFileName() == null) {
            return null;
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return null;
        }
        return name.substring(dot + 1);
    }
}
