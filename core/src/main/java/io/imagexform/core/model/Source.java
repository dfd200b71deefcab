package io.imagexform.core.model;

import java.io.File;
import java.nio.file.Path;

/**
 * The input of a pipeline: unset, a file path, or an already-open engine handle.
 *
 * <p>
 * A {@link Kind#HANDLE} source is not validated when it is set; the executor checks it against
 * the bound engine's accumulator type at execution time, so a template can be built before the
 * engine is known.
 */
public record Source(Kind kind, Path path, Object handle) {

    /** Source variant. */
    public enum Kind {
        UNSET,
        PATH,
        HANDLE
    }

    private static final Source UNSET = new Source(Kind.UNSET, null, null);

    public Source {
        if (kind == null) {
            throw new NullPointerException("kind must not be null");
        }
    }

    /** The unset source every pipeline starts with. */
    public static Source unset() {
        return UNSET;
    }

    /**
     * Classifies a caller-supplied value. {@link Path}, {@link File} and {@link String} are paths;
     * {@code null} is unset; anything else is an engine handle.
     */
    public static Source of(Object value) {
        if (value == null) {
            return UNSET;
        }
        if (value instanceof Source source) {
            return source;
        }
        if (value instanceof Path path) {
            return new Source(Kind.PATH, path, null);
        }
        if (value instanceof File file) {
            return new Source(Kind.PATH, file.toPath(), null);
        }
        if (value instanceof String string) {
            return new Source(Kind.PATH, Path.of(string), null);
        }
        return new Source(Kind.HANDLE, null, value);
    }

    public boolean isUnset() {
        return kind == Kind.UNSET;
    }

    public boolean isPath() {
        return kind == Kind.PATH;
    }

    public boolean isHandle() {
        return kind == Kind.HANDLE;
    }
}
