package io.imagexform.core.error;

import java.nio.file.Path;

/**
 * Best-effort cleanup failure. Attached to the original error as a suppressed exception so that
 * it never masks the error that triggered the rollback.
 */
public final class ResourceCleanupException extends ImageXformException {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public ResourceCleanupException(String message, Throwable cause, Path path) {
        super(message, cause, Phase.CLEANUP);
        this.path = path;
    }

    /** The file that could not be removed. */
    public Path path() {
        return path;
    }
}
