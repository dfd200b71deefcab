package io.imagexform.core.error;

/**
 * Abstract base for all image-xform exceptions. Never thrown directly; use one of the concrete
 * subclasses. Every exception records the {@link Phase} of the pipeline in which it was raised.
 */
public abstract class ImageXformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        BUILD,
        LOAD,
        TRANSFORM,
        SAVE,
        CLEANUP
    }

    private final Phase phase;

    protected ImageXformException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ImageXformException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
