package io.imagexform.core.error;

/**
 * Thrown when an operation name resolves to neither a macro nor a primitive of the bound engine,
 * or when a predicate-style name ({@code valid?}) is used as an operation. Never retried.
 */
public final class UnknownOperationException extends ImageXformException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final String engineId;

    public UnknownOperationException(String message, String operation, String engineId, Phase phase) {
        super(message, phase);
        this.operation = operation;
        this.engineId = engineId;
    }

    /** The operation name that failed to resolve. */
    public String operation() {
        return operation;
    }

    /** The engine the name was resolved against, or {@code null} at build time. */
    public String engineId() {
        return engineId;
    }
}
