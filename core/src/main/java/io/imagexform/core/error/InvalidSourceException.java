package io.imagexform.core.error;

/** Thrown when the pipeline source is missing, or is neither a loadable path nor an engine handle. */
public final class InvalidSourceException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public InvalidSourceException(String message) {
        super(message, Phase.LOAD);
    }

    public InvalidSourceException(String message, Throwable cause) {
        super(message, cause, Phase.LOAD);
    }
}
