package io.imagexform.core.error;

/** Thrown for an unrecognized color name or a channel array of the wrong arity. */
public final class InvalidColorException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public InvalidColorException(String message) {
        super(message, Phase.TRANSFORM);
    }
}
