package io.imagexform.core.error;

/** Thrown for a gravity name outside the nine recognized anchors. */
public final class InvalidGravityException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String gravity;

    public InvalidGravityException(String message, String gravity) {
        super(message, Phase.TRANSFORM);
        this.gravity = gravity;
    }

    /** The rejected gravity value, as given by the caller. */
    public String gravity() {
        return gravity;
    }
}
