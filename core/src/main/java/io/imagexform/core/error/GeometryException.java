package io.imagexform.core.error;

/**
 * Thrown when a geometry computation cannot be satisfied, e.g. placing an element that is larger
 * than the target box, or inferring dimensions when neither width nor height is given.
 */
public final class GeometryException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public GeometryException(String message) {
        super(message, Phase.TRANSFORM);
    }
}
