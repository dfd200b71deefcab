package io.imagexform.core.error;

/**
 * Thrown when a pipeline is configured incorrectly: missing or invalid source, missing required
 * dimension, invalid gravity, color or background value. Always surfaced synchronously to the
 * caller; never retried.
 */
public class ConfigurationException extends ImageXformException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message, Phase.BUILD);
    }

    public ConfigurationException(String message, Phase phase) {
        super(message, phase);
    }

    public ConfigurationException(String message, Throwable cause, Phase phase) {
        super(message, cause, phase);
    }
}
