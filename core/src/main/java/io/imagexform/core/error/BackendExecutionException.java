package io.imagexform.core.error;

/**
 * Wraps a native failure of the underlying engine: corrupt input, exceeded resource limit,
 * unsupported format. The engine's message is carried unmodified; the core never retries.
 */
public final class BackendExecutionException extends ImageXformException {

    private static final long serialVersionUID = 1L;

    private final String engineId;

    public BackendExecutionException(String message, String engineId, Phase phase) {
        super(message, phase);
        this.engineId = engineId;
    }

    public BackendExecutionException(String message, Throwable cause, String engineId, Phase phase) {
        super(message, cause, phase);
        this.engineId = engineId;
    }

    /** Identifier of the engine that failed. */
    public String engineId() {
        return engineId;
    }
}
