package io.imagexform.core.error;

/** Thrown when a YAML pipeline definition has invalid syntax or unknown keys. */
public final class PipelineDefinitionException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public PipelineDefinitionException(String message, String source) {
        super(message, Phase.BUILD);
        this.source = source;
    }

    public PipelineDefinitionException(String message, Throwable cause, String source) {
        super(message, cause, Phase.BUILD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
