package io.imagexform.core.model;

import java.nio.file.Path;

/**
 * Terminal value of one execution: the saved file, or the raw accumulator when saving was
 * suppressed. Exactly one of {@link #path()} and {@link #accumulator()} is non-null.
 */
public record PipelineResult<A>(Path path, A accumulator) {

    public static <A> PipelineResult<A> saved(Path path) {
        return new PipelineResult<>(path, null);
    }

    public static <A> PipelineResult<A> raw(A accumulator) {
        return new PipelineResult<>(null, accumulator);
    }

    public boolean isSaved() {
        return path != null;
    }
}
