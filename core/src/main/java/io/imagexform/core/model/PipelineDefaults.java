package io.imagexform.core.model;

import io.imagexform.core.spi.EngineAdapter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-constructed defaults passed to the builder entry point: the engine new pipelines bind
 * to, plus default loader options, saver options and format.
 *
 * @param backend the engine to bind on the first operation, or null for an unbound template
 * @param loaderOptions default loader options
 * @param saverOptions default saver options
 * @param format default output format, or null
 */
public record PipelineDefaults<A>(
        EngineAdapter<A> backend, Map<String, Object> loaderOptions, Map<String, Object> saverOptions, String format) {

    public PipelineDefaults {
        loaderOptions = copy(loaderOptions);
        saverOptions = copy(saverOptions);
    }

    /** Defaults that only name the engine. */
    public static <A> PipelineDefaults<A> of(EngineAdapter<A> backend) {
        return new PipelineDefaults<>(backend, Map.of(), Map.of(), null);
    }

    /** Defaults without an engine; pipelines built from them must be bound before execution. */
    public static <A> PipelineDefaults<A> unbound() {
        return new PipelineDefaults<>(null, Map.of(), Map.of(), null);
    }

    private static Map<String, Object> copy(Map<String, Object> options) {
        return options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }
}
