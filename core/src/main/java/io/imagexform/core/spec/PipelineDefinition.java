package io.imagexform.core.spec;

import io.imagexform.core.builder.ImagePipeline;
import java.util.List;
import java.util.Map;

/**
 * A pipeline described as data, typically parsed from YAML by {@link PipelineDefinitionParser}.
 * Immutable.
 *
 * @param format output format, or null
 * @param loaderOptions loader options
 * @param saverOptions saver options
 * @param operations ordered {@code (name, argument)} pairs, fanned out by
 *     {@link ImagePipeline#apply(List)}
 */
public record PipelineDefinition(
        String format,
        Map<String, Object> loaderOptions,
        Map<String, Object> saverOptions,
        List<Map.Entry<String, Object>> operations) {

    public PipelineDefinition {
        loaderOptions = loaderOptions == null ? Map.of() : loaderOptions;
        saverOptions = saverOptions == null ? Map.of() : saverOptions;
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    /** Applies this definition onto {@code base}, preserving operation order. */
    public <A> ImagePipeline<A> applyTo(ImagePipeline<A> base) {
        ImagePipeline<A> pipeline = base.loader(loaderOptions).saver(saverOptions);
        if (format != null) {
            pipeline = pipeline.convert(format);
        }
        return pipeline.apply(operations);
    }
}
