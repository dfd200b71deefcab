package io.imagexform.core.spi;

import io.imagexform.core.engine.OperationResolver;
import io.imagexform.core.model.OperationArgs;
import io.imagexform.core.model.Source;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Pluggable image engine SPI. An adapter wraps one concrete image-processing backend (a
 * command-line raster tool, an in-process imaging library) behind the same four operations:
 * load, apply, save and accepted-options.
 *
 * <p>
 * Adapters MUST be stateless with respect to individual executions: the accumulator returned
 * by {@link #load} belongs to one pipeline run and is never shared.
 *
 * @param <A> the engine's accumulator type, the mutable in-flight image handle
 */
public interface EngineAdapter<A> {

    /**
     * Returns the engine identifier, e.g. {@code "magick"} or {@code "java2d"}.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /** The accumulator class; a source that is an instance of it is used as-is. */
    Class<A> accumulatorType();

    /** The engine's macro and primitive registry. */
    OperationTable<A> operations();

    /**
     * Resolves the source into a fresh accumulator, applying loader options.
     *
     * @throws io.imagexform.core.error.InvalidSourceException if the source is neither a supported
     *     handle nor a loadable path
     * @throws io.imagexform.core.error.BackendExecutionException if the engine fails to decode
     */
    A load(Source source, Map<String, Object> loaderOptions);

    /**
     * Applies one named operation: the macro registered under {@code name}, else the primitive of
     * the same name.
     *
     * @throws io.imagexform.core.error.UnknownOperationException if the name is registered as
     *     neither
     */
    default A apply(String name, A accumulator, OperationArgs args, ImageCallback<A> callback) {
        return OperationResolver.apply(this, name, accumulator, args, callback);
    }

    /**
     * Writes the accumulator to the destination path.
     *
     * @param format the destination format resolved for this execution
     * @throws io.imagexform.core.error.BackendExecutionException wrapping the engine's native
     *     error on unsupported format, corrupt data or resource-limit violations
     */
    void save(A accumulator, Path destination, String format, Map<String, Object> saverOptions);

    /**
     * Returns the option names the engine accepts for the given side and format. Options outside
     * this set are dropped by the executor instead of failing.
     *
     * @param format the source format (loader side) or destination format (saver side); may be
     *     null when unknown
     */
    Set<String> acceptedOptions(OptionKind kind, String format);

    /**
     * Character that replaces underscores when nested option groups are flattened into
     * {@code namespace:key} atoms. Defaults to {@code '_'}, which leaves keys unchanged.
     */
    default char optionSeparator() {
        return '_';
    }
}
