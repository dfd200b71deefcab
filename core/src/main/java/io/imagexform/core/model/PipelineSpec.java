package io.imagexform.core.model;

import io.imagexform.core.error.ConfigurationException;
import io.imagexform.core.spi.EngineAdapter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one pipeline: source, loader and saver options, output format, the
 * ordered operation list, the target engine and an optional destination.
 *
 * <p>
 * Every {@code with*} method returns a new spec. Fields that are not touched are shared with
 * the receiver; option maps are merged with new keys winning; operations are only ever appended.
 * Thread-safe: a spec can be shared as a template across concurrent executions.
 *
 * <p>
 * A spec without a source is legal; the missing source is reported when the spec is executed.
 */
public record PipelineSpec(
        Source source,
        Map<String, Object> loaderOptions,
        Map<String, Object> saverOptions,
        String format,
        List<Operation> operations,
        EngineAdapter<?> backend,
        Path destination) {

    private static final PipelineSpec EMPTY =
            new PipelineSpec(Source.unset(), Map.of(), Map.of(), null, List.of(), null, null);

    /**
     * Validates required fields.
     *
     * @throws NullPointerException if source, an option map or the operation list is null
     */
    public PipelineSpec {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(loaderOptions, "loaderOptions must not be null");
        Objects.requireNonNull(saverOptions, "saverOptions must not be null");
        Objects.requireNonNull(operations, "operations must not be null");
        // format, backend and destination may be null
    }

    /** The spec every pipeline starts from. */
    public static PipelineSpec empty() {
        return EMPTY;
    }

    public PipelineSpec withSource(Source newSource) {
        return new PipelineSpec(newSource, loaderOptions, saverOptions, format, operations, backend, destination);
    }

    public PipelineSpec withFormat(String newFormat) {
        return new PipelineSpec(source, loaderOptions, saverOptions, newFormat, operations, backend, destination);
    }

    public PipelineSpec withDestination(Path newDestination) {
        return new PipelineSpec(source, loaderOptions, saverOptions, format, operations, backend, newDestination);
    }

    /** Merges loader options; keys in {@code delta} override existing keys. */
    public PipelineSpec withLoaderOptions(Map<String, ?> delta) {
        if (delta == null || delta.isEmpty()) {
            return this;
        }
        return new PipelineSpec(
                source, merge(loaderOptions, delta), saverOptions, format, operations, backend, destination);
    }

    /** Merges saver options; keys in {@code delta} override existing keys. */
    public PipelineSpec withSaverOptions(Map<String, ?> delta) {
        if (delta == null || delta.isEmpty()) {
            return this;
        }
        return new PipelineSpec(
                source, loaderOptions, merge(saverOptions, delta), format, operations, backend, destination);
    }

    /** Appends an operation. */
    public PipelineSpec withOperation(Operation operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        List<Operation> appended = new ArrayList<>(operations.size() + 1);
        appended.addAll(operations);
        appended.add(operation);
        return new PipelineSpec(
                source,
                loaderOptions,
                saverOptions,
                format,
                Collections.unmodifiableList(appended),
                backend,
                destination);
    }

    /**
     * Binds the spec to an engine. Binding to the engine it is already bound to is a no-op.
     *
     * @throws ConfigurationException if the spec is already bound to a different engine
     */
    public PipelineSpec withBackend(EngineAdapter<?> newBackend) {
        Objects.requireNonNull(newBackend, "backend must not be null");
        if (backend == newBackend) {
            return this;
        }
        if (backend != null) {
            throw new ConfigurationException("Pipeline is already bound to engine '" + backend.id()
                    + "', cannot rebind to '" + newBackend.id() + "'");
        }
        return new PipelineSpec(source, loaderOptions, saverOptions, format, operations, newBackend, destination);
    }

    public boolean isBound() {
        return backend != null;
    }

    private static Map<String, Object> merge(Map<String, Object> base, Map<String, ?> delta) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        merged.putAll(delta);
        return Collections.unmodifiableMap(merged);
    }
}
