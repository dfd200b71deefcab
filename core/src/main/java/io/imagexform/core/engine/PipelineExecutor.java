package io.imagexform.core.engine;

import io.imagexform.core.error.BackendExecutionException;
import io.imagexform.core.error.ConfigurationException;
import io.imagexform.core.error.ImageXformException.Phase;
import io.imagexform.core.error.InvalidSourceException;
import io.imagexform.core.error.ResourceCleanupException;
import io.imagexform.core.model.Operation;
import io.imagexform.core.model.OperationArgs;
import io.imagexform.core.model.PipelineResult;
import io.imagexform.core.model.PipelineSpec;
import io.imagexform.core.model.Source;
import io.imagexform.core.option.OptionFilter;
import io.imagexform.core.spi.EngineAdapter;
import io.imagexform.core.spi.ImageCallback;
import io.imagexform.core.spi.OptionKind;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Executes a finalized {@link PipelineSpec}: load, apply every operation in order, save.
 *
 * <p>
 * The executor talks to exactly one engine per execution, the one the spec is bound to. It
 * performs no retries and reports no partial success: an execution either completes or fails as
 * a whole. On failure:
 * <ul>
 *   <li>a temporary destination is always deleted;
 *   <li>an explicit destination is deleted only if it did not exist before the save attempt;
 *   <li>a failure to delete is attached as a suppressed {@link ResourceCleanupException} and
 *       never replaces the original error.
 * </ul>
 *
 * <p>
 * Stateless and thread-safe. Each execution obtains its own accumulator; temporary files get
 * unique names from {@link Files#createTempFile}.
 */
public final class PipelineExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineExecutor.class);

    /** MDC key carrying the engine id for the duration of an execution. */
    public static final String MDC_ENGINE = "pipeline_engine";

    static final String TEMP_PREFIX = "image_xform";

    /**
     * Executes the spec.
     *
     * @param spec the pipeline to run; must be bound to an engine and have a source
     * @param save {@code false} to return the raw accumulator without writing any file
     * @return the saved path, or the raw accumulator when {@code save} is {@code false}
     * @throws ConfigurationException if the spec is unbound or has an invalid source
     */
    public <A> PipelineResult<A> execute(PipelineSpec spec, boolean save) {
        Objects.requireNonNull(spec, "spec must not be null");
        EngineAdapter<A> adapter = requireBackend(spec);
        Source source = requireSource(spec, adapter);
        String format = DestinationFormat.resolve(spec.format(), spec.destination(), source);

        MDC.put(MDC_ENGINE, adapter.id());
        long start = System.nanoTime();
        try {
            A accumulator = load(adapter, source, spec.loaderOptions());
            accumulator = transform(adapter, spec.operations(), accumulator);

            if (!save) {
                LOG.debug(
                        "Returning unsaved accumulator: engine={}, operations={}",
                        adapter.id(),
                        spec.operations().size());
                return PipelineResult.raw(accumulator);
            }

            Map<String, Object> saverOptions =
                    filter(adapter, OptionKind.SAVER, format, spec.saverOptions());
            Path destination = spec.destination() != null
                    ? saveToDestination(adapter, accumulator, spec.destination(), format, saverOptions)
                    : saveToTempFile(adapter, accumulator, format, saverOptions);

            LOG.info(
                    "Pipeline executed: engine={}, operations={}, format={}, destination={}, duration_ms={}",
                    adapter.id(),
                    spec.operations().size(),
                    format,
                    destination,
                    (System.nanoTime() - start) / 1_000_000);
            return PipelineResult.saved(destination);
        } finally {
            MDC.remove(MDC_ENGINE);
        }
    }

    @SuppressWarnings("unchecked")
    private static <A> EngineAdapter<A> requireBackend(PipelineSpec spec) {
        if (spec.backend() == null) {
            throw new ConfigurationException("Pipeline is not bound to an engine", Phase.LOAD);
        }
        return (EngineAdapter<A>) spec.backend();
    }

    private static Source requireSource(PipelineSpec spec, EngineAdapter<?> adapter) {
        Source source = spec.source();
        if (source.isUnset()) {
            throw new InvalidSourceException("source file is not provided");
        }
        if (source.isHandle() && !adapter.accumulatorType().isInstance(source.handle())) {
            throw new InvalidSourceException("source must be a path or a "
                    + adapter.accumulatorType().getSimpleName() + " for engine '" + adapter.id() + "', got "
                    + source.handle().getClass().getName());
        }
        return source;
    }

    private static <A> A load(EngineAdapter<A> adapter, Source source, Map<String, Object> loaderOptions) {
        String sourceFormat = source.isPath() ? DestinationFormat.extension(source.path()) : null;
        Map<String, Object> accepted = filter(adapter, OptionKind.LOADER, sourceFormat, loaderOptions);
        LOG.debug(
                "Loading source: engine={}, source={}, loader_options={}",
                adapter.id(),
                describe(source),
                accepted.keySet());
        return adapter.load(source, accepted);
    }

    @SuppressWarnings("unchecked")
    private static <A> A transform(EngineAdapter<A> adapter, List<Operation> operations, A accumulator) {
        int total = operations.size();
        A current = accumulator;
        for (int i = 0; i < total; i++) {
            Operation operation = operations.get(i);
            LOG.debug(
                    "Applying operation: step={}/{}, name={}, kind={}",
                    i + 1,
                    total,
                    operation.name(),
                    OperationResolver.resolve(adapter, operation.name()));
            current = adapter.apply(
                    operation.name(), current, OperationArgs.of(operation), (ImageCallback<A>) operation.callback());
        }
        return current;
    }

    private static <A> Path saveToDestination(
            EngineAdapter<A> adapter, A accumulator, Path destination, String format, Map<String, Object> options) {
        boolean existed = Files.exists(destination);
        try {
            adapter.save(accumulator, destination, format, options);
            return destination;
        } catch (RuntimeException | Error e) {
            if (!existed) {
                deleteQuietly(destination, e);
            }
            throw e;
        }
    }

    private static <A> Path saveToTempFile(
            EngineAdapter<A> adapter, A accumulator, String format, Map<String, Object> options) {
        Path tempFile;
        try {
            tempFile = Files.createTempFile(TEMP_PREFIX, "." + format);
        } catch (IOException e) {
            throw new BackendExecutionException(
                    "Failed to create temporary file: " + e.getMessage(), e, adapter.id(), Phase.SAVE);
        }
        try {
            adapter.save(accumulator, tempFile, format, options);
            return tempFile;
        } catch (RuntimeException | Error e) {
            deleteQuietly(tempFile, e);
            throw e;
        }
    }

    private static Map<String, Object> filter(
            EngineAdapter<?> adapter, OptionKind kind, String format, Map<String, Object> options) {
        if (options.isEmpty()) {
            return options;
        }
        Set<String> accepted = adapter.acceptedOptions(kind, format);
        Map<String, Object> flattened = OptionFilter.flattenGroups(options, accepted, adapter.optionSeparator());
        List<String> dropped = OptionFilter.rejected(flattened, accepted);
        if (!dropped.isEmpty()) {
            LOG.debug("Ignoring unsupported {} options for engine '{}': {}", kind, adapter.id(), dropped);
        }
        return OptionFilter.select(flattened, accepted);
    }

    private static void deleteQuietly(Path path, Throwable original) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete {} after failed save: {}", path, e.getMessage());
            original.addSuppressed(new ResourceCleanupException("Failed to delete " + path, e, path));
        }
    }

    private static String describe(Source source) {
        return source.isPath() ? source.path().toString() : source.handle().getClass().getSimpleName();
    }
}
