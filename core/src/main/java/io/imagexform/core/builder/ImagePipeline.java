package io.imagexform.core.builder;

import io.imagexform.core.engine.PipelineExecutor;
import io.imagexform.core.error.ConfigurationException;
import io.imagexform.core.error.ImageXformException.Phase;
import io.imagexform.core.error.UnknownOperationException;
import io.imagexform.core.model.Operation;
import io.imagexform.core.model.PipelineDefaults;
import io.imagexform.core.model.PipelineResult;
import io.imagexform.core.model.PipelineSpec;
import io.imagexform.core.model.Source;
import io.imagexform.core.spi.EngineAdapter;
import io.imagexform.core.spi.ImageCallback;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable fluent builder for image pipelines.
 *
 * <pre>{@code
 * Path thumbnail = ImagePipeline.using(new Java2dAdapter())
 *         .source(Path.of("photo.jpg"))
 *         .resizeToLimit(400, 400)
 *         .convert("png")
 *         .call();
 * }</pre>
 *
 * <p>
 * Every method returns a new builder and leaves its receiver untouched, so a partially built
 * pipeline can be kept as a template and branched any number of times, from any thread.
 *
 * <p>
 * The engine is taken from the {@link PipelineDefaults} given to the entry point and bound to
 * the spec on the first operation (or at execution time); once bound it never changes.
 *
 * @param <A> the accumulator type of the engine this pipeline runs on
 */
public final class ImagePipeline<A> {

    /** Suffix of a dynamic name that builds and then immediately executes. */
    public static final String EXECUTE_MARKER = "!";

    /** Suffix of a predicate name; never turned into an operation. */
    public static final String PREDICATE_MARKER = "?";

    private static final PipelineExecutor EXECUTOR = new PipelineExecutor();

    private final PipelineSpec spec;
    private final PipelineDefaults<A> defaults;

    private ImagePipeline(PipelineSpec spec, PipelineDefaults<A> defaults) {
        this.spec = spec;
        this.defaults = defaults;
    }

    /** Entry point for pipelines running on the given engine. */
    public static <A> ImagePipeline<A> using(EngineAdapter<A> adapter) {
        Objects.requireNonNull(adapter, "adapter must not be null");
        return using(PipelineDefaults.of(adapter));
    }

    /** Entry point seeded with caller-constructed defaults. */
    public static <A> ImagePipeline<A> using(PipelineDefaults<A> defaults) {
        Objects.requireNonNull(defaults, "defaults must not be null");
        PipelineSpec seeded = PipelineSpec.empty()
                .withLoaderOptions(defaults.loaderOptions())
                .withSaverOptions(defaults.saverOptions())
                .withFormat(defaults.format());
        return new ImagePipeline<>(seeded, defaults);
    }

    /** The accumulated, immutable description of this pipeline. */
    public PipelineSpec spec() {
        return spec;
    }

    // --- Spec fields ---

    /** Sets the source: a {@link Path}, {@link java.io.File}, path string, or engine handle. */
    public ImagePipeline<A> source(Object source) {
        return branch(spec.withSource(Source.of(source)));
    }

    /** Sets the output format, e.g. {@code "png"}. */
    public ImagePipeline<A> convert(String format) {
        return branch(spec.withFormat(format));
    }

    /** Merges options applied when loading; later keys override earlier ones. */
    public ImagePipeline<A> loader(Map<String, ?> options) {
        return branch(spec.withLoaderOptions(options));
    }

    /** Merges a single loader option. */
    public ImagePipeline<A> loader(String name, Object value) {
        return loader(singleton(name, value));
    }

    /** Merges options applied when saving; later keys override earlier ones. */
    public ImagePipeline<A> saver(Map<String, ?> options) {
        return branch(spec.withSaverOptions(options));
    }

    /** Merges a single saver option. */
    public ImagePipeline<A> saver(String name, Object value) {
        return saver(singleton(name, value));
    }

    /**
     * Binds the pipeline to an engine. Needed for templates built from
     * {@link PipelineDefaults#unbound()}; binding again to the same engine is a no-op.
     *
     * @throws ConfigurationException if the pipeline is already bound to a different engine
     */
    public ImagePipeline<A> backend(EngineAdapter<A> adapter) {
        return branch(spec.withBackend(adapter));
    }

    /** Saves to the given path instead of a new temporary file. */
    public ImagePipeline<A> destination(Path destination) {
        return branch(spec.withDestination(destination));
    }

    // --- Operations ---

    /**
     * Appends an operation. A trailing {@link Map} argument carries the operation's named options
     * (e.g. {@code gravity}, {@code background}); every other argument is positional.
     */
    public ImagePipeline<A> operation(String name, Object... args) {
        List<Object> positional = new ArrayList<>(Arrays.asList(args));
        Map<String, Object> options = null;
        if (!positional.isEmpty() && positional.get(positional.size() - 1) instanceof Map<?, ?> trailing) {
            positional.remove(positional.size() - 1);
            options = toOptions(trailing);
        }
        return operation(name, positional, options);
    }

    /** Appends an operation with explicit positional arguments and named options. */
    public ImagePipeline<A> operation(String name, List<Object> args, Map<String, Object> options) {
        return operation(name, args, options, null);
    }

    /**
     * Appends an operation that carries a callback. A macro receives the callback as its third
     * argument and decides when to invoke it; primitives ignore it.
     */
    public ImagePipeline<A> operation(
            String name, List<Object> args, Map<String, Object> options, ImageCallback<A> callback) {
        return bound(spec.withOperation(new Operation(name, args, options, callback)));
    }

    /**
     * Appends a callback invoked directly on the accumulator. Its return value becomes the new
     * accumulator; returning {@code null} keeps the current one.
     */
    public ImagePipeline<A> custom(ImageCallback<A> callback) {
        return bound(spec.withOperation(Operation.custom(callback)));
    }

    /** Shrinks to fit within the box, preserving aspect ratio; never enlarges. */
    public ImagePipeline<A> resizeToLimit(Integer width, Integer height) {
        return operation("resize_to_limit", width, height);
    }

    /** Scales to fit within the box, preserving aspect ratio; may enlarge. */
    public ImagePipeline<A> resizeToFit(Integer width, Integer height) {
        return operation("resize_to_fit", width, height);
    }

    /** Scales to cover the box, then crops the excess around the center. */
    public ImagePipeline<A> resizeToFill(int width, int height) {
        return operation("resize_to_fill", width, height);
    }

    /** Scales to cover the box, then crops the excess around the given gravity. */
    public ImagePipeline<A> resizeToFill(int width, int height, String gravity) {
        return operation("resize_to_fill", width, height, singleton("gravity", gravity));
    }

    /** Scales to fit, then pads to exactly the box with a transparent background. */
    public ImagePipeline<A> resizeAndPad(int width, int height) {
        return operation("resize_and_pad", width, height);
    }

    /** Scales to fit, then pads to exactly the box; options: {@code background}, {@code gravity}. */
    public ImagePipeline<A> resizeAndPad(int width, int height, Map<String, ?> options) {
        return operation("resize_and_pad", width, height, options);
    }

    /** Rotates by the given angle; non-right angles fill the corners with transparency. */
    public ImagePipeline<A> rotate(double degrees) {
        return operation("rotate", degrees);
    }

    /** Rotates by the given angle, filling the corners with the background color. */
    public ImagePipeline<A> rotate(double degrees, Object background) {
        return operation("rotate", degrees, singleton("background", background));
    }

    /** Extracts the {@code width x height} area at {@code (left, top)}. */
    public ImagePipeline<A> crop(int left, int top, int width, int height) {
        return operation("crop", left, top, width, height);
    }

    /** Overlays another image; options: {@code gravity}, {@code offset} ([x, y]). */
    public ImagePipeline<A> composite(Object overlay, Map<String, ?> options) {
        return operation("composite", overlay, options);
    }

    /**
     * Adds operations from data, in iteration order. Each value is fanned out: {@code true} or
     * {@code null} means no arguments, a {@link List} is spread as arguments, anything else is a
     * single argument. Names go through {@link #invoke}, so {@code convert}, {@code loader} and
     * {@code saver} address the builder itself.
     */
    public ImagePipeline<A> apply(Map<String, ?> operations) {
        ImagePipeline<A> builder = this;
        for (Map.Entry<String, ?> entry : operations.entrySet()) {
            builder = builder.applyOne(entry.getKey(), entry.getValue());
        }
        return builder;
    }

    /** Ordered-pairs variant of {@link #apply(Map)}; names may repeat. */
    public ImagePipeline<A> apply(List<? extends Map.Entry<String, ?>> operations) {
        ImagePipeline<A> builder = this;
        for (Map.Entry<String, ?> entry : operations) {
            builder = builder.applyOne(entry.getKey(), entry.getValue());
        }
        return builder;
    }

    /**
     * Dynamic entry point for operation names chosen at runtime.
     *
     * <ul>
     *   <li>{@code name?} fails with {@link UnknownOperationException} and adds nothing.
     *   <li>{@code name!} builds {@code name} and executes immediately, returning the saved
     *       {@link Path}.
     *   <li>{@code source}, {@code convert}, {@code loader}, {@code saver}, {@code destination},
     *       {@code custom} and {@code apply} call the builder method of that name.
     *   <li>Any other name becomes {@link #operation(String, Object...)}.
     * </ul>
     *
     * @return a new {@link ImagePipeline}, or the saved {@link Path} for {@code name!}
     */
    public Object invoke(String name, Object... args) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.endsWith(PREDICATE_MARKER)) {
            throw new UnknownOperationException(
                    "'" + name + "' is a predicate, not an operation", name, null, Phase.BUILD);
        }
        if (name.endsWith(EXECUTE_MARKER)) {
            Object built = invoke(name.substring(0, name.length() - EXECUTE_MARKER.length()), args);
            return asPipeline(built, name).call();
        }
        return switch (name) {
            case "source" -> source(single(name, args));
            case "convert" -> convert(String.valueOf(single(name, args)));
            case "loader" -> loader(toOptions(requireMap(name, single(name, args))));
            case "saver" -> saver(toOptions(requireMap(name, single(name, args))));
            case "destination" -> destination(toPath(single(name, args)));
            case "custom" -> custom(requireCallback(single(name, args)));
            case "apply" -> apply(toOptions(requireMap(name, single(name, args))));
            default -> operation(name, args);
        };
    }

    // --- Execution ---

    /** Executes and returns the saved file. */
    public Path call() {
        return execute(spec, true).path();
    }

    /** Executes with the given source and returns the saved file. */
    public Path call(Object source) {
        return source(source).call();
    }

    /** Executes with the given source, saving to {@code destination}. */
    public Path call(Object source, Path destination) {
        return source(source).destination(destination).call();
    }

    /** Executes without saving and returns the engine's accumulator. */
    public A callUnsaved() {
        return execute(spec, false).accumulator();
    }

    /** Executes with the given source without saving. */
    public A callUnsaved(Object source) {
        return source(source).callUnsaved();
    }

    private PipelineResult<A> execute(PipelineSpec toRun, boolean save) {
        PipelineSpec ready =
                toRun.isBound() || defaults.backend() == null ? toRun : toRun.withBackend(defaults.backend());
        return EXECUTOR.execute(ready, save);
    }

    // --- Internals ---

    private ImagePipeline<A> branch(PipelineSpec next) {
        return new ImagePipeline<>(next, defaults);
    }

    private ImagePipeline<A> bound(PipelineSpec next) {
        if (!next.isBound() && defaults.backend() != null) {
            return branch(next.withBackend(defaults.backend()));
        }
        return branch(next);
    }

    private ImagePipeline<A> applyOne(String name, Object argument) {
        Object result;
        if (argument == null || Boolean.TRUE.equals(argument)) {
            result = invoke(name);
        } else if (argument instanceof List<?> list) {
            result = invoke(name, list.toArray());
        } else {
            result = invoke(name, argument);
        }
        return asPipeline(result, name);
    }

    @SuppressWarnings("unchecked")
    private ImagePipeline<A> asPipeline(Object result, String name) {
        if (result instanceof ImagePipeline<?> pipeline) {
            return (ImagePipeline<A>) pipeline;
        }
        throw new ConfigurationException("'" + name + "' does not produce a pipeline");
    }

    private static Object single(String name, Object[] args) {
        if (args.length != 1) {
            throw new ConfigurationException("'" + name + "' expects exactly one argument, got " + args.length);
        }
        return args[0];
    }

    private static Map<?, ?> requireMap(String name, Object value) {
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new ConfigurationException("'" + name + "' expects a map of options, got " + value);
    }

    @SuppressWarnings("unchecked")
    private ImageCallback<A> requireCallback(Object value) {
        if (value instanceof ImageCallback<?> callback) {
            return (ImageCallback<A>) callback;
        }
        throw new ConfigurationException("'custom' expects an ImageCallback, got " + value);
    }

    private static Path toPath(Object value) {
        return value instanceof Path path ? path : Path.of(String.valueOf(value));
    }

    private static Map<String, Object> toOptions(Map<?, ?> map) {
        Map<String, Object> options = new LinkedHashMap<>();
        map.forEach((key, value) -> options.put(String.valueOf(key), value));
        return options;
    }

    private static Map<String, Object> singleton(String name, Object value) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put(name, value);
        return options;
    }

    @Override
    public String toString() {
        return "ImagePipeline[engine=" + (spec.isBound() ? spec.backend().id() : "unbound") + ", operations="
                + spec.operations().size() + "]";
    }
}
