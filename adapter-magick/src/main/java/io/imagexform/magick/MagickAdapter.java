package io.imagexform.magick;

import io.imagexform.core.engine.DestinationFormat;
import io.imagexform.core.error.BackendExecutionException;
import io.imagexform.core.error.ImageXformException.Phase;
import io.imagexform.core.error.InvalidSourceException;
import io.imagexform.core.model.Source;
import io.imagexform.core.option.OptionFilter;
import io.imagexform.core.spi.EngineAdapter;
import io.imagexform.core.spi.OperationTable;
import io.imagexform.core.spi.OptionKind;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine that drives the ImageMagick command-line tool. The accumulator is a
 * {@link MagickCommand}: loading records the input, every operation appends arguments, and a
 * single process runs on save.
 *
 * <p>
 * Loader options {@code page} and {@code geometry} become part of the input spec
 * ({@code photo.pdf[2][400x]}); {@code fail} (default {@code true}) adds {@code -regard-warnings}
 * and {@code auto_orient} (default {@code true}) adds {@code -auto-orient}. Any other loader
 * option is rendered as a flag before the input, saver options after all operations. Nested
 * option groups such as {@code {jpeg: {size: "100x100"}}} arrive flattened and are rendered as
 * {@code -define jpeg:size=100x100}.
 *
 * <p>
 * Thread-safe as long as the {@link MagickRunner} is.
 */
public final class MagickAdapter implements EngineAdapter<MagickCommand> {

    private static final Logger LOG = LoggerFactory.getLogger(MagickAdapter.class);

    /** Engine identifier. */
    public static final String ID = "magick";

    static final String PAGE = "page";
    static final String GEOMETRY = "geometry";
    static final String FAIL = "fail";
    static final String AUTO_ORIENT = "auto_orient";

    private static final Set<String> LOADER_OPTIONS = loaderOptions();
    private static final Set<String> SAVER_OPTIONS = saverOptions();

    private final MagickConfig config;
    private final MagickRunner runner;
    private final OperationTable<MagickCommand> operations = MagickOperations.table();

    public MagickAdapter() {
        this(MagickConfig.defaults(), new ProcessMagickRunner());
    }

    public MagickAdapter(MagickConfig config) {
        this(config, new ProcessMagickRunner());
    }

    public MagickAdapter(MagickConfig config, MagickRunner runner) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<MagickCommand> accumulatorType() {
        return MagickCommand.class;
    }

    @Override
    public OperationTable<MagickCommand> operations() {
        return operations;
    }

    @Override
    public MagickCommand load(Source source, Map<String, Object> loaderOptions) {
        MagickCommand command;
        if (source.isHandle()) {
            command = (MagickCommand) source.handle();
        } else {
            Path path = source.path();
            if (!Files.isRegularFile(path)) {
                throw new InvalidSourceException("source file does not exist: " + path);
            }
            command = MagickCommand.empty();
            for (Map.Entry<String, Object> option : loaderOptions.entrySet()) {
                if (!isInputOption(option.getKey())) {
                    command = command.option(option.getKey(), option.getValue());
                }
            }
            command = command.append(inputSpec(path, loaderOptions));
        }
        if (!Boolean.FALSE.equals(loaderOptions.get(FAIL))) {
            command = command.option("regard_warnings", null);
        }
        if (!Boolean.FALSE.equals(loaderOptions.get(AUTO_ORIENT))) {
            command = command.option(AUTO_ORIENT, null);
        }
        return command;
    }

    @Override
    public void save(MagickCommand command, Path destination, String format, Map<String, Object> saverOptions) {
        List<String> line = new ArrayList<>();
        line.add(config.executable());
        line.addAll(command.arguments());
        saverOptions.forEach((name, value) -> line.addAll(MagickFlags.render(name, value)));
        line.add(outputSpec(destination, format));

        RunResult result = run(line, Phase.SAVE);
        if (!result.success()) {
            throw new BackendExecutionException(
                    "ImageMagick exited with code " + result.exitCode() + ": " + result.firstStderrLine(),
                    ID,
                    Phase.SAVE);
        }
        LOG.debug("ImageMagick finished: destination={}, elapsed_ms={}", destination, result.elapsedMs());
    }

    @Override
    public Set<String> acceptedOptions(OptionKind kind, String format) {
        return kind == OptionKind.LOADER ? LOADER_OPTIONS : SAVER_OPTIONS;
    }

    /** Flattened groups become {@code -define} atoms, which ImageMagick spells with dashes. */
    @Override
    public char optionSeparator() {
        return '-';
    }

    /**
     * Returns {@code true} if ImageMagick reads the file without errors or warnings.
     *
     * @throws BackendExecutionException if the executable cannot be run at all
     */
    public boolean valid(Path path) {
        RunResult result =
                run(List.of(config.executable(), "-regard-warnings", path.toString(), "null:"), Phase.LOAD);
        if (!result.success()) {
            LOG.debug("Invalid image {}: {}", path, result.firstStderrLine());
        }
        return result.success();
    }

    private RunResult run(List<String> line, Phase phase) {
        LOG.debug("Running ImageMagick: {}", String.join(" ", line));
        try {
            return runner.run(line, config.timeout());
        } catch (IOException e) {
            throw new BackendExecutionException(
                    "failed to run '" + config.executable() + "': " + e.getMessage(), e, ID, phase);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendExecutionException("interrupted while running ImageMagick", e, ID, phase);
        }
    }

    private static String inputSpec(Path path, Map<String, Object> options) {
        StringBuilder spec = new StringBuilder(path.toString());
        if (options.get(PAGE) != null) {
            spec.append('[').append(options.get(PAGE)).append(']');
        }
        if (options.get(GEOMETRY) != null) {
            spec.append('[').append(options.get(GEOMETRY)).append(']');
        }
        return spec.toString();
    }

    /** Prefixes the format when it differs from the destination's extension: {@code png:out.tmp}. */
    private static String outputSpec(Path destination, String format) {
        String extension = DestinationFormat.extension(destination);
        if (format == null || format.equalsIgnoreCase(extension)) {
            return destination.toString();
        }
        return format + ":" + destination;
    }

    private static boolean isInputOption(String name) {
        return PAGE.equals(name) || GEOMETRY.equals(name) || FAIL.equals(name) || AUTO_ORIENT.equals(name);
    }

    private static Set<String> loaderOptions() {
        Set<String> names = new HashSet<>(MagickOptions.NAMES);
        names.add(PAGE);
        names.add(FAIL);
        names.add(OptionFilter.ANY_NAMESPACE);
        return Set.copyOf(names);
    }

    private static Set<String> saverOptions() {
        Set<String> names = new HashSet<>(MagickOptions.NAMES);
        names.add(OptionFilter.ANY_NAMESPACE);
        return Set.copyOf(names);
    }
}
