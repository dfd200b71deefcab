package io.imagexform.java2d;

import io.imagexform.core.error.ImageXformException;
import io.imagexform.core.model.Source;
import io.imagexform.core.spi.EngineAdapter;
import io.imagexform.core.spi.OperationTable;
import io.imagexform.core.spi.OptionKind;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process engine backed by the JDK imaging stack: {@code javax.imageio} for decoding and
 * encoding, {@code java.awt} for pixel work. The accumulator is a {@link BufferedImage}; every
 * operation returns a new image.
 *
 * <p>
 * Macros: {@code resize_to_limit}, {@code resize_to_fit}, {@code resize_to_fill},
 * {@code resize_and_pad}, {@code rotate}, {@code crop}, {@code composite}. Pass-through
 * primitives: {@code flip}, {@code flop}, {@code grayscale}, {@code invert}, and the queries
 * {@code width} and {@code height}.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class Java2dAdapter implements EngineAdapter<BufferedImage> {

    private static final Logger LOG = LoggerFactory.getLogger(Java2dAdapter.class);

    /** Engine identifier. */
    public static final String ID = "java2d";

    private final Java2dLoader loader = new Java2dLoader();
    private final Java2dSaver saver = new Java2dSaver();
    private final OperationTable<BufferedImage> operations = new Java2dOperations(loader).table();

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<BufferedImage> accumulatorType() {
        return BufferedImage.class;
    }

    @Override
    public OperationTable<BufferedImage> operations() {
        return operations;
    }

    @Override
    public BufferedImage load(Source source, Map<String, Object> loaderOptions) {
        if (source.isHandle()) {
            return (BufferedImage) source.handle();
        }
        return loader.load(source.path(), loaderOptions);
    }

    @Override
    public void save(BufferedImage image, Path destination, String format, Map<String, Object> saverOptions) {
        saver.save(image, destination, format, saverOptions);
    }

    @Override
    public Set<String> acceptedOptions(OptionKind kind, String format) {
        return kind == OptionKind.LOADER ? Java2dLoader.OPTIONS : saver.acceptedOptions(format);
    }

    /**
     * Returns {@code true} if the file decodes without errors or warnings.
     */
    public boolean valid(Path path) {
        try {
            loader.load(path, Map.of());
            return true;
        } catch (ImageXformException e) {
            LOG.debug("Invalid image {}: {}", path, e.getMessage());
            return false;
        }
    }
}
