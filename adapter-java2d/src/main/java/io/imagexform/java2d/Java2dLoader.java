package io.imagexform.java2d;

import io.imagexform.core.error.BackendExecutionException;
import io.imagexform.core.error.ConfigurationException;
import io.imagexform.core.error.ImageXformException.Phase;
import io.imagexform.core.error.InvalidSourceException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes image files with the first {@link ImageReader} that recognizes the content.
 *
 * <p>
 * Loader options:
 * <ul>
 *   <li>{@code page}: index of the image to read from a multi-image file (default 0)
 *   <li>{@code shrink}: integer subsampling factor applied while decoding (default 1)
 *   <li>{@code fail}: treat reader warnings as errors (default {@code true})
 * </ul>
 */
final class Java2dLoader {

    private static final Logger LOG = LoggerFactory.getLogger(Java2dLoader.class);

    static final String PAGE = "page";
    static final String SHRINK = "shrink";
    static final String FAIL = "fail";

    static final Set<String> OPTIONS = Set.of(PAGE, SHRINK, FAIL);

    BufferedImage load(Path path, Map<String, Object> options) {
        int page = OptionValues.intValue(options, PAGE, 0, Phase.LOAD);
        int shrink = OptionValues.intValue(options, SHRINK, 1, Phase.LOAD);
        boolean fail = OptionValues.booleanValue(options, FAIL, true, Phase.LOAD);
        if (page < 0 || shrink < 1) {
            throw new ConfigurationException(
                    "invalid loader options: page=" + page + ", shrink=" + shrink, Phase.LOAD);
        }
        if (!Files.isRegularFile(path)) {
            throw new InvalidSourceException("source file does not exist: " + path);
        }

        try (ImageInputStream iis = ImageIO.createImageInputStream(path.toFile())) {
            if (iis == null) {
                throw new InvalidSourceException("cannot open image stream for " + path);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                throw new InvalidSourceException("unsupported image format: " + path);
            }
            ImageReader reader = readers.next();
            try {
                return read(reader, iis, path, page, shrink, fail);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new BackendExecutionException(
                    "failed to decode " + path + ": " + e.getMessage(), e, Java2dAdapter.ID, Phase.LOAD);
        }
    }

    private static BufferedImage read(
            ImageReader reader, ImageInputStream iis, Path path, int page, int shrink, boolean fail)
            throws IOException {
        List<String> warnings = new ArrayList<>();
        reader.setInput(iis, false, true);
        reader.addIIOReadWarningListener((source, warning) -> warnings.add(warning));

        ImageReadParam param = reader.getDefaultReadParam();
        if (shrink > 1) {
            param.setSourceSubsampling(shrink, shrink, 0, 0);
        }

        BufferedImage image;
        try {
            image = reader.read(page, param);
        } catch (IndexOutOfBoundsException e) {
            throw new ConfigurationException("page " + page + " does not exist in " + path, e, Phase.LOAD);
        }

        if (!warnings.isEmpty()) {
            if (fail) {
                throw new BackendExecutionException(
                        "decoding " + path + " produced warnings: " + String.join("; ", warnings),
                        Java2dAdapter.ID,
                        Phase.LOAD);
            }
            LOG.debug("Ignoring decoder warnings for {}: {}", path, warnings);
        }
        return image;
    }
}
