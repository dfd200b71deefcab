package io.imagexform.java2d;

import io.imagexform.core.error.BackendExecutionException;
import io.imagexform.core.error.ConfigurationException;
import io.imagexform.core.error.ImageXformException.Phase;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

/**
 * Encodes images with the {@link ImageWriter} registered for the destination format. The saver
 * options a format accepts are read from its writer's {@link ImageWriteParam}: {@code quality}
 * (1..100) when the writer can compress, {@code progressive} when it can write progressively.
 */
final class Java2dSaver {

    static final String QUALITY = "quality";
    static final String PROGRESSIVE = "progressive";

    // writers for these formats reject images with an alpha channel
    private static final Set<String> OPAQUE_FORMATS = Set.of("jpg", "jpeg", "bmp", "wbmp");

    Set<String> acceptedOptions(String format) {
        Optional<ImageWriter> found = writerFor(format);
        if (found.isEmpty()) {
            return Set.of();
        }
        ImageWriter writer = found.get();
        try {
            ImageWriteParam param = writer.getDefaultWriteParam();
            Set<String> accepted = new LinkedHashSet<>();
            if (param.canWriteCompressed()) {
                accepted.add(QUALITY);
            }
            if (param.canWriteProgressive()) {
                accepted.add(PROGRESSIVE);
            }
            return accepted;
        } finally {
            writer.dispose();
        }
    }

    void save(BufferedImage image, Path destination, String format, Map<String, Object> options) {
        ImageWriter writer = writerFor(format)
                .orElseThrow(() -> new BackendExecutionException(
                        "no image writer for format '" + format + "'", Java2dAdapter.ID, Phase.SAVE));
        try {
            BufferedImage output = OPAQUE_FORMATS.contains(format.toLowerCase(Locale.ROOT)) && ImageOps.hasAlpha(image)
                    ? ImageOps.flatten(image, Color.WHITE)
                    : image;
            ImageWriteParam param = writeParam(writer, options);
            try (OutputStream out = Files.newOutputStream(destination);
                    ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
                if (ios == null) {
                    throw new IOException("no image output stream available");
                }
                writer.setOutput(ios);
                writer.write(null, new IIOImage(output, null, null), param);
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new BackendExecutionException(
                    "failed to write " + format + " to " + destination + ": " + e.getMessage(),
                    e,
                    Java2dAdapter.ID,
                    Phase.SAVE);
        } finally {
            writer.dispose();
        }
    }

    private static ImageWriteParam writeParam(ImageWriter writer, Map<String, Object> options) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        if (options.containsKey(QUALITY) && param.canWriteCompressed()) {
            int quality = OptionValues.intValue(options, QUALITY, 100, Phase.SAVE);
            if (quality < 1 || quality > 100) {
                throw new ConfigurationException("quality must be between 1 and 100, got " + quality, Phase.SAVE);
            }
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            String[] types = param.getCompressionTypes();
            if (param.getCompressionType() == null && types != null && types.length > 0) {
                param.setCompressionType(types[0]);
            }
            param.setCompressionQuality(quality / 100f);
        }
        if (options.containsKey(PROGRESSIVE) && param.canWriteProgressive()) {
            boolean progressive = OptionValues.booleanValue(options, PROGRESSIVE, false, Phase.SAVE);
            param.setProgressiveMode(progressive ? ImageWriteParam.MODE_DEFAULT : ImageWriteParam.MODE_DISABLED);
        }
        return param;
    }

    private static Optional<ImageWriter> writerFor(String format) {
        if (format == null) {
            return Optional.empty();
        }
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.toLowerCase(Locale.ROOT));
        return writers.hasNext() ? Optional.of(writers.next()) : Optional.empty();
    }
}
