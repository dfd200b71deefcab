package io.imagexform.magick;

import java.time.Duration;
import java.util.Objects;

/**
 * ImageMagick adapter settings.
 *
 * @param executable the command to run: {@code magick} for ImageMagick 7, {@code convert} for 6
 * @param timeout maximum time a single invocation may take
 */
public record MagickConfig(String executable, Duration timeout) {

    /** Default executable name. */
    public static final String DEFAULT_EXECUTABLE = "magick";

    /** Default per-invocation timeout. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public MagickConfig {
        Objects.requireNonNull(executable, "executable must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (executable.isBlank()) {
            throw new IllegalArgumentException("executable must not be blank");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
    }

    public static MagickConfig defaults() {
        return new MagickConfig(DEFAULT_EXECUTABLE, DEFAULT_TIMEOUT);
    }
}
