package io.imagexform.standalone.app;

import io.imagexform.core.spi.EngineAdapter;
import io.imagexform.java2d.Java2dAdapter;
import io.imagexform.magick.MagickAdapter;
import io.imagexform.magick.MagickConfig;
import io.imagexform.magick.MagickRunner;
import io.imagexform.magick.ProcessMagickRunner;
import io.imagexform.standalone.config.XformConfig;
import java.time.Duration;

/** Creates the engine adapter named by {@link XformConfig#engineType()}. */
public final class EngineFactory {

    private final MagickRunner magickRunner;

    public EngineFactory() {
        this(new ProcessMagickRunner());
    }

    /** Uses the given runner for the ImageMagick engine. */
    public EngineFactory(MagickRunner magickRunner) {
        this.magickRunner = magickRunner;
    }

    public EngineAdapter<?> create(XformConfig config) {
        return switch (config.engineType()) {
            case Java2dAdapter.ID -> new Java2dAdapter();
            case MagickAdapter.ID -> new MagickAdapter(
                    new MagickConfig(config.magickExecutable(), Duration.ofMillis(config.magickTimeoutMs())),
                    magickRunner);
            default -> throw new IllegalArgumentException("unknown engine type: " + config.engineType());
        };
    }
}
