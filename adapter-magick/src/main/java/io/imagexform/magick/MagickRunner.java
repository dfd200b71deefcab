package io.imagexform.magick;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/** Runs an ImageMagick command line. Replaced by a fake in tests. */
@FunctionalInterface
public interface MagickRunner {

    /**
     * Runs the command and waits up to {@code timeout} for it to finish.
     *
     * @param command full argument list, executable first; no shell expansion
     * @return exit code and captured output
     * @throws IOException if the process cannot be started or does not finish in time
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    RunResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
