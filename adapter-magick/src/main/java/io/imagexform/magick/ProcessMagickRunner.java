package io.imagexform.magick;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link MagickRunner} backed by {@link ProcessBuilder}. Each output stream is drained by its own
 * daemon thread, started with the process, so a chatty process cannot block on a full pipe no
 * matter how busy the JVM's shared pools are.
 */
public final class ProcessMagickRunner implements MagickRunner {

    @Override
    public RunResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        long start = System.nanoTime();
        Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();

        Drain stdout = Drain.start(process.getInputStream(), "magick-stdout");
        Drain stderr = Drain.start(process.getErrorStream(), "magick-stderr");

        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new IOException("'" + command.get(0) + "' did not finish within " + timeout.toMillis() + " ms");
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        return new RunResult(process.exitValue(), stdout.await(), stderr.await(), elapsedMs);
    }

    /** Reads one stream to its end on a dedicated thread. */
    private static final class Drain implements Runnable {

        private final InputStream stream;
        private volatile String content = "";
        private volatile IOException failure;
        private Thread thread;

        private Drain(InputStream stream) {
            this.stream = stream;
        }

        static Drain start(InputStream stream, String name) {
            Drain drain = new Drain(stream);
            drain.thread = new Thread(drain, name);
            drain.thread.setDaemon(true);
            drain.thread.start();
            return drain;
        }

        @Override
        public void run() {
            try (InputStream in = stream) {
                content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                failure = e;
            }
        }

        String await() throws IOException, InterruptedException {
            thread.join();
            if (failure != null) {
                throw new IOException("failed to read process output", failure);
            }
            return content;
        }
    }
}
