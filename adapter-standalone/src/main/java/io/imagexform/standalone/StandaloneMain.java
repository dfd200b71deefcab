package io.imagexform.standalone;

import io.imagexform.standalone.app.XformApp;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the standalone host. Delegates to {@link XformApp#run(String[])}, prints the
 * written file on stdout, and on failure logs the error and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments, e.g. {@code --source in.jpg --definition thumbs.yaml}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            Path written = new XformApp().run(args);
            System.out.println(written);
        } catch (Exception e) {
            LOG.error("Pipeline failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
