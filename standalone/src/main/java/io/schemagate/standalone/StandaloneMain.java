package io.schemagate.standalone;

import io.schemagate.standalone.runtime.GateApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the standalone host. Delegates to {@link GateApp#start(String[])}; on failure,
 * logs the error and exits with a non-zero status. Runs until the JVM is asked to shut down.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /** @param args command-line arguments, e.g. {@code --config path/to/schema-gate.yaml} */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        GateApp app;
        try {
            app = GateApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "schema-gate-shutdown"));
        try {
            app.awaitStop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            app.stop();
        }
    }
}
