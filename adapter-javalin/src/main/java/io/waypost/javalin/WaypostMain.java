package io.waypost.javalin;

import io.waypost.javalin.server.Launcher;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runnable entry point. Serves a health route so a bare launch can be probed;
 * applications embed {@link Launcher} with their own setup instead.
 */
public final class WaypostMain {

    private static final Logger LOG = LoggerFactory.getLogger(WaypostMain.class);

    private WaypostMain() {
        // utility class
    }

    /**
     * @param args command-line arguments, e.g. {@code --config waypost.yaml}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            Launcher.listen(args, app -> app.get("/health", (req, res) -> res.json(Map.of("status", "UP"))));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
