package io.waypost.core.app;

import io.waypost.core.spi.TransportServer;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle on a started {@link App}. {@link #stop()} is idempotent and releases
 * every thread blocked in {@link #await()}.
 */
public final class RunningApp implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RunningApp.class);

    private final TransportServer server;
    private final CountDownLatch stopped = new CountDownLatch(1);

    RunningApp(TransportServer server) {
        this.server = server;
    }

    /** The bound port; the ephemeral one when started on port 0. */
    public int port() {
        return server.port();
    }

    public synchronized void stop() {
        if (stopped.getCount() == 0) {
            return;
        }
        server.stop();
        stopped.countDown();
        LOG.info("waypost stopped");
    }

    /** Blocks until {@link #stop()} is called. */
    public void await() throws InterruptedException {
        stopped.await();
    }

    public boolean isStopped() {
        return stopped.getCount() == 0;
    }

    @Override
    public void close() {
        stop();
    }
}
