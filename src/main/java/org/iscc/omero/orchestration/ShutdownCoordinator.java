package org.iscc.omero.orchestration;

import org.iscc.omero.config.IsccServiceConfig;
import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns application shutdown (SIGTERM/SIGINT) into a stop request and holds shutdown
 * until the in-flight asset is committed or the shutdown timeout elapses.
 */
@ApplicationScoped
public class ShutdownCoordinator {

    private static final Logger LOG = Logger.getLogger(ShutdownCoordinator.class);

    @Inject
    IsccServiceConfig config;

    private final AtomicReference<ActiveRun> active = new AtomicReference<>();

    /**
     * Register a run and hand out its stop token.
     */
    public StopToken begin() {
        StopToken token = new StopToken();
        active.set(new ActiveRun(token, new CountDownLatch(1)));
        return token;
    }

    /**
     * Mark the registered run as finished, releasing a waiting shutdown.
     */
    public void finish() {
        ActiveRun run = active.getAndSet(null);
        if (run != null) {
            run.done().countDown();
        }
    }

    void onShutdown(@Observes ShutdownEvent event) {
        ActiveRun run = active.get();
        if (run == null) {
            return;
        }

        Duration timeout = config.shutdownTimeout();
        LOG.infof("Shutdown requested, waiting up to %s for the in-flight asset", timeout);
        run.token().requestStop();

        try {
            if (!run.done().await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warnf("Ingestion did not stop within %s, exiting anyway", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for ingestion to stop");
        }
    }

    private record ActiveRun(StopToken token, CountDownLatch done) {
    }
}
