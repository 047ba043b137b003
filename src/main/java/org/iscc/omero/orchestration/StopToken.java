package org.iscc.omero.orchestration;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot stop request, observed by the orchestrator between assets and during sleeps.
 * A request never interrupts work already in progress.
 */
public final class StopToken {

    private final CountDownLatch stopped = new CountDownLatch(1);

    public void requestStop() {
        stopped.countDown();
    }

    public boolean isStopRequested() {
        return stopped.getCount() == 0;
    }

    /**
     * Wait until stop is requested or the timeout elapses.
     *
     * @return true if stop was requested
     */
    public boolean await(Duration timeout) {
        try {
            return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestStop();
            return true;
        }
    }
}
