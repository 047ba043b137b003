package org.iscc.omero.orchestration;

import java.time.Duration;

/**
 * Pause between polls and between reconnect attempts. Must return early once stop is requested.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration, StopToken stop);

    static Sleeper interruptible() {
        return (duration, stop) -> stop.await(duration);
    }
}
