package com.endecrelay.relay;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cooperative stop flag shared by the relay loop and the publishers.
 *
 * <p>
 * Long waits (reconnect and retry back-off) go through {@link #pause(Duration)}
 * so a shutdown request ends them early instead of holding up JVM exit.
 * </p>
 *
 * @since 1.0.0
 */
public class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * Request shutdown. Idempotent.
     */
    public void request() {
        latch.countDown();
    }

    public boolean isRequested() {
        return latch.getCount() == 0;
    }

    /**
     * Wait for the given duration unless shutdown is requested first.
     *
     * @param duration how long to wait; zero or negative returns immediately
     * @return {@code true} if the full duration elapsed, {@code false} if
     *         shutdown was requested or the thread was interrupted
     */
    public boolean pause(Duration duration) {
        if (isRequested()) {
            return false;
        }
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            return !latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
