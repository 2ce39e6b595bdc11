package com.bridgerelay.relay.job;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative shutdown signal observed by the relay loop between states and while sleeping.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Sleep for the given duration or until cancelled.
     *
     * @return true if the token was cancelled (or the thread interrupted) before the duration elapsed
     */
    public boolean sleep(Duration duration) {
        try {
            return cancelled.await(Math.max(0, duration.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return true;
        }
    }
}
