package com.slipway.core.engine;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation handle for one run. Cancelling interrupts the in-flight stage
 * action and wakes any retry backoff; the executor then releases the environment and
 * marks the remaining stages skipped.
 */
public class RunControl {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicReference<Future<?>> inFlight = new AtomicReference<>();
    private volatile String reason;

    public void cancel(String reason) {
        synchronized (this) {
            if (isCancelled()) {
                return;
            }
            this.reason = reason != null ? reason : "Cancelled";
            cancelled.countDown();
        }
        Future<?> action = inFlight.get();
        if (action != null) {
            action.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String reason() {
        return reason;
    }

    /**
     * Waits for {@code duration} unless cancelled first.
     *
     * @return true if the run was cancelled (or the waiting thread interrupted)
     */
    public boolean awaitCancellation(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return isCancelled();
        }
        try {
            return cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    void bind(Future<?> action) {
        inFlight.set(action);
        if (isCancelled()) {
            action.cancel(true);
        }
    }

    void unbind() {
        inFlight.set(null);
    }
}
