package com.naturalsql.util;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation flag for one request, plus the asynchronous call currently running on its behalf.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<Future<?>> current = new AtomicReference<>();

    /**
     * Track an in-flight call. A call attached after {@link #cancel()} is cancelled immediately.
     *
     * @param future in-flight call
     */
    public void attach(Future<?> future) {
        current.set(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    public void detach(Future<?> future) {
        current.compareAndSet(future, null);
    }

    /**
     * Mark the request cancelled and abort the attached call, if any.
     *
     * @return true if a call was running
     */
    public boolean cancel() {
        cancelled.set(true);
        Future<?> f = current.get();
        return f != null && f.cancel(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
