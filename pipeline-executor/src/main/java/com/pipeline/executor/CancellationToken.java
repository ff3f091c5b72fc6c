package com.pipeline.executor;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot cancellation signal shared between the dispatcher and a running executor.
 * The first reason wins; later signals are ignored.
 */
public final class CancellationToken {

    /**
     * Why an execution was asked to stop.
     */
    public enum Reason {
        USER,
        TIMEOUT,
        SHUTDOWN,
        PROJECT_DELETED
    }

    private final AtomicReference<Reason> reason = new AtomicReference<>();
    private final CountDownLatch signalled = new CountDownLatch(1);

    /**
     * Signal cancellation.
     *
     * @return true if this call signalled the token, false if it was already cancelled
     */
    public boolean cancel(Reason why) {
        if (reason.compareAndSet(null, why)) {
            signalled.countDown();
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public Optional<Reason> reason() {
        return Optional.ofNullable(reason.get());
    }

    /**
     * Wait until the token is signalled or the timeout elapses.
     *
     * @return true if the token was signalled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return signalled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
