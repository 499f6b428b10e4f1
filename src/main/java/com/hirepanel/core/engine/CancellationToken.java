package com.hirepanel.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal threaded through one evaluation run.
 * <p>
 * Listeners registered after cancellation run immediately on the registering
 * thread. A listener may run more than once under a race, so listeners must be
 * idempotent.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancellation requested");
            for (Runnable listener : listeners) {
                runSafely(listener);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Registration onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            runSafely(listener);
        }
        return () -> listeners.remove(listener);
    }

    @FunctionalInterface
    public interface Registration {
        void remove();
    }

    private static void runSafely(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed: {}", e.getMessage(), e);
        }
    }
}
