package com.ecoauditor.core.util;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * External cancellation request for an audit run.
 *
 * <p>Cancelling is idempotent. Listeners registered before cancellation run once, on the
 * cancelling thread; listeners registered afterwards run immediately.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * Creates a signal that has not been cancelled.
     *
     * @return new signal
     */
    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            listeners.forEach(Runnable::run);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers work to run when the signal is cancelled.
     *
     * @param listener callback, typically aborting in-flight I/O
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }
}
