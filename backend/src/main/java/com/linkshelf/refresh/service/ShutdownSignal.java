package com.linkshelf.refresh.service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation flag shared by the scheduler loop, the ticker and the batch coordinator.
 */
public final class ShutdownSignal {
    private final AtomicBoolean raised = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void raise() {
        if (!raised.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
    }

    public boolean isRaised() {
        return raised.get();
    }

    public void onRaise(Runnable listener) {
        listeners.add(listener);
        if (raised.get()) {
            listener.run();
        }
    }
}
