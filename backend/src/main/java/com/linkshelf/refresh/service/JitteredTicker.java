package com.linkshelf.refresh.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

public class JitteredTicker {
    private final Duration interval;
    private final int jitterPercent;
    private final DoubleSupplier unitRandom;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wake = lock.newCondition();

    private boolean wakeRequested;

    public JitteredTicker(Duration interval, int jitterPercent) {
        this(interval, jitterPercent, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param unitRandom source of values in {@code [0, 1)}
     */
    public JitteredTicker(Duration interval, int jitterPercent, DoubleSupplier unitRandom) {
        this.interval = interval;
        this.jitterPercent = jitterPercent;
        this.unitRandom = unitRandom;
    }

    public Duration nextDelay() {
        double spread = jitterPercent / 100.0;
        double factor = 1.0 + (unitRandom.getAsDouble() * 2.0 - 1.0) * spread;
        long millis = Math.round(interval.toMillis() * factor);
        return Duration.ofMillis(Math.max(0L, millis));
    }

    /**
     * Blocks until the delay elapses, {@link #wakeUp()} is called or the signal is raised.
     *
     * @return true when a tick should run, false once the signal is raised
     */
    public boolean awaitTick(Duration delay, ShutdownSignal signal) throws InterruptedException {
        long remaining = Math.max(0L, delay.toNanos());
        lock.lock();
        try {
            while (!signal.isRaised() && !wakeRequested && remaining > 0) {
                remaining = wake.awaitNanos(remaining);
            }
            wakeRequested = false;
            return !signal.isRaised();
        } finally {
            lock.unlock();
        }
    }

    public void wakeUp() {
        lock.lock();
        try {
            wakeRequested = true;
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
