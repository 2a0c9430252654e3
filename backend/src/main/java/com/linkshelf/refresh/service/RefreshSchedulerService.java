package com.linkshelf.refresh.service;

import com.linkshelf.config.RefreshProperties;
import com.linkshelf.config.SchedulerConfig;
import com.linkshelf.refresh.model.RunReport;
import com.linkshelf.refresh.model.SchedulerState;
import com.linkshelf.refresh.model.SchedulerStatusResponse;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

@Service
public class RefreshSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(RefreshSchedulerService.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final RefreshBatchCoordinator coordinator;
    private final SchedulerRunTracker tracker;
    private final SchedulerConfig config;
    private final RefreshProperties properties;
    private final Object lifecycleLock = new Object();

    private ExecutorService loopExecutor;
    private volatile ShutdownSignal signal;
    private volatile JitteredTicker ticker;

    public RefreshSchedulerService(
        RefreshBatchCoordinator coordinator,
        SchedulerRunTracker tracker,
        SchedulerConfig config,
        RefreshProperties properties
    ) {
        this.coordinator = coordinator;
        this.tracker = tracker;
        this.config = config;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        } else {
            log.info("Link refresh scheduler disabled by configuration");
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public SchedulerStatusResponse getStatus() {
        return tracker.snapshot();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (!tracker.compareAndSetState(SchedulerState.STOPPED, SchedulerState.STARTING)) {
                log.debug("Scheduler start ignored in state {}", tracker.state());
                return;
            }
            ShutdownSignal newSignal = new ShutdownSignal();
            JitteredTicker newTicker = new JitteredTicker(config.interval(), config.jitterPercent());
            newSignal.onRaise(newTicker::wakeUp);
            signal = newSignal;
            ticker = newTicker;
            loopExecutor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("link-refresh-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            loopExecutor.submit(() -> loop(newSignal, newTicker));
            loopExecutor.shutdown();
            log.info(
                "Link refresh scheduler started (interval={}, batchSize={}, maxConcurrency={}, jitter={}%)",
                config.interval(),
                config.batchSize(),
                config.maxConcurrency(),
                config.jitterPercent()
            );
        }
    }

    /**
     * Raises the shutdown signal and waits up to the shutdown timeout for the loop to drain.
     */
    public void stop() {
        ExecutorService executor;
        synchronized (lifecycleLock) {
            if (tracker.state() == SchedulerState.STOPPED || signal == null) {
                return;
            }
            tracker.setState(SchedulerState.STOPPING);
            signal.raise();
            executor = loopExecutor;
        }
        Duration timeout = config.shutdownTimeout();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scheduler did not stop within {}; the current batch is still draining", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the scheduler to stop");
        }
    }

    /**
     * Wakes the ticker so a cycle starts without waiting for the interval.
     *
     * @return false when the scheduler is not running
     */
    public boolean runNow() {
        JitteredTicker current = ticker;
        if (tracker.state() != SchedulerState.RUNNING || current == null) {
            log.debug("Run-now ignored in state {}", tracker.state());
            return false;
        }
        current.wakeUp();
        return true;
    }

    private void loop(ShutdownSignal loopSignal, JitteredTicker loopTicker) {
        tracker.compareAndSetState(SchedulerState.STARTING, SchedulerState.RUNNING);
        try {
            while (!loopSignal.isRaised()) {
                Duration delay = loopTicker.nextDelay();
                tracker.setNextRunAt(Instant.now().plus(delay));
                log.debug("Next refresh cycle in {}", delay);
                if (!loopTicker.awaitTick(delay, loopSignal)) {
                    break;
                }
                tracker.setNextRunAt(null);
                runCycle(loopSignal);
            }
            log.info("Scheduler shutdown signal received");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scheduler loop interrupted");
        } finally {
            tracker.setState(SchedulerState.STOPPED);
            log.info("Link refresh scheduler stopped");
        }
    }

    private void runCycle(ShutdownSignal loopSignal) {
        Instant startedAt = Instant.now();
        RunReport report;
        try {
            report = coordinator.runOnce(config, loopSignal);
        } catch (RuntimeException e) {
            log.error("Link refresh cycle failed", e);
            report = RunReport.failed(startedAt, Duration.between(startedAt, Instant.now()), summarizeError(e));
        }
        tracker.recordReport(report);
    }

    private String summarizeError(Exception e) {
        String message = e.getClass().getSimpleName() + ": " + e.getMessage();
        if (message.length() > MAX_ERROR_LENGTH) {
            return message.substring(0, MAX_ERROR_LENGTH);
        }
        return message;
    }
}
