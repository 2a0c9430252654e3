package com.linkshelf.refresh.service;

import com.linkshelf.refresh.model.RunReport;
import com.linkshelf.refresh.model.SchedulerState;
import com.linkshelf.refresh.model.SchedulerStatusResponse;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

@Component
public class SchedulerRunTracker {
    private final ReentrantLock lock = new ReentrantLock();

    private SchedulerState state = SchedulerState.STOPPED;
    private Instant nextRunAt;
    private RunReport lastReport;
    private long cyclesCompleted;
    private long cyclesFailed;

    public SchedulerState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean compareAndSetState(SchedulerState expected, SchedulerState next) {
        lock.lock();
        try {
            if (state != expected) {
                return false;
            }
            state = next;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void setState(SchedulerState next) {
        lock.lock();
        try {
            state = next;
            if (next == SchedulerState.STOPPED) {
                nextRunAt = null;
            }
        } finally {
            lock.unlock();
        }
    }

    public void setNextRunAt(Instant nextRunAt) {
        lock.lock();
        try {
            this.nextRunAt = nextRunAt;
        } finally {
            lock.unlock();
        }
    }

    public void recordReport(RunReport report) {
        lock.lock();
        try {
            lastReport = report;
            if (report.isFailed()) {
                cyclesFailed++;
            } else {
                cyclesCompleted++;
            }
        } finally {
            lock.unlock();
        }
    }

    public SchedulerStatusResponse snapshot() {
        lock.lock();
        try {
            return new SchedulerStatusResponse(
                state,
                state == SchedulerState.RUNNING,
                nextRunAt,
                lastReport,
                cyclesCompleted,
                cyclesFailed
            );
        } finally {
            lock.unlock();
        }
    }
}
