package com.linkshelf.refresh.service;

import com.linkshelf.config.SchedulerConfig;
import com.linkshelf.refresh.model.Link;
import com.linkshelf.refresh.model.LinkRefreshResult;
import com.linkshelf.refresh.model.LinkStateWrite;
import com.linkshelf.refresh.model.LinkStatus;
import com.linkshelf.refresh.model.RefreshOutcome;
import com.linkshelf.refresh.model.RunReport;
import com.linkshelf.refresh.persistence.LinkRefreshRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;

@Service
public class RefreshBatchCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RefreshBatchCoordinator.class);

    private final LinkSelector linkSelector;
    private final LinkRefreshWorker worker;
    private final LinkRefreshRepository repository;
    private final ExecutorService executor;
    private final SchedulerConfig config;
    // Links with a refresh between snapshot and write-back, from either a cycle or a manual refresh.
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    public RefreshBatchCoordinator(
        LinkSelector linkSelector,
        LinkRefreshWorker worker,
        LinkRefreshRepository repository,
        @Qualifier("refreshExecutor") ExecutorService executor,
        SchedulerConfig config
    ) {
        this.linkSelector = linkSelector;
        this.worker = worker;
        this.repository = repository;
        this.executor = executor;
        this.config = config;
    }

    /**
     * Runs one refresh cycle. Selection errors propagate; per-link write errors are counted and skipped.
     */
    public RunReport runOnce(SchedulerConfig cycleConfig, ShutdownSignal signal) {
        Instant startedAt = Instant.now();
        List<Link> due = linkSelector.selectDue(cycleConfig);
        CycleTally tally = new CycleTally(due.size());
        if (due.isEmpty()) {
            log.debug("No links due for refresh");
            return tally.toReport(startedAt);
        }
        log.info("Refreshing {} links (maxConcurrency={})", due.size(), cycleConfig.maxConcurrency());

        Semaphore permits = new Semaphore(cycleConfig.maxConcurrency());
        CompletionService<CompletedRefresh> completions = new ExecutorCompletionService<>(executor);
        Set<UUID> claimed = new HashSet<>();
        try {
            for (Link link : due) {
                drainCompleted(completions, tally, cycleConfig, claimed);
                while (!signal.isRaised() && !permits.tryAcquire()) {
                    applyCompleted(completions.take(), tally, cycleConfig, claimed);
                }
                if (signal.isRaised()) {
                    tally.cancelled = true;
                    log.info(
                        "Shutdown requested; stopping dispatch after {} of {} links",
                        tally.attempted,
                        due.size()
                    );
                    break;
                }
                if (!inFlight.add(link.id())) {
                    permits.release();
                    log.info("Skipping link {}: a manual refresh is in progress", link.id());
                    continue;
                }
                claimed.add(link.id());
                completions.submit(() -> {
                    try {
                        return new CompletedRefresh(link, worker.refresh(link));
                    } finally {
                        permits.release();
                    }
                });
                tally.attempted++;
            }
            while (tally.collected < tally.attempted) {
                applyCompleted(completions.take(), tally, cycleConfig, claimed);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tally.cancelled = true;
            log.warn(
                "Refresh cycle interrupted with {} outcomes not applied",
                tally.attempted - tally.collected
            );
        } finally {
            claimed.forEach(inFlight::remove);
        }

        RunReport report = tally.toReport(startedAt);
        log.info(
            "Refresh cycle finished: selected={} attempted={} succeeded={} failed={} inaccessible={} "
                + "repoUnavailable={} recovered={} writeErrors={} cancelled={} duration={}ms",
            report.linksSelected(),
            report.linksAttempted(),
            report.linksSucceeded(),
            report.linksFailed(),
            report.linksTransitionedToInaccessible(),
            report.linksTransitionedToRepoUnavailable(),
            report.linksRecovered(),
            report.writeErrors(),
            report.cancelled(),
            report.duration().toMillis()
        );
        return report;
    }

    /**
     * Refreshes one link right away, ignoring due-ness and the repo_unavailable retry policy.
     * Rejected with {@link LinkRefreshInProgressException} while a cycle or another manual refresh holds the link.
     */
    public LinkRefreshResult refreshNow(UUID linkId) {
        if (!inFlight.add(linkId)) {
            throw new LinkRefreshInProgressException(linkId);
        }
        try {
            return refreshClaimed(linkId);
        } finally {
            inFlight.remove(linkId);
        }
    }

    private LinkRefreshResult refreshClaimed(UUID linkId) {
        Link link = repository.findById(linkId);
        if (link == null) {
            throw new LinkNotFoundException(linkId);
        }
        if (link.status() == LinkStatus.ARCHIVED) {
            throw new LinkArchivedException(linkId);
        }
        RefreshOutcome outcome = worker.refresh(link);
        LinkStateWrite write = OutcomeTransitions.apply(link, outcome, config.failureThreshold(), Instant.now());
        boolean written = repository.applyStateWrite(write);
        log.info("Manual refresh of link {}: outcome={} status={} written={}",
            linkId, outcome.kind(), write.status(), written);
        return new LinkRefreshResult(
            linkId,
            outcome.kind(),
            outcome.source(),
            outcome.reason(),
            written ? write.status() : link.status(),
            written ? write.consecutiveFailures() : link.consecutiveFailures(),
            written ? write.lastChecked() : link.lastChecked(),
            written ? write.delta().changedFields() : List.of(),
            written
        );
    }

    private void drainCompleted(
        CompletionService<CompletedRefresh> completions,
        CycleTally tally,
        SchedulerConfig cycleConfig,
        Set<UUID> claimed
    ) {
        Future<CompletedRefresh> ready;
        while ((ready = completions.poll()) != null) {
            applyCompleted(ready, tally, cycleConfig, claimed);
        }
    }

    private void applyCompleted(
        Future<CompletedRefresh> future,
        CycleTally tally,
        SchedulerConfig cycleConfig,
        Set<UUID> claimed
    ) {
        tally.collected++;
        CompletedRefresh completed;
        try {
            completed = future.get();
        } catch (ExecutionException e) {
            tally.failed++;
            log.warn("Refresh worker failed without an outcome", e.getCause());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tally.failed++;
            return;
        }

        RefreshOutcome outcome = completed.outcome();
        if (outcome.isSuccess()) {
            tally.succeeded++;
        } else {
            tally.failed++;
            log.debug("Link {} refresh failed: {} ({})", completed.link().id(), outcome.reason(), outcome.kind());
        }

        LinkStateWrite write = OutcomeTransitions.apply(
            completed.link(),
            outcome,
            cycleConfig.failureThreshold(),
            Instant.now()
        );
        try {
            if (!repository.applyStateWrite(write)) {
                log.info("Skipped write for link {}: archived or deleted since selection", write.linkId());
                return;
            }
        } catch (DataAccessException e) {
            tally.writeErrors++;
            log.warn("Failed to write refresh result for link {}", write.linkId(), e);
            return;
        } finally {
            claimed.remove(write.linkId());
            inFlight.remove(write.linkId());
        }
        if (write.becameInaccessible()) {
            tally.inaccessible++;
            log.info("Link {} marked inaccessible ({})", write.linkId(), outcome.reason());
        } else if (write.becameRepoUnavailable()) {
            tally.repoUnavailable++;
            log.info("Link {} marked repo_unavailable ({})", write.linkId(), outcome.reason());
        } else if (write.recovered()) {
            tally.recovered++;
            log.info("Link {} recovered from {}", write.linkId(), write.previousStatus().dbValue());
        }
    }

    private record CompletedRefresh(Link link, RefreshOutcome outcome) {
    }

    private static final class CycleTally {
        private final int selected;
        private int attempted;
        private int collected;
        private int succeeded;
        private int failed;
        private int inaccessible;
        private int repoUnavailable;
        private int recovered;
        private int writeErrors;
        private boolean cancelled;

        private CycleTally(int selected) {
            this.selected = selected;
        }

        private RunReport toReport(Instant startedAt) {
            return new RunReport(
                startedAt,
                Duration.between(startedAt, Instant.now()),
                selected,
                attempted,
                succeeded,
                failed,
                inaccessible,
                repoUnavailable,
                recovered,
                writeErrors,
                cancelled,
                null
            );
        }
    }
}
