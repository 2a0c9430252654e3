package com.linkshelf.refresh.service;

import com.linkshelf.config.SchedulerConfig;
import com.linkshelf.refresh.LinkFixtures;
import com.linkshelf.refresh.github.GitHubClient;
import com.linkshelf.refresh.model.Link;
import com.linkshelf.refresh.model.LinkRefreshResult;
import com.linkshelf.refresh.model.LinkStateWrite;
import com.linkshelf.refresh.model.LinkStatus;
import com.linkshelf.refresh.model.PageMetadata;
import com.linkshelf.refresh.model.RefreshOutcome;
import com.linkshelf.refresh.model.RunReport;
import com.linkshelf.refresh.persistence.LinkRefreshRepository;
import com.linkshelf.refresh.scrape.PageScraper;
import com.linkshelf.refresh.scrape.ScrapeErrorKind;
import com.linkshelf.refresh.scrape.ScrapeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RefreshBatchCoordinatorTest {
    private final LinkSelector linkSelector = Mockito.mock(LinkSelector.class);
    private final LinkRefreshRepository repository = Mockito.mock(LinkRefreshRepository.class);
    private final GitHubClient gitHubClient = Mockito.mock(GitHubClient.class);
    private final ExecutorService executor = Executors.newFixedThreadPool(8);
    private final ExecutorService caller = Executors.newSingleThreadExecutor();
    private final List<LinkStateWrite> writes = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        caller.shutdownNow();
    }

    @Test
    void mixedBatchWritesEveryOutcome() {
        SchedulerConfig config = LinkFixtures.config(50, 4, 3);
        Link fresh = LinkFixtures.activeLink("https://ok.example.com/");
        Link gone = LinkFixtures.activeLink("https://gone.example.com/");
        Link flaky = LinkFixtures.link("https://flaky.example.com/", false, LinkStatus.ACTIVE, 2);
        PageScraper scraper = (url, timeout) -> {
            if (url.contains("gone")) {
                throw new ScrapeException(ScrapeErrorKind.NOT_FOUND, 404, "http_404");
            }
            if (url.contains("flaky")) {
                throw new ScrapeException(ScrapeErrorKind.TIMEOUT, "timeout");
            }
            return new PageMetadata("OK", null, null);
        };
        when(linkSelector.selectDue(config)).thenReturn(List.of(fresh, gone, flaky));
        recordWrites();

        RunReport report = coordinator(scraper, config).runOnce(config, new ShutdownSignal());

        assertThat(report.linksSelected()).isEqualTo(3);
        assertThat(report.linksAttempted()).isEqualTo(3);
        assertThat(report.linksSucceeded()).isEqualTo(1);
        assertThat(report.linksFailed()).isEqualTo(2);
        assertThat(report.linksTransitionedToInaccessible()).isEqualTo(2);
        assertThat(report.writeErrors()).isZero();
        assertThat(report.cancelled()).isFalse();

        Map<UUID, LinkStateWrite> byId = writesById();
        assertThat(byId.get(fresh.id()).status()).isEqualTo(LinkStatus.ACTIVE);
        assertThat(byId.get(fresh.id()).delta().title()).isEqualTo("OK");
        assertThat(byId.get(fresh.id()).refreshedAt()).isNotNull();
        assertThat(byId.get(gone.id()).status()).isEqualTo(LinkStatus.INACCESSIBLE);
        assertThat(byId.get(gone.id()).consecutiveFailures()).isZero();
        assertThat(byId.get(flaky.id()).status()).isEqualTo(LinkStatus.INACCESSIBLE);
        assertThat(byId.get(flaky.id()).consecutiveFailures()).isEqualTo(3);
    }

    @Test
    void emptySelectionStillProducesReport() {
        SchedulerConfig config = LinkFixtures.config(50, 4, 3);
        when(linkSelector.selectDue(config)).thenReturn(List.of());

        RunReport report = coordinator((url, timeout) -> PageMetadata.empty(), config)
            .runOnce(config, new ShutdownSignal());

        assertThat(report.linksSelected()).isZero();
        assertThat(report.linksAttempted()).isZero();
        assertThat(report.isFailed()).isFalse();
        verify(repository, never()).applyStateWrite(any());
    }

    @Test
    void neverRunsMoreWorkersThanMaxConcurrency() {
        SchedulerConfig config = LinkFixtures.config(50, 3, 3);
        List<Link> links = links(12);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        PageScraper scraper = (url, timeout) -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                active.decrementAndGet();
            }
            return PageMetadata.empty();
        };
        when(linkSelector.selectDue(config)).thenReturn(links);
        recordWrites();

        RunReport report = coordinator(scraper, config).runOnce(config, new ShutdownSignal());

        assertThat(report.linksAttempted()).isEqualTo(12);
        assertThat(report.linksSucceeded()).isEqualTo(12);
        assertThat(peak.get()).isBetween(1, 3);
        assertThat(writes).hasSize(12);
    }

    @Test
    void shutdownStopsDispatchAndDrainsInFlightWork() throws Exception {
        SchedulerConfig config = LinkFixtures.config(50, 2, 3);
        List<Link> links = links(10);
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        PageScraper scraper = (url, timeout) -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return PageMetadata.empty();
        };
        when(linkSelector.selectDue(config)).thenReturn(links);
        recordWrites();
        ShutdownSignal signal = new ShutdownSignal();
        RefreshBatchCoordinator coordinator = coordinator(scraper, config);

        Future<RunReport> run = caller.submit(() -> coordinator.runOnce(config, signal));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        signal.raise();
        release.countDown();
        RunReport report = run.get(5, TimeUnit.SECONDS);

        assertThat(report.cancelled()).isTrue();
        assertThat(report.linksSelected()).isEqualTo(10);
        assertThat(report.linksAttempted()).isEqualTo(2);
        assertThat(report.linksSkipped()).isEqualTo(8);
        assertThat(writes).hasSize(2);
        assertThat(writes).extracting(LinkStateWrite::linkId)
            .containsExactlyInAnyOrder(links.get(0).id(), links.get(1).id());
    }

    @Test
    void writeErrorIsCountedAndDoesNotStopTheBatch() {
        SchedulerConfig config = LinkFixtures.config(50, 2, 3);
        List<Link> links = links(3);
        UUID broken = links.get(1).id();
        when(linkSelector.selectDue(config)).thenReturn(links);
        when(repository.applyStateWrite(any())).thenAnswer(invocation -> {
            LinkStateWrite write = invocation.getArgument(0);
            if (write.linkId().equals(broken)) {
                throw new DataAccessResourceFailureException("connection reset");
            }
            writes.add(write);
            return true;
        });

        RunReport report = coordinator((url, timeout) -> new PageMetadata("T", null, null), config)
            .runOnce(config, new ShutdownSignal());

        assertThat(report.writeErrors()).isEqualTo(1);
        assertThat(report.linksAttempted()).isEqualTo(3);
        assertThat(report.isFailed()).isFalse();
        assertThat(writes).extracting(LinkStateWrite::linkId)
            .containsExactlyInAnyOrder(links.get(0).id(), links.get(2).id());
    }

    @Test
    void slowWorkerDoesNotDelayOtherWrites() throws Exception {
        SchedulerConfig config = LinkFixtures.config(50, 2, 3);
        Link slow = LinkFixtures.activeLink("https://slow.example.com/");
        Link fast = LinkFixtures.activeLink("https://fast.example.com/");
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch fastWritten = new CountDownLatch(1);
        PageScraper scraper = (url, timeout) -> {
            if (url.contains("slow")) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return PageMetadata.empty();
        };
        when(linkSelector.selectDue(config)).thenReturn(List.of(slow, fast));
        when(repository.applyStateWrite(any())).thenAnswer(invocation -> {
            LinkStateWrite write = invocation.getArgument(0);
            writes.add(write);
            if (write.linkId().equals(fast.id())) {
                fastWritten.countDown();
            }
            return true;
        });
        RefreshBatchCoordinator coordinator = coordinator(scraper, config);

        Future<RunReport> run = caller.submit(() -> coordinator.runOnce(config, new ShutdownSignal()));
        boolean fastWrittenWhileSlowBlocked = fastWritten.await(3, TimeUnit.SECONDS);
        release.countDown();
        RunReport report = run.get(5, TimeUnit.SECONDS);

        assertThat(fastWrittenWhileSlowBlocked).isTrue();
        assertThat(writes).extracting(LinkStateWrite::linkId).containsExactly(fast.id(), slow.id());
        assertThat(report.linksSucceeded()).isEqualTo(2);
    }

    @Test
    void selectionErrorPropagates() {
        SchedulerConfig config = LinkFixtures.config(50, 2, 3);
        when(linkSelector.selectDue(config)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> coordinator((url, timeout) -> PageMetadata.empty(), config)
            .runOnce(config, new ShutdownSignal()))
            .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void skippedWriteForArchivedLinkIsNotCountedAsTransition() {
        SchedulerConfig config = LinkFixtures.config(50, 2, 1);
        Link link = LinkFixtures.activeLink("https://gone.example.com/");
        when(linkSelector.selectDue(config)).thenReturn(List.of(link));
        when(repository.applyStateWrite(any())).thenReturn(false);
        PageScraper scraper = (url, timeout) -> {
            throw new ScrapeException(ScrapeErrorKind.NOT_FOUND, 404, "http_404");
        };

        RunReport report = coordinator(scraper, config).runOnce(config, new ShutdownSignal());

        assertThat(report.linksFailed()).isEqualTo(1);
        assertThat(report.linksTransitionedToInaccessible()).isZero();
        assertThat(report.writeErrors()).isZero();
    }

    @Test
    void refreshNowRejectsMissingAndArchivedLinks() {
        SchedulerConfig config = LinkFixtures.config(50, 2, 3);
        UUID missing = UUID.randomUUID();
        Link archived = LinkFixtures.link("https://old.example.com/", false, LinkStatus.ARCHIVED, 0);
        when(repository.findById(missing)).thenReturn(null);
        when(repository.findById(archived.id())).thenReturn(archived);
        RefreshBatchCoordinator coordinator = coordinator((url, timeout) -> PageMetadata.empty(), config);

        assertThatThrownBy(() -> coordinator.refreshNow(missing)).isInstanceOf(LinkNotFoundException.class);
        assertThatThrownBy(() -> coordinator.refreshNow(archived.id())).isInstanceOf(LinkArchivedException.class);
        verify(repository, never()).applyStateWrite(any());
    }

    @Test
    void refreshNowRefreshesRepoUnavailableLinkRegardlessOfPolicy() {
        SchedulerConfig config = LinkFixtures.config(50, 2, 3);
        Link link = LinkFixtures.link("https://github.com/acme/widget", true, LinkStatus.REPO_UNAVAILABLE, 4);
        when(repository.findById(link.id())).thenReturn(link);
        recordWrites();
        RefreshBatchCoordinator coordinator = coordinator((url, timeout) -> new PageMetadata("Widget", null, null), config);

        LinkRefreshResult result = coordinator.refreshNow(link.id());

        assertThat(result.written()).isTrue();
        assertThat(result.outcome()).isEqualTo(RefreshOutcome.Kind.SUCCESS);
        assertThat(result.status()).isEqualTo(LinkStatus.ACTIVE);
        assertThat(result.consecutiveFailures()).isZero();
        assertThat(result.changedFields()).contains("title");
        verify(linkSelector, never()).selectDue(any());
    }

    @Test
    void refreshNowIsRejectedWhileCycleHoldsTheLink() throws Exception {
        SchedulerConfig config = LinkFixtures.config(50, 2, 3);
        Link link = LinkFixtures.link("https://flaky.example.com/", false, LinkStatus.ACTIVE, 2);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        PageScraper scraper = (url, timeout) -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new ScrapeException(ScrapeErrorKind.TIMEOUT, "timeout");
        };
        when(linkSelector.selectDue(config)).thenReturn(List.of(link));
        when(repository.findById(link.id())).thenReturn(link);
        recordWrites();
        RefreshBatchCoordinator coordinator = coordinator(scraper, config);

        Future<RunReport> run = caller.submit(() -> coordinator.runOnce(config, new ShutdownSignal()));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> coordinator.refreshNow(link.id()))
            .isInstanceOf(LinkRefreshInProgressException.class);

        release.countDown();
        RunReport report = run.get(5, TimeUnit.SECONDS);

        assertThat(report.linksTransitionedToInaccessible()).isEqualTo(1);
        assertThat(writes).hasSize(1);
        assertThat(writes.get(0).status()).isEqualTo(LinkStatus.INACCESSIBLE);
        assertThat(writes.get(0).consecutiveFailures()).isEqualTo(3);

        // released once the cycle's write is applied
        LinkRefreshResult manual = coordinator.refreshNow(link.id());
        assertThat(manual.written()).isTrue();
        assertThat(writes).hasSize(2);
    }

    @Test
    void cycleSkipsLinkHeldByManualRefresh() throws Exception {
        SchedulerConfig config = LinkFixtures.config(50, 2, 3);
        Link held = LinkFixtures.activeLink("https://held.example.com/");
        Link other = LinkFixtures.activeLink("https://other.example.com/");
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        PageScraper scraper = (url, timeout) -> {
            if (url.contains("held")) {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return new PageMetadata("Fresh", null, null);
        };
        when(linkSelector.selectDue(config)).thenReturn(List.of(held, other));
        when(repository.findById(held.id())).thenReturn(held);
        recordWrites();
        RefreshBatchCoordinator coordinator = coordinator(scraper, config);

        Future<LinkRefreshResult> manual = caller.submit(() -> coordinator.refreshNow(held.id()));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        RunReport report = coordinator.runOnce(config, new ShutdownSignal());
        release.countDown();
        LinkRefreshResult result = manual.get(5, TimeUnit.SECONDS);

        assertThat(report.linksSelected()).isEqualTo(2);
        assertThat(report.linksAttempted()).isEqualTo(1);
        assertThat(result.written()).isTrue();
        assertThat(writes).extracting(LinkStateWrite::linkId).containsExactly(other.id(), held.id());
    }

    private RefreshBatchCoordinator coordinator(PageScraper scraper, SchedulerConfig config) {
        LinkRefreshWorker worker = new LinkRefreshWorker(scraper, gitHubClient, config);
        return new RefreshBatchCoordinator(linkSelector, worker, repository, executor, config);
    }

    private void recordWrites() {
        when(repository.applyStateWrite(any())).thenAnswer(invocation -> {
            writes.add(invocation.getArgument(0));
            return true;
        });
    }

    private Map<UUID, LinkStateWrite> writesById() {
        Map<UUID, LinkStateWrite> byId = new ConcurrentHashMap<>();
        for (LinkStateWrite write : writes) {
            byId.put(write.linkId(), write);
        }
        return byId;
    }

    private List<Link> links(int count) {
        List<Link> links = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            links.add(LinkFixtures.activeLink("https://site" + i + ".example.com/"));
        }
        return links;
    }
}
