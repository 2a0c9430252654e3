package com.linkshelf.refresh.service;

import com.linkshelf.config.SchedulerConfig;
import com.linkshelf.refresh.github.GitHubClient;
import com.linkshelf.refresh.github.GitHubException;
import com.linkshelf.refresh.github.GitHubRepoRef;
import com.linkshelf.refresh.model.FailureSource;
import com.linkshelf.refresh.model.Link;
import com.linkshelf.refresh.model.MetadataDelta;
import com.linkshelf.refresh.model.PageMetadata;
import com.linkshelf.refresh.model.RefreshOutcome;
import com.linkshelf.refresh.model.RepoMetadata;
import com.linkshelf.refresh.scrape.PageScraper;
import com.linkshelf.refresh.scrape.ScrapeException;
import com.linkshelf.refresh.util.GitHubRepoUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

@Service
public class LinkRefreshWorker {
    private static final Logger log = LoggerFactory.getLogger(LinkRefreshWorker.class);
    static final String UNEXPECTED_ERROR = "unexpected_error";

    private final PageScraper pageScraper;
    private final GitHubClient gitHubClient;
    private final SchedulerConfig config;

    public LinkRefreshWorker(PageScraper pageScraper, GitHubClient gitHubClient, SchedulerConfig config) {
        this.pageScraper = pageScraper;
        this.gitHubClient = gitHubClient;
        this.config = config;
    }

    /**
     * Fetches fresh metadata for one link and classifies the result. Never writes and never throws.
     */
    public RefreshOutcome refresh(Link link) {
        Duration timeout = config.requestTimeout();
        PageMetadata page;
        try {
            page = pageScraper.fetchPage(link.url(), timeout);
        } catch (ScrapeException e) {
            log.debug("Page fetch failed for link {} ({}): {}", link.id(), e.getKind(), e.getMessage());
            return classify(e);
        } catch (RuntimeException e) {
            log.warn("Unexpected error fetching page for link {}", link.id(), e);
            return RefreshOutcome.transientFailure(FailureSource.PAGE, UNEXPECTED_ERROR);
        }

        RepoMetadata repo = null;
        if (link.githubRepo()) {
            GitHubRepoRef ref = GitHubRepoUrls.parse(link.url());
            if (ref == null) {
                log.debug("Link {} is flagged as a GitHub repo but {} has no owner/repo", link.id(), link.url());
            } else {
                try {
                    repo = gitHubClient.fetchRepo(ref.owner(), ref.repo(), timeout);
                } catch (GitHubException e) {
                    log.debug("GitHub fetch failed for {} ({}): {}", ref.fullName(), e.getKind(), e.getMessage());
                    return classify(e);
                } catch (RuntimeException e) {
                    log.warn("Unexpected error fetching GitHub repo {} for link {}", ref.fullName(), link.id(), e);
                    return RefreshOutcome.transientFailure(FailureSource.GITHUB, UNEXPECTED_ERROR);
                }
            }
        }
        return RefreshOutcome.success(MetadataDelta.between(link, page, repo));
    }

    static RefreshOutcome classify(ScrapeException e) {
        String reason = "page_" + e.getKind().name().toLowerCase(Locale.ROOT);
        return switch (e.getKind()) {
            case TIMEOUT, SERVER_ERROR, OTHER -> RefreshOutcome.transientFailure(FailureSource.PAGE, reason);
            case NOT_FOUND -> RefreshOutcome.permanentFailure(FailureSource.PAGE, reason);
        };
    }

    static RefreshOutcome classify(GitHubException e) {
        String reason = "github_" + e.getKind().name().toLowerCase(Locale.ROOT);
        return switch (e.getKind()) {
            case RATE_LIMITED, TIMEOUT, OTHER -> RefreshOutcome.transientFailure(FailureSource.GITHUB, reason);
            case NOT_FOUND -> RefreshOutcome.permanentFailure(FailureSource.GITHUB, reason);
        };
    }
}
