package com.linkshelf.refresh.service;

import com.linkshelf.refresh.model.FailureSource;
import com.linkshelf.refresh.model.Link;
import com.linkshelf.refresh.model.LinkStateWrite;
import com.linkshelf.refresh.model.LinkStatus;
import com.linkshelf.refresh.model.MetadataDelta;
import com.linkshelf.refresh.model.RefreshOutcome;

import java.time.Instant;

public final class OutcomeTransitions {

    private OutcomeTransitions() {}

    public static LinkStateWrite apply(Link link, RefreshOutcome outcome, int failureThreshold, Instant now) {
        return switch (outcome.kind()) {
            case SUCCESS -> success(link, outcome.delta(), now);
            case TRANSIENT_FAILURE -> transientFailure(link, outcome.source(), failureThreshold, now);
            case PERMANENT_FAILURE -> permanentFailure(link, outcome.source(), now);
        };
    }

    private static LinkStateWrite success(Link link, MetadataDelta delta, Instant now) {
        MetadataDelta changes = delta == null ? MetadataDelta.empty() : delta;
        LinkStatus status = link.status().isUnreachable() ? LinkStatus.ACTIVE : link.status();
        Instant refreshedAt = changes.isEmpty() ? null : now;
        return new LinkStateWrite(link.id(), link.status(), status, 0, now, refreshedAt, changes);
    }

    private static LinkStateWrite transientFailure(
        Link link,
        FailureSource source,
        int failureThreshold,
        Instant now
    ) {
        int failures = link.consecutiveFailures() + 1;
        LinkStatus status = link.status();
        if (failures >= failureThreshold && status == LinkStatus.ACTIVE) {
            status = unreachableStatus(link, source);
        }
        return new LinkStateWrite(link.id(), link.status(), status, failures, now, null, MetadataDelta.empty());
    }

    private static LinkStateWrite permanentFailure(Link link, FailureSource source, Instant now) {
        LinkStatus status = source == FailureSource.GITHUB ? LinkStatus.REPO_UNAVAILABLE : LinkStatus.INACCESSIBLE;
        return new LinkStateWrite(
            link.id(),
            link.status(),
            status,
            link.consecutiveFailures(),
            now,
            null,
            MetadataDelta.empty()
        );
    }

    private static LinkStatus unreachableStatus(Link link, FailureSource source) {
        if (link.githubRepo() && source == FailureSource.GITHUB) {
            return LinkStatus.REPO_UNAVAILABLE;
        }
        return LinkStatus.INACCESSIBLE;
    }
}
