package com.linkshelf.refresh.service;

import com.linkshelf.config.SchedulerConfig;
import com.linkshelf.refresh.model.Link;
import com.linkshelf.refresh.persistence.LinkRefreshRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class LinkSelector {
    private final LinkRefreshRepository repository;

    public LinkSelector(LinkRefreshRepository repository) {
        this.repository = repository;
    }

    public List<Link> selectDue(SchedulerConfig config) {
        Instant checkedBefore = Instant.now().minus(config.interval());
        return repository.findDueLinks(config.batchSize(), checkedBefore, config.retryRepoUnavailable());
    }
}
