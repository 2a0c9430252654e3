package com.linkshelf.refresh.api;

import com.linkshelf.refresh.model.LinkRefreshResult;
import com.linkshelf.refresh.service.RefreshBatchCoordinator;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/links")
public class LinkRefreshController {
    private final RefreshBatchCoordinator coordinator;

    public LinkRefreshController(RefreshBatchCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/{id}/refresh")
    public LinkRefreshResult refresh(@PathVariable("id") UUID id) {
        return coordinator.refreshNow(id);
    }
}
