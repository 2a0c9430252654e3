package com.linkshelf.refresh.api;

import com.linkshelf.refresh.model.SchedulerStatusResponse;
import com.linkshelf.refresh.persistence.LinkRefreshRepository;
import com.linkshelf.refresh.service.RefreshSchedulerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {
    private final RefreshSchedulerService schedulerService;
    private final LinkRefreshRepository repository;

    public SchedulerController(RefreshSchedulerService schedulerService, LinkRefreshRepository repository) {
        this.schedulerService = schedulerService;
        this.repository = repository;
    }

    @PostMapping("/start")
    public SchedulerStatusResponse start() {
        schedulerService.start();
        return schedulerService.getStatus();
    }

    @PostMapping("/stop")
    public SchedulerStatusResponse stop() {
        schedulerService.stop();
        return schedulerService.getStatus();
    }

    @PostMapping("/run")
    public SchedulerStatusResponse run() {
        schedulerService.runNow();
        return schedulerService.getStatus();
    }

    @GetMapping("/status")
    public SchedulerStatusResponse status() {
        return schedulerService.getStatus();
    }

    @GetMapping("/links/status-counts")
    public Map<String, Long> statusCounts() {
        return repository.countByStatus();
    }
}
