package com.linkshelf.refresh.api;

import com.linkshelf.refresh.model.DatabaseHealthResponse;
import com.linkshelf.refresh.model.SchedulerStatusResponse;
import com.linkshelf.refresh.persistence.LinkRefreshRepository;
import com.linkshelf.refresh.service.RefreshSchedulerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/health")
public class HealthController {
    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final RefreshSchedulerService schedulerService;
    private final LinkRefreshRepository repository;

    public HealthController(RefreshSchedulerService schedulerService, LinkRefreshRepository repository) {
        this.schedulerService = schedulerService;
        this.repository = repository;
    }

    @GetMapping("/scheduler")
    public SchedulerStatusResponse scheduler() {
        return schedulerService.getStatus();
    }

    @GetMapping("/database")
    public ResponseEntity<DatabaseHealthResponse> database() {
        boolean connected;
        try {
            connected = repository.isDbReachable();
        } catch (DataAccessException e) {
            log.warn("Database health check failed", e);
            connected = false;
        }
        if (connected) {
            return ResponseEntity.ok(new DatabaseHealthResponse("healthy", true));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new DatabaseHealthResponse("unhealthy", false));
    }
}
