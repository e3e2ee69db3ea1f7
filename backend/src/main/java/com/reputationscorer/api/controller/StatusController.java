package com.reputationscorer.api.controller;

import com.reputationscorer.api.dto.HealthResponse;
import com.reputationscorer.stats.ProcessingStats;
import com.reputationscorer.stats.StatsSnapshot;
import com.reputationscorer.stream.ActivityStreamProcessor;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/v1/health, GET /api/v1/stats. Read-only; never touches the processing loop.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class StatusController {

    private final ProcessingStats processingStats;
    private final ActivityStreamProcessor activityStreamProcessor;

    @GetMapping("/health")
    public HealthResponse health() {
        String status = activityStreamProcessor.isDegraded() ? HealthResponse.DEGRADED : HealthResponse.OK;
        return new HealthResponse(status, activityStreamProcessor.getState().name());
    }

    @GetMapping("/stats")
    public StatsSnapshot stats() {
        return processingStats.snapshot();
    }
}
