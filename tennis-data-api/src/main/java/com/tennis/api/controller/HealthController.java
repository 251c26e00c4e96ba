package com.tennis.api.controller;

import com.tennis.api.service.HistoricalDataService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final HistoricalDataService historicalDataService;
    private final Clock clock;

    public HealthController(HistoricalDataService historicalDataService, Clock clock) {
        this.historicalDataService = historicalDataService;
        this.clock = clock;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check API status and archive availability")
    public Map<String, Object> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", Instant.now(clock));
        health.put("dataDirectory", historicalDataService.getDataDirectory());
        health.put("dataAvailable", historicalDataService.isDataAvailable());
        return health;
    }
}
