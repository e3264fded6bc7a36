package com.herzen.coach.api;

import com.herzen.coach.analytics.AnalyticsModels;
import com.herzen.coach.analytics.AnalyticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {
    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @PostMapping("/recompute")
    public ResponseEntity<Void> recompute() {
        analyticsService.recomputeAggregates();
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/strategies")
    public ResponseEntity<AnalyticsModels.StrategyOverviewResponse> strategies() {
        return ResponseEntity.ok(analyticsService.overview());
    }
}
