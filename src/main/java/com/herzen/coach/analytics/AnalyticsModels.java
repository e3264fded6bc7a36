package com.herzen.coach.analytics;

import java.time.Instant;
import java.util.List;

public class AnalyticsModels {
    public record StrategyAggregate(String strategyName,
                                    long delivered,
                                    long outcomes,
                                    double avgEffectiveness,
                                    double avgSatisfaction,
                                    double completionRate,
                                    double weight,
                                    Instant computedAt) {}

    public record StrategyOverviewResponse(List<StrategyAggregate> strategies) {}
}
