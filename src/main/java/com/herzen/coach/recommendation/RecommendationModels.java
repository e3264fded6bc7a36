package com.herzen.coach.recommendation;

import com.herzen.coach.domain.DomainModels.DeferReason;
import com.herzen.coach.strategy.StrategyModels.Difficulty;
import com.herzen.coach.strategy.StrategyModels.InterventionType;
import com.herzen.coach.strategy.StrategyModels.Strategy;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public class RecommendationModels {
    public record FactorScore(String name, double value) {}

    /**
     * Outcome of strategy selection. A no-op selection has no strategy and carries the reason the
     * caller should defer with.
     */
    public record Selection(Strategy strategy, double score, List<FactorScore> factors, DeferReason deferReason) {
        public static Selection noop(DeferReason reason) {
            return new Selection(null, 0.0, List.of(), reason);
        }

        public boolean isNoop() {
            return strategy == null;
        }
    }

    public record ActionStep(String description, String timeframe, Difficulty difficulty, String successCriterion) {}

    public record Intervention(InterventionType type,
                               String message,
                               List<ActionStep> actionSteps,
                               Set<String> successMetrics,
                               Instant followUpAt,
                               List<String> tips,
                               double expectedBenefit,
                               boolean fallback) {}
}
