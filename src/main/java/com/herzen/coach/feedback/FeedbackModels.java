package com.herzen.coach.feedback;

import com.herzen.coach.history.HistoryModels.Outcome;

public class FeedbackModels {
    public record FeedbackRequest(String recordId, OutcomeReport outcome) {}

    /** Outcome as reported by a caller; every field is required. */
    public record OutcomeReport(Double effectiveness, Double satisfaction, Boolean completed) {
        public Outcome toOutcome() {
            if (effectiveness == null || effectiveness.isNaN()) throw new IllegalArgumentException("outcome.effectiveness is required");
            if (satisfaction == null || satisfaction.isNaN()) throw new IllegalArgumentException("outcome.satisfaction is required");
            if (completed == null) throw new IllegalArgumentException("outcome.completed is required");
            return new Outcome(effectiveness, satisfaction, completed);
        }
    }

    public record StrategyFeedbackRequest(Double effectiveness) {}

    public record FeedbackResult(String recordId, String amendmentId, String strategyName, double updatedWeight) {}

    public record WeightUpdate(String strategyName, double updatedWeight) {}
}
