package com.herzen.coach.engine;

import com.herzen.coach.context.ContextModels.ContextConfidence;
import com.herzen.coach.domain.DomainModels.DeferReason;
import com.herzen.coach.recommendation.RecommendationModels.FactorScore;
import com.herzen.coach.recommendation.RecommendationModels.Intervention;

import java.time.Instant;
import java.util.List;

public class EngineModels {
    public record Timing(Instant followUpAt) {}

    /**
     * Decision returned to the caller. Deferred decisions carry only the reason and detail;
     * delivered ones carry the record id to report outcomes against.
     */
    public record InterventionResponse(boolean deferred,
                                       DeferReason reason,
                                       String detail,
                                       String recordId,
                                       String selectedStrategy,
                                       Double score,
                                       List<FactorScore> factors,
                                       Intervention intervention,
                                       Timing timing,
                                       ContextConfidence contextConfidence) {

        public static InterventionResponse deferred(DeferReason reason, String detail, ContextConfidence confidence) {
            return new InterventionResponse(true, reason, detail, null, null, null, null, null, null, confidence);
        }

        public static InterventionResponse delivered(String recordId, String strategy, double score, List<FactorScore> factors,
                                                     Intervention intervention, ContextConfidence confidence) {
            return new InterventionResponse(false, null, null, recordId, strategy, score, factors, intervention,
                    new Timing(intervention.followUpAt()), confidence);
        }
    }
}
