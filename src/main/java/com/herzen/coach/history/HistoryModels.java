package com.herzen.coach.history;

import com.herzen.coach.context.ContextModels.FocusState;
import com.herzen.coach.context.ContextModels.TimeOfDay;
import com.herzen.coach.support.Scores;

import java.time.Instant;
import java.util.Set;

public class HistoryModels {

    public record Outcome(double effectiveness, double satisfaction, boolean completed) {
        public Outcome {
            effectiveness = Scores.clamp01(effectiveness);
            satisfaction = Scores.clamp01(satisfaction);
        }
    }

    /** Value copy of the context a record was created from; it never references live context state. */
    public record ContextSnapshot(String userId,
                                  double cognitiveLoad,
                                  double energyLevel,
                                  double stressLevel,
                                  FocusState focusState,
                                  String personalityType,
                                  TimeOfDay timeOfDay,
                                  Set<String> goals,
                                  Set<String> flags) {
        public ContextSnapshot {
            goals = goals == null ? Set.of() : Set.copyOf(goals);
            flags = flags == null ? Set.of() : Set.copyOf(flags);
        }
    }

    /**
     * Immutable history entry. An outcome is attached by appending an amended copy whose
     * {@code originalId} points at the delivered record; the copy keeps the original timestamp.
     */
    public record InterventionRecord(String id,
                                     String originalId,
                                     String userId,
                                     String strategyName,
                                     Instant timestamp,
                                     ContextSnapshot contextSnapshot,
                                     Outcome outcome) {

        public boolean hasOutcome() {
            return outcome != null;
        }

        public boolean isAmendment() {
            return originalId != null;
        }

        public String rootId() {
            return originalId == null ? id : originalId;
        }

        public InterventionRecord amendedWith(String amendmentId, Outcome newOutcome) {
            return new InterventionRecord(amendmentId, rootId(), userId, strategyName, timestamp, contextSnapshot, newOutcome);
        }
    }
}
