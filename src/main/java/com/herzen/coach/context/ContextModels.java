package com.herzen.coach.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.herzen.coach.history.HistoryModels.ContextSnapshot;
import com.herzen.coach.history.HistoryModels.InterventionRecord;

import java.util.List;
import java.util.Locale;
import java.util.Set;

public class ContextModels {

    public enum FocusState {
        DEEP, SHALLOW, SCATTERED, FLOW;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }

        /** Unknown codes map to {@code null} so the normalizer can default them. */
        @JsonCreator
        public static FocusState fromCode(String code) {
            if (code == null) return null;
            for (FocusState s : values()) {
                if (s.name().equalsIgnoreCase(code.trim())) return s;
            }
            return null;
        }
    }

    public enum TimeOfDay {
        MORNING, AFTERNOON, EVENING, NIGHT;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static TimeOfDay fromCode(String code) {
            if (code == null) return null;
            for (TimeOfDay t : values()) {
                if (t.name().equalsIgnoreCase(code.trim())) return t;
            }
            return null;
        }

        public static TimeOfDay ofHour(int hour) {
            if (hour >= 5 && hour < 12) return MORNING;
            if (hour >= 12 && hour < 17) return AFTERNOON;
            if (hour >= 17 && hour < 22) return EVENING;
            return NIGHT;
        }
    }

    /**
     * Context payload as it arrives from a caller or the telemetry provider. Every field except
     * {@code userId} is optional: direct values win, raw counters are used to derive missing ones.
     */
    public record RawSignals(String userId,
                             Double cognitiveLoad,
                             Double energyLevel,
                             Double stressLevel,
                             FocusState focusState,
                             String personalityType,
                             TimeOfDay timeOfDay,
                             Set<String> goals,
                             Integer taskSwitches,
                             Integer tabCount,
                             Integer interruptionCount,
                             Integer meetingCount,
                             Integer minutesSinceBreak,
                             Integer focusSessionMinutes,
                             Integer hour) {

        public static RawSignals empty(String userId) {
            return new RawSignals(userId, null, null, null, null, null, null, null,
                    null, null, null, null, null, null, null);
        }

        public RawSignals withUserId(String id) {
            return new RawSignals(id, cognitiveLoad, energyLevel, stressLevel, focusState, personalityType, timeOfDay, goals,
                    taskSwitches, tabCount, interruptionCount, meetingCount, minutesSinceBreak, focusSessionMinutes, hour);
        }
    }

    public record ContextConfidence(double score, List<String> defaultedFields) {
        public ContextConfidence {
            defaultedFields = List.copyOf(defaultedFields);
        }
    }

    public record UserContext(String userId,
                              double cognitiveLoad,
                              double energyLevel,
                              double stressLevel,
                              FocusState focusState,
                              String personalityType,
                              TimeOfDay timeOfDay,
                              List<InterventionRecord> recentInteractions,
                              Set<String> goals,
                              Set<String> flags,
                              ContextConfidence confidence) {
        public UserContext {
            recentInteractions = recentInteractions == null ? List.of() : List.copyOf(recentInteractions);
            goals = goals == null ? Set.of() : Set.copyOf(goals);
            flags = flags == null ? Set.of() : Set.copyOf(flags);
        }

        public ContextSnapshot snapshot() {
            return new ContextSnapshot(userId, cognitiveLoad, energyLevel, stressLevel, focusState,
                    personalityType, timeOfDay, goals, flags);
        }
    }
}
