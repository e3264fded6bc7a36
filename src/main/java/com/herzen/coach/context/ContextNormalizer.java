package com.herzen.coach.context;

import com.herzen.coach.context.ContextModels.*;
import com.herzen.coach.history.HistoryModels.InterventionRecord;
import com.herzen.coach.support.Scores;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.*;

/**
 * Turns raw context signals into a bounded {@link UserContext}.
 * <p>
 * Never throws on missing input. A direct value wins over a value derived from telemetry counters;
 * when neither is available the documented default is used and the field is listed in
 * {@link ContextConfidence#defaultedFields()}.
 */
@Component
public class ContextNormalizer {
    public static final double DEFAULT_COGNITIVE_LOAD = 0.5;
    public static final double DEFAULT_ENERGY_LEVEL = 0.5;
    public static final double DEFAULT_STRESS_LEVEL = 0.3;
    public static final FocusState DEFAULT_FOCUS_STATE = FocusState.SHALLOW;
    public static final String DEFAULT_PERSONALITY = "balanced";

    public static final String FLAG_HIGH_TAB_COUNT = "high_tab_count";
    public static final String FLAG_FREQUENT_SWITCHING = "frequent_switching";
    public static final String FLAG_GOOD_FOCUS = "good_focus";
    public static final String FLAG_HIGH_COGNITIVE_LOAD = "high_cognitive_load";
    public static final String FLAG_HIGH_INTERRUPTIONS = "high_interruptions";
    public static final String FLAG_LONG_WITHOUT_BREAK = "long_without_break";

    private static final double PENALTY_PER_DEFAULT = 0.25;

    private final Clock clock;

    public ContextNormalizer(Clock clock) {
        this.clock = clock;
    }

    public UserContext normalize(RawSignals raw, List<InterventionRecord> recentInteractions) {
        RawSignals signals = raw == null ? RawSignals.empty(null) : raw;
        List<String> defaulted = new ArrayList<>();

        Double load = firstPresent(signals.cognitiveLoad(), deriveLoad(signals));
        if (load == null) defaulted.add("cognitive_load");
        Double energy = firstPresent(signals.energyLevel(), deriveEnergy(signals));
        if (energy == null) defaulted.add("energy_level");
        Double stress = firstPresent(signals.stressLevel(), deriveStress(signals));
        if (stress == null) defaulted.add("stress_level");
        FocusState focus = signals.focusState() != null ? signals.focusState() : deriveFocus(signals);
        if (focus == null) defaulted.add("focus_state");

        double cognitiveLoad = Scores.clamp01(load == null ? DEFAULT_COGNITIVE_LOAD : load);
        double confidenceScore = Scores.clamp01(1.0 - PENALTY_PER_DEFAULT * defaulted.size());

        String personality = signals.personalityType() == null || signals.personalityType().isBlank()
                ? DEFAULT_PERSONALITY
                : signals.personalityType().trim().toLowerCase(Locale.ROOT);

        return new UserContext(
                signals.userId(),
                cognitiveLoad,
                Scores.clamp01(energy == null ? DEFAULT_ENERGY_LEVEL : energy),
                Scores.clamp01(stress == null ? DEFAULT_STRESS_LEVEL : stress),
                focus == null ? DEFAULT_FOCUS_STATE : focus,
                personality,
                resolveTimeOfDay(signals),
                recentInteractions,
                signals.goals() == null ? Set.of() : cleanGoals(signals.goals()),
                flags(signals, cognitiveLoad),
                new ContextConfidence(confidenceScore, defaulted));
    }

    private Double deriveLoad(RawSignals s) {
        if (s.taskSwitches() == null && s.tabCount() == null && s.interruptionCount() == null) return null;
        double switches = ratio(s.taskSwitches(), 20);
        double tabs = ratio(s.tabCount(), 15);
        double interruptions = ratio(s.interruptionCount(), 10);
        return 0.4 * switches + 0.3 * tabs + 0.3 * interruptions;
    }

    private Double deriveEnergy(RawSignals s) {
        if (s.minutesSinceBreak() == null && s.meetingCount() == null) return null;
        double sinceBreak = s.minutesSinceBreak() == null ? 0.0 : ratio(s.minutesSinceBreak(), 240);
        double meetings = s.meetingCount() == null ? 0.0 : 0.1 * Math.max(0, s.meetingCount());
        return 1.0 - sinceBreak - meetings;
    }

    private Double deriveStress(RawSignals s) {
        if (s.meetingCount() == null && s.interruptionCount() == null) return null;
        double meetings = s.meetingCount() == null ? 0.0 : 0.15 * Math.max(0, s.meetingCount());
        double interruptions = s.interruptionCount() == null ? 0.0 : 0.05 * Math.max(0, s.interruptionCount());
        return 0.1 + meetings + interruptions;
    }

    private FocusState deriveFocus(RawSignals s) {
        Integer minutes = s.focusSessionMinutes();
        Integer switches = s.taskSwitches();
        if (minutes == null && switches == null) return null;
        int m = minutes == null ? 0 : minutes;
        int sw = switches == null ? 0 : switches;
        if (m >= 45 && sw <= 2) return FocusState.FLOW;
        if (sw > 10) return FocusState.SCATTERED;
        if (m >= 20) return FocusState.DEEP;
        return FocusState.SHALLOW;
    }

    private TimeOfDay resolveTimeOfDay(RawSignals s) {
        if (s.timeOfDay() != null) return s.timeOfDay();
        if (s.hour() != null && s.hour() >= 0 && s.hour() <= 23) return TimeOfDay.ofHour(s.hour());
        return TimeOfDay.ofHour(ZonedDateTime.now(clock).getHour());
    }

    private Set<String> flags(RawSignals s, double cognitiveLoad) {
        Set<String> flags = new TreeSet<>();
        if (s.tabCount() != null && s.tabCount() > 5) flags.add(FLAG_HIGH_TAB_COUNT);
        if (s.taskSwitches() != null && s.taskSwitches() > 10) flags.add(FLAG_FREQUENT_SWITCHING);
        if (s.focusSessionMinutes() != null && s.focusSessionMinutes() > 45) flags.add(FLAG_GOOD_FOCUS);
        if (cognitiveLoad > 0.8) flags.add(FLAG_HIGH_COGNITIVE_LOAD);
        if (s.interruptionCount() != null && s.interruptionCount() > 8) flags.add(FLAG_HIGH_INTERRUPTIONS);
        if (s.minutesSinceBreak() != null && s.minutesSinceBreak() > 90) flags.add(FLAG_LONG_WITHOUT_BREAK);
        return flags;
    }

    private Set<String> cleanGoals(Set<String> goals) {
        Set<String> out = new TreeSet<>();
        for (String g : goals) {
            if (g != null && !g.isBlank()) out.add(g.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }

    private static double ratio(Integer value, int saturation) {
        if (value == null) return 0.0;
        return Math.min(1.0, Math.max(0, value) / (double) saturation);
    }

    private static Double firstPresent(Double direct, Double derived) {
        if (direct != null && !direct.isNaN()) return direct;
        return derived;
    }
}
