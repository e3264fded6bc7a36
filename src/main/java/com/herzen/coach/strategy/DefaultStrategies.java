package com.herzen.coach.strategy;

import com.herzen.coach.strategy.StrategyModels.ActionStepTemplate;
import com.herzen.coach.strategy.StrategyModels.Difficulty;
import com.herzen.coach.strategy.StrategyModels.InterventionType;
import com.herzen.coach.strategy.StrategyModels.StrategyDefinition;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in strategy set registered by {@link StrategyCatalog} at startup.
 */
public final class DefaultStrategies {
    public static final String BREATHING_RESET = "breathing-reset";
    public static final String WORRY_JOURNAL = "worry-journal";
    public static final String MICRO_BREAK = "micro-break";
    public static final String DEEP_WORK_BLOCK = "deep-work-block";
    public static final String TASK_BATCHING = "task-batching";
    public static final String PROGRESS_REVIEW = "progress-review";
    public static final String HABIT_STACKING = "habit-stacking";
    public static final String TOP_THREE_PRIORITIES = "top-three-priorities";

    private DefaultStrategies() {}

    public static List<StrategyDefinition> all() {
        return List.of(
                new StrategyDefinition(BREATHING_RESET, StrategyKind.STRESS_RELIEF, null, 0.6, 0.1, null, null,
                        InterventionType.MICRO_NUDGE,
                        Map.of("manager", 0.7, "analyst", 0.6, "developer", 0.6, "designer", 0.8),
                        List.of("Your stress signals are elevated. A short breathing reset lowers arousal before the next task.",
                                "Pause for a box-breathing round to bring your stress level down."),
                        List.of(step("Do four rounds of box breathing: inhale 4s, hold 4s, exhale 4s, hold 4s", 2, Difficulty.EASY,
                                "four full breathing cycles completed")),
                        Set.of("self_reported_stress_drop", "breathing_cycles_completed")),

                new StrategyDefinition(WORRY_JOURNAL, StrategyKind.REFLECTION, null, 0.55, 0.3, null, null,
                        InterventionType.MICRO_NUDGE,
                        Map.of("analyst", 0.8, "developer", 0.7, "manager", 0.5, "designer", 0.6),
                        List.of("Writing down what is on your mind frees working memory for the task at hand."),
                        List.of(step("Write down every open worry or distraction in a single list", 3, Difficulty.EASY,
                                        "list contains at least three items"),
                                step("Mark one item you can act on today and park the rest", 2, Difficulty.EASY,
                                        "one item marked as actionable")),
                        Set.of("worries_captured", "self_reported_stress_drop")),

                new StrategyDefinition(MICRO_BREAK, StrategyKind.BREAK_REMINDER, null, 0.6, 0.1, Duration.ofMinutes(45), null,
                        InterventionType.MICRO_NUDGE,
                        Map.of("developer", 0.8, "designer", 0.7, "analyst", 0.7, "manager", 0.6),
                        List.of("You have been going for a while. A short break now protects the rest of your afternoon.",
                                "Energy looks low. Step away from the screen for a few minutes."),
                        List.of(step("Stand up, stretch and walk away from the screen", 5, Difficulty.EASY,
                                "break taken away from the screen")),
                        Set.of("break_taken", "energy_rating_after_break")),

                new StrategyDefinition(DEEP_WORK_BLOCK, StrategyKind.FOCUS_ENHANCEMENT, null, 0.65, 0.7, null, null,
                        InterventionType.STANDARD_COACHING,
                        Map.of("developer", 0.9, "analyst", 0.8, "designer", 0.7, "manager", 0.4),
                        List.of("Conditions look good for focused work. Protect the next block for your most important task.",
                                "You have capacity right now. Turn it into one uninterrupted work session."),
                        List.of(step("Close chat and email, silence notifications", 2, Difficulty.EASY,
                                        "notifications silenced"),
                                step("Work on a single task in a 25-minute focus session", 25, Difficulty.MODERATE,
                                        "one focus session completed without switching"),
                                step("Note where you stopped and the next concrete step", 3, Difficulty.EASY,
                                        "next step written down")),
                        Set.of("focus_minutes", "task_switches_during_block")),

                new StrategyDefinition(TASK_BATCHING, StrategyKind.TASK_BATCHING, null, 0.55, 0.5, null, null,
                        InterventionType.STANDARD_COACHING,
                        Map.of("manager", 0.8, "analyst", 0.6, "developer", 0.6, "designer", 0.5),
                        List.of("Frequent switching is costing you focus. Group similar small tasks and clear them in one pass."),
                        List.of(step("Close tabs and windows unrelated to the current task", 3, Difficulty.EASY,
                                        "five or fewer tabs open"),
                                step("Collect messages and small requests into one batch and handle them together", 15, Difficulty.MODERATE,
                                        "batch cleared in one sitting")),
                        Set.of("task_switches_per_hour", "open_tab_count")),

                new StrategyDefinition(PROGRESS_REVIEW, StrategyKind.MOTIVATION_BOOST, null, 0.5, 0.3, null, null,
                        InterventionType.MOTIVATION_BOOST,
                        Map.of("manager", 0.7, "designer", 0.7, "analyst", 0.5, "developer", 0.5),
                        List.of("Looking at what you already finished today is a reliable way to get momentum back."),
                        List.of(step("List three things you completed today, however small", 3, Difficulty.EASY,
                                        "three completed items listed"),
                                step("Pick the smallest next task and start it right away", 10, Difficulty.EASY,
                                        "next task started")),
                        Set.of("tasks_started_after_review", "self_reported_motivation")),

                new StrategyDefinition(HABIT_STACKING, StrategyKind.HABIT_FORMATION, null, 0.5, 0.4, null, null,
                        InterventionType.STANDARD_COACHING,
                        Map.of("analyst", 0.7, "developer", 0.6, "manager", 0.6, "designer", 0.6),
                        List.of("Attach the habit you are building to something you already do every day."),
                        List.of(step("Choose an existing daily routine as the anchor", 2, Difficulty.EASY,
                                        "anchor routine chosen"),
                                step("Perform a two-minute version of the new habit right after the anchor", 2, Difficulty.MODERATE,
                                        "habit performed after anchor on the same day")),
                        Set.of("habit_streak_days", "habit_completions")),

                new StrategyDefinition(TOP_THREE_PRIORITIES, StrategyKind.PRIORITY_PLANNING, null, 0.55, 0.5, null, null,
                        InterventionType.STANDARD_COACHING,
                        Map.of("manager", 0.9, "analyst", 0.7, "designer", 0.6, "developer", 0.5),
                        List.of("A short planning pass keeps today's work tied to your goals."),
                        List.of(step("Write down the three outcomes that would make today a success", 5, Difficulty.EASY,
                                        "three outcomes written down"),
                                step("Schedule a time block for the first outcome", 3, Difficulty.EASY,
                                        "time block booked in calendar")),
                        Set.of("priorities_completed", "goal_alignment"))
        );
    }

    private static ActionStepTemplate step(String description, int minutes, Difficulty difficulty, String successCriterion) {
        return new ActionStepTemplate(description, Duration.ofMinutes(minutes), difficulty, successCriterion);
    }
}
