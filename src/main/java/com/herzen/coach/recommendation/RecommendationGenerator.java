package com.herzen.coach.recommendation;

import com.herzen.coach.config.CoachProperties;
import com.herzen.coach.context.ContextModels.UserContext;
import com.herzen.coach.context.ContextNormalizer;
import com.herzen.coach.history.HistoryModels.InterventionRecord;
import com.herzen.coach.recommendation.RecommendationModels.ActionStep;
import com.herzen.coach.recommendation.RecommendationModels.Intervention;
import com.herzen.coach.strategy.StrategyModels.ActionStepTemplate;
import com.herzen.coach.strategy.StrategyModels.Difficulty;
import com.herzen.coach.strategy.StrategyModels.InterventionType;
import com.herzen.coach.strategy.StrategyModels.Strategy;
import com.herzen.coach.support.Scores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Turns a selected strategy into a deliverable intervention.
 * <p>
 * Every returned intervention has at least one step, and every step has a timeframe and a success
 * criterion. A candidate that fails this check is rebuilt from its valid steps only; if nothing
 * valid remains the fixed five-minute-break fallback is returned.
 */
@Component
public class RecommendationGenerator {
    private static final Logger log = LoggerFactory.getLogger(RecommendationGenerator.class);

    public static final String FALLBACK_MESSAGE = "Take a 5-minute break";
    static final ActionStep FALLBACK_STEP = new ActionStep(
            "Take a 5-minute break away from the screen", "5 minutes", Difficulty.EASY, "break taken away from the screen");
    private static final String DEFAULT_MESSAGE = "Here is one small step that fits your current state.";

    private final Random random;
    private final Clock clock;
    private final CoachProperties.Generator config;

    public RecommendationGenerator(Random templateRandom, Clock clock, CoachProperties properties) {
        this.random = templateRandom;
        this.clock = clock;
        this.config = properties.generator();
    }

    public Intervention build(Strategy strategy, UserContext context) {
        Instant followUpAt = followUpAt(strategy, context);
        List<String> tips = contextTips(context);
        double benefit = expectedBenefit(strategy, context);

        Intervention candidate = compose(strategy, toSteps(strategy.definition().steps()), followUpAt, tips, benefit);
        Optional<String> problem = validate(candidate);
        if (problem.isEmpty()) return candidate;
        log.warn("Recommendation for strategy {} rejected: {}; retrying with valid steps only", strategy.name(), problem.get());

        List<ActionStep> validSteps = candidate.actionSteps().stream().filter(RecommendationGenerator::isActionable).toList();
        Intervention retry = compose(strategy, validSteps, followUpAt, tips, benefit);
        problem = validate(retry);
        if (problem.isEmpty()) return retry;
        log.warn("Recommendation for strategy {} rejected again: {}; using fallback", strategy.name(), problem.get());

        return fallback(followUpAt, tips, benefit);
    }

    /** Record for the intervention delivered now. */
    public InterventionRecord recordFor(Strategy strategy, UserContext context) {
        return new InterventionRecord(UUID.randomUUID().toString(), null, context.userId(), strategy.name(),
                clock.instant(), context.snapshot(), null);
    }

    Instant followUpAt(Strategy strategy, UserContext context) {
        Duration wait = strategy.cooldown();
        if (context.stressLevel() >= config.highStressThreshold()) {
            wait = wait.dividedBy(2);
        }
        return clock.instant().plus(wait);
    }

    static Optional<String> validate(Intervention intervention) {
        if (intervention.actionSteps() == null || intervention.actionSteps().isEmpty()) {
            return Optional.of("no action steps");
        }
        for (ActionStep step : intervention.actionSteps()) {
            if (!isActionable(step)) {
                return Optional.of("step '" + step.description() + "' lacks a timeframe or success criterion");
            }
        }
        return Optional.empty();
    }

    private static boolean isActionable(ActionStep step) {
        return step != null
                && notBlank(step.description())
                && notBlank(step.timeframe())
                && notBlank(step.successCriterion());
    }

    private Intervention compose(Strategy strategy, List<ActionStep> steps, Instant followUpAt, List<String> tips, double benefit) {
        Set<String> metrics = new TreeSet<>(strategy.definition().successMetrics());
        if (metrics.isEmpty()) {
            steps.stream().map(ActionStep::successCriterion).filter(RecommendationGenerator::notBlank).forEach(metrics::add);
        }
        return new Intervention(strategy.definition().interventionType(), pickMessage(strategy.definition().messages()),
                steps, metrics, followUpAt, tips, benefit, false);
    }

    private Intervention fallback(Instant followUpAt, List<String> tips, double benefit) {
        return new Intervention(InterventionType.MICRO_NUDGE, FALLBACK_MESSAGE, List.of(FALLBACK_STEP),
                Set.of("break_taken"), followUpAt, tips, benefit, true);
    }

    private List<ActionStep> toSteps(List<ActionStepTemplate> templates) {
        List<ActionStep> steps = new ArrayList<>(templates.size());
        for (ActionStepTemplate t : templates) {
            steps.add(new ActionStep(t.description(), formatTimeframe(t.timeframe()),
                    t.difficulty() == null ? Difficulty.MODERATE : t.difficulty(), t.successCriterion()));
        }
        return steps;
    }

    private String pickMessage(List<String> messages) {
        if (messages.isEmpty()) return DEFAULT_MESSAGE;
        return messages.get(random.nextInt(messages.size()));
    }

    private List<String> contextTips(UserContext context) {
        List<String> tips = new ArrayList<>();
        if (context.cognitiveLoad() > 0.7) {
            tips.add("Your cognitive load is high. Focus on one task at a time.");
        }
        if (context.energyLevel() < 0.4) {
            tips.add("Consider taking a proper break to recharge.");
        }
        if (context.stressLevel() >= config.highStressThreshold()) {
            tips.add("Stress is elevated. Keep the next hour light where you can.");
        }
        if (context.flags().contains(ContextNormalizer.FLAG_FREQUENT_SWITCHING)) {
            tips.add("Try to minimize context switching between tasks.");
        }
        return tips;
    }

    private double expectedBenefit(Strategy strategy, UserContext context) {
        double contextual = 0.5;
        if (context.cognitiveLoad() < 0.3) contextual += 0.2;
        else if (context.cognitiveLoad() > 0.8) contextual -= 0.3;
        if (context.energyLevel() > 0.7) contextual += 0.1;
        return Scores.clamp01(0.5 * strategy.weight() + 0.5 * Scores.clamp01(contextual));
    }

    static String formatTimeframe(Duration timeframe) {
        if (timeframe == null || timeframe.isZero() || timeframe.isNegative()) return null;
        long minutes = Math.max(1, timeframe.toMinutes());
        if (minutes % 60 == 0) {
            long hours = minutes / 60;
            return hours == 1 ? "1 hour" : hours + " hours";
        }
        return minutes == 1 ? "1 minute" : minutes + " minutes";
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
