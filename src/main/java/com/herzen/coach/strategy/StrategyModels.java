package com.herzen.coach.strategy;

import com.fasterxml.jackson.annotation.JsonValue;
import com.herzen.coach.context.ContextModels.UserContext;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class StrategyModels {

    public enum InterventionType {
        MICRO_NUDGE, MOTIVATION_BOOST, STANDARD_COACHING;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Difficulty {
        EASY, MODERATE, CHALLENGING;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public record ActionStepTemplate(String description, Duration timeframe, Difficulty difficulty, String successCriterion) {}

    /**
     * Static part of a strategy, registered once at startup. {@code applicability} defaults to the
     * kind's own rule; {@code cooldown} and {@code alpha} may be null to fall back to configuration.
     */
    public record StrategyDefinition(String name,
                                     StrategyKind kind,
                                     ApplicabilityRule applicability,
                                     double baseEffectiveness,
                                     double cognitiveCost,
                                     Duration cooldown,
                                     Double alpha,
                                     InterventionType interventionType,
                                     Map<String, Double> personalityFit,
                                     List<String> messages,
                                     List<ActionStepTemplate> steps,
                                     Set<String> successMetrics) {
        public StrategyDefinition {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("Strategy name is required");
            if (kind == null) throw new IllegalArgumentException("Strategy kind is required: " + name);
            if (applicability == null) applicability = kind;
            personalityFit = personalityFit == null ? Map.of() : Map.copyOf(personalityFit);
            messages = messages == null ? List.of() : List.copyOf(messages);
            steps = steps == null ? List.of() : List.copyOf(steps);
            successMetrics = successMetrics == null ? Set.of() : Set.copyOf(successMetrics);
        }
    }

    /**
     * Resolved view of a registered strategy: configuration applied and the learned weight as of
     * the moment the view was taken.
     */
    public record Strategy(StrategyDefinition definition, Duration cooldown, double alpha, double weight) {

        public String name() {
            return definition.name();
        }

        public double cognitiveCost() {
            return definition.cognitiveCost();
        }

        public double baseEffectiveness() {
            return definition.baseEffectiveness();
        }

        public boolean appliesTo(UserContext context) {
            return definition.applicability().appliesTo(context);
        }

        public double personalityFit(String personalityType) {
            return definition.personalityFit().getOrDefault(personalityType, 0.5);
        }
    }

    public record StrategyView(String name,
                               StrategyKind kind,
                               InterventionType interventionType,
                               double baseEffectiveness,
                               double cognitiveCost,
                               long cooldownMinutes,
                               double alpha,
                               double weight) {
        public static StrategyView of(Strategy s) {
            return new StrategyView(s.name(), s.definition().kind(), s.definition().interventionType(),
                    s.baseEffectiveness(), s.cognitiveCost(), s.cooldown().toMinutes(), s.alpha(), s.weight());
        }
    }
}
