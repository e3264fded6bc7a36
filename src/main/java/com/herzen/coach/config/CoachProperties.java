package com.herzen.coach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Map;

/**
 * Engine tuning bound from the {@code coach.*} keys of application.yml.
 * <p>
 * Cooldown and EMA alpha are resolved per strategy: an entry under {@code coach.strategies.<name>}
 * wins over the value in the strategy definition, which wins over the global default.
 */
@ConfigurationProperties(prefix = "coach")
public record CoachProperties(@DefaultValue Gate gate,
                              @DefaultValue Selector selector,
                              @DefaultValue Feedback feedback,
                              @DefaultValue Generator generator,
                              @DefaultValue History history,
                              @DefaultValue Context context,
                              @DefaultValue StrategyDefaults strategyDefaults,
                              Map<String, StrategyOverride> strategies) {

    public CoachProperties {
        strategies = strategies == null ? Map.of() : Map.copyOf(strategies);
    }

    public static CoachProperties defaults() {
        return new CoachProperties(
                new Gate(0.8, Duration.ofMinutes(30), 8, 2, 10, Duration.ofHours(2)),
                new Selector(0.3, 0.3, 0.3, 0.1),
                new Feedback(0.3),
                new Generator(0.7, null),
                new History(20),
                new Context(Duration.ofSeconds(2)),
                new StrategyDefaults(Duration.ofMinutes(60)),
                Map.of());
    }

    public Duration cooldownFor(String strategyName, Duration declared) {
        StrategyOverride override = strategies.get(strategyName);
        if (override != null && override.cooldown() != null) return override.cooldown();
        return declared != null ? declared : strategyDefaults.cooldown();
    }

    public double alphaFor(String strategyName, Double declared) {
        StrategyOverride override = strategies.get(strategyName);
        if (override != null && override.alpha() != null) return override.alpha();
        return declared != null ? declared : feedback.alpha();
    }

    /**
     * {@code dismissalThreshold} dismissed outcomes among the last {@code dismissalLookback}
     * deliveries, each younger than {@code dismissalBackoff}, pause interventions.
     */
    public record Gate(@DefaultValue("0.8") double highLoadThreshold,
                       @DefaultValue("30m") Duration minSpacing,
                       @DefaultValue("8") int dailyCap,
                       @DefaultValue("2") int dismissalThreshold,
                       @DefaultValue("10") int dismissalLookback,
                       @DefaultValue("2h") Duration dismissalBackoff) {}

    public record Selector(@DefaultValue("0.3") double personalityWeight,
                           @DefaultValue("0.3") double costWeight,
                           @DefaultValue("0.3") double learnedWeight,
                           @DefaultValue("0.1") double recencyWeight) {
        public Selector {
            double sum = personalityWeight + costWeight + learnedWeight + recencyWeight;
            if (Math.abs(sum - 1.0) > 1e-6) {
                throw new IllegalArgumentException("coach.selector weights must sum to 1, got " + sum);
            }
        }
    }

    public record Feedback(@DefaultValue("0.3") double alpha) {}

    /** {@code seed} is optional; without it template choice is not reproducible. */
    public record Generator(@DefaultValue("0.7") double highStressThreshold, Long seed) {}

    public record History(@DefaultValue("20") int recentLimit) {}

    public record Context(@DefaultValue("2s") Duration fetchTimeout) {}

    public record StrategyDefaults(@DefaultValue("60m") Duration cooldown) {}

    public record StrategyOverride(Duration cooldown, Double alpha) {}
}
