package com.herzen.coach.strategy;

import com.herzen.coach.config.CoachProperties;
import com.herzen.coach.repository.StrategyWeightJdbcRepository;
import com.herzen.coach.strategy.StrategyModels.Strategy;
import com.herzen.coach.strategy.StrategyModels.StrategyDefinition;
import com.herzen.coach.support.Scores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Registry of candidate strategies and their learned weights.
 * <p>
 * Definitions never change after registration. The weight is the only mutable value and is
 * written through {@link #replaceWeight}, which only {@code FeedbackAdapter} calls.
 */
@Component
public class StrategyCatalog {
    private static final Logger log = LoggerFactory.getLogger(StrategyCatalog.class);

    private final CoachProperties properties;
    private final Map<String, Double> persistedWeights;
    private final Map<String, Strategy> strategies = new ConcurrentSkipListMap<>();
    private final Map<String, Double> weights = new ConcurrentHashMap<>();

    public StrategyCatalog(CoachProperties properties, StrategyWeightJdbcRepository weightRepository) {
        this.properties = properties;
        this.persistedWeights = weightRepository.loadAll();
        DefaultStrategies.all().forEach(this::register);
    }

    /**
     * @throws IllegalArgumentException if a strategy with the same name is already registered
     */
    public Strategy register(StrategyDefinition definition) {
        Strategy resolved = new Strategy(definition,
                properties.cooldownFor(definition.name(), definition.cooldown()),
                Scores.clamp01(properties.alphaFor(definition.name(), definition.alpha())),
                0.0);
        if (strategies.putIfAbsent(definition.name(), resolved) != null) {
            throw new IllegalArgumentException("Strategy already registered: " + definition.name());
        }
        double weight = Scores.clamp01(persistedWeights.getOrDefault(definition.name(), definition.baseEffectiveness()));
        weights.put(definition.name(), weight);
        log.info("Registered strategy {} (kind={}, cost={}, cooldown={}, weight={})",
                definition.name(), definition.kind(), definition.cognitiveCost(), resolved.cooldown(), weight);
        return withWeight(resolved);
    }

    /** Snapshot of every registered strategy, ordered by name. */
    public List<Strategy> all() {
        return strategies.values().stream().map(this::withWeight).toList();
    }

    public Optional<Strategy> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(strategies.get(name)).map(this::withWeight);
    }

    /**
     * @throws StrategyNotFoundException if no strategy has this name
     */
    public Strategy get(String name) {
        return find(name).orElseThrow(() -> new StrategyNotFoundException(name));
    }

    public double weightOf(String name) {
        Double w = weights.get(name);
        if (w == null) throw new StrategyNotFoundException(name);
        return w;
    }

    /**
     * Stores a new learned weight. Callers serialize writes per strategy name.
     *
     * @throws StrategyNotFoundException if no strategy has this name
     */
    public double replaceWeight(String name, double weight) {
        if (!strategies.containsKey(name)) throw new StrategyNotFoundException(name);
        double clamped = Scores.clamp01(weight);
        weights.put(name, clamped);
        return clamped;
    }

    private Strategy withWeight(Strategy s) {
        return new Strategy(s.definition(), s.cooldown(), s.alpha(), weights.getOrDefault(s.name(), s.baseEffectiveness()));
    }
}
