package com.herzen.coach.feedback;

import com.herzen.coach.repository.StrategyWeightJdbcRepository;
import com.herzen.coach.strategy.StrategyCatalog;
import com.herzen.coach.strategy.StrategyModels.Strategy;
import com.herzen.coach.support.KeyedLocks;
import com.herzen.coach.support.Scores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Folds observed effectiveness into a strategy's learned weight with an exponential moving
 * average. Updates for one strategy are applied one at a time; the result is persisted before it
 * becomes visible in the catalog.
 */
@Component
public class FeedbackAdapter {
    private static final Logger log = LoggerFactory.getLogger(FeedbackAdapter.class);

    private final StrategyCatalog catalog;
    private final StrategyWeightJdbcRepository weightRepository;
    private final Clock clock;
    private final KeyedLocks locks = new KeyedLocks();

    public FeedbackAdapter(StrategyCatalog catalog, StrategyWeightJdbcRepository weightRepository, Clock clock) {
        this.catalog = catalog;
        this.weightRepository = weightRepository;
        this.clock = clock;
    }

    /**
     * @return the new weight, within [0,1]
     * @throws com.herzen.coach.strategy.StrategyNotFoundException if the name is not registered
     */
    public double applyFeedback(String strategyName, double effectiveness) {
        Strategy strategy = catalog.get(strategyName);
        double observed = Scores.clamp01(effectiveness);
        return locks.withLock(strategyName, () -> {
            double old = catalog.weightOf(strategyName);
            // same as old * (1 - alpha) + observed * alpha
            double updated = Scores.clamp01(old + strategy.alpha() * (observed - old));
            weightRepository.save(strategyName, updated, clock.instant());
            catalog.replaceWeight(strategyName, updated);
            log.info("Strategy {} weight {} -> {} (effectiveness={}, alpha={})",
                    strategyName, old, updated, observed, strategy.alpha());
            return updated;
        });
    }
}
