package com.herzen.coach.recommendation;

import com.herzen.coach.config.CoachProperties;
import com.herzen.coach.context.ContextModels.UserContext;
import com.herzen.coach.domain.DomainModels.DeferReason;
import com.herzen.coach.history.HistoryModels.InterventionRecord;
import com.herzen.coach.history.InterventionHistoryStore;
import com.herzen.coach.recommendation.RecommendationModels.FactorScore;
import com.herzen.coach.recommendation.RecommendationModels.Selection;
import com.herzen.coach.strategy.StrategyCatalog;
import com.herzen.coach.strategy.StrategyModels.Strategy;
import com.herzen.coach.support.Scores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the best strategy for a context among those whose rule applies and whose cooldown has
 * elapsed for the user. Ties go to the lower cognitive cost, then to the alphabetically first name.
 */
@Component
public class StrategySelector {
    private static final Logger log = LoggerFactory.getLogger(StrategySelector.class);

    static final Comparator<Selection> RANKING = Comparator
            .comparingDouble(Selection::score).reversed()
            .thenComparingDouble((Selection s) -> s.strategy().cognitiveCost())
            .thenComparing((Selection s) -> s.strategy().name());

    private final StrategyCatalog catalog;
    private final CoachProperties.Selector weights;
    private final Clock clock;

    public StrategySelector(StrategyCatalog catalog, CoachProperties properties, Clock clock) {
        this.catalog = catalog;
        this.weights = properties.selector();
        this.clock = clock;
    }

    public Selection select(UserContext context, InterventionHistoryStore history) {
        Instant now = clock.instant();
        Selection best = null;
        int applicable = 0;

        for (Strategy strategy : catalog.all()) {
            if (!applies(strategy, context)) continue;
            applicable++;
            if (coolingDown(strategy, context.userId(), history, now)) {
                log.debug("Strategy {} skipped for user={}: cooldown {} not elapsed", strategy.name(), context.userId(), strategy.cooldown());
                continue;
            }
            Selection candidate = score(strategy, context);
            if (best == null || RANKING.compare(candidate, best) < 0) {
                best = candidate;
            }
        }

        if (best == null) {
            return Selection.noop(applicable > 0 ? DeferReason.COOLDOWN_ACTIVE : DeferReason.NO_ELIGIBLE_STRATEGY);
        }
        return best;
    }

    Selection score(Strategy strategy, UserContext context) {
        double personalityFit = strategy.personalityFit(context.personalityType());
        double adjustedCost = Scores.clamp01(strategy.cognitiveCost() * (0.5 + context.cognitiveLoad()));
        double costFit = 1.0 - adjustedCost;
        double learned = strategy.weight();
        double recency = recencyBonus(strategy, context);

        double score = weights.personalityWeight() * personalityFit
                + weights.costWeight() * costFit
                + weights.learnedWeight() * learned
                + weights.recencyWeight() * recency;

        List<FactorScore> factors = List.of(
                new FactorScore("personality_fit", personalityFit),
                new FactorScore("cost_fit", costFit),
                new FactorScore("learned_weight", learned),
                new FactorScore("recency_bonus", recency));
        return new Selection(strategy, score, factors, null);
    }

    private boolean applies(Strategy strategy, UserContext context) {
        try {
            return strategy.appliesTo(context);
        } catch (RuntimeException e) {
            log.warn("Applicability rule of strategy {} failed for user={}; excluding it from selection",
                    strategy.name(), context.userId(), e);
            return false;
        }
    }

    private boolean coolingDown(Strategy strategy, String userId, InterventionHistoryStore history, Instant now) {
        Optional<InterventionRecord> last = history.lastFor(userId, strategy.name());
        return last.isPresent() && Duration.between(last.get().timestamp(), now).compareTo(strategy.cooldown()) < 0;
    }

    private double recencyBonus(Strategy strategy, UserContext context) {
        List<InterventionRecord> recent = context.recentInteractions();
        if (recent.isEmpty()) return 1.0;
        long uses = recent.stream().filter(r -> strategy.name().equals(r.strategyName())).count();
        return 1.0 - (double) uses / recent.size();
    }
}
