package com.herzen.coach;

import com.herzen.coach.config.CoachProperties;
import com.herzen.coach.context.ContextModels.FocusState;
import com.herzen.coach.context.ContextModels.UserContext;
import com.herzen.coach.domain.DomainModels.DeferReason;
import com.herzen.coach.history.HistoryModels.InterventionRecord;
import com.herzen.coach.recommendation.RecommendationModels.FactorScore;
import com.herzen.coach.recommendation.RecommendationModels.Selection;
import com.herzen.coach.recommendation.StrategySelector;
import com.herzen.coach.strategy.DefaultStrategies;
import com.herzen.coach.strategy.StrategyCatalog;
import com.herzen.coach.strategy.StrategyKind;
import com.herzen.coach.strategy.StrategyModels.ActionStepTemplate;
import com.herzen.coach.strategy.StrategyModels.Difficulty;
import com.herzen.coach.strategy.StrategyModels.InterventionType;
import com.herzen.coach.strategy.StrategyModels.StrategyDefinition;
import com.herzen.coach.strategy.ApplicabilityRule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StrategySelectorTest {
    private final StrategyCatalog catalog = TestFixtures.catalog();
    private final StrategySelector selector = new StrategySelector(catalog, CoachProperties.defaults(), TestFixtures.CLOCK);

    @Test
    void stressedUserGetsLowCostStressStrategy() {
        UserContext ctx = TestFixtures.context("sel-stress", 0.2, 0.5, 0.9, FocusState.SHALLOW);

        Selection selection = selector.select(ctx, new InMemoryHistoryStore());

        assertFalse(selection.isNoop());
        assertEquals(DefaultStrategies.BREATHING_RESET, selection.strategy().name());
        assertTrue(selection.strategy().cognitiveCost() <= 0.4);
        assertEquals(List.of("personality_fit", "cost_fit", "learned_weight", "recency_bonus"),
                selection.factors().stream().map(FactorScore::name).toList());
        assertTrue(selection.score() > 0.0 && selection.score() <= 1.0);
    }

    @Test
    void scoreCombinesWeightedFactors() {
        UserContext ctx = TestFixtures.context("sel-formula", 0.2, 0.5, 0.9, FocusState.SHALLOW);

        Selection selection = selector.select(ctx, new InMemoryHistoryStore());

        // 0.3 * 0.5 + 0.3 * (1 - 0.1 * 0.7) + 0.3 * 0.6 + 0.1 * 1.0
        assertEquals(0.709, selection.score(), 1e-9);
        assertEquals(0.5, factor(selection, "personality_fit"), 1e-9);
        assertEquals(0.93, factor(selection, "cost_fit"), 1e-9);
        assertEquals(0.6, factor(selection, "learned_weight"), 1e-9);
        assertEquals(1.0, factor(selection, "recency_bonus"), 1e-9);
    }

    @Test
    void personalityFitComesFromStrategyTable() {
        UserContext designer = TestFixtures.context("sel-designer", 0.2, 0.5, 0.9, FocusState.SHALLOW, "designer", List.of());

        Selection selection = selector.select(designer, new InMemoryHistoryStore());

        assertEquals(DefaultStrategies.BREATHING_RESET, selection.strategy().name());
        assertEquals(0.8, factor(selection, "personality_fit"), 1e-9);
        assertEquals(0.799, selection.score(), 1e-9);
    }

    @Test
    void recentUseLowersRecencyBonusAndChangesWinner() {
        InterventionRecord used = new InterventionRecord("rec-1", null, "sel-recency", DefaultStrategies.BREATHING_RESET,
                TestFixtures.NOW.minus(Duration.ofDays(2)), null, null);
        UserContext ctx = TestFixtures.context("sel-recency", 0.2, 0.5, 0.9, FocusState.SHALLOW, "balanced", List.of(used));

        Selection selection = selector.select(ctx, new InMemoryHistoryStore());

        // breathing-reset drops to 0.609, worry-journal keeps 0.3 * 0.5 + 0.3 * 0.79 + 0.3 * 0.55 + 0.1
        assertEquals(DefaultStrategies.WORRY_JOURNAL, selection.strategy().name());
        assertEquals(0.652, selection.score(), 1e-9);
        assertEquals(1.0, factor(selection, "recency_bonus"), 1e-9);
    }

    @Test
    void repeatedSelectionGivesSameStrategyAndScore() {
        UserContext ctx = TestFixtures.context("sel-repeat", 0.4, 0.3, 0.5, FocusState.SHALLOW);
        InMemoryHistoryStore history = new InMemoryHistoryStore();

        Selection first = selector.select(ctx, history);
        Selection second = selector.select(ctx, history);

        assertEquals(first.strategy().name(), second.strategy().name());
        assertEquals(first.score(), second.score());
        assertEquals(first.factors(), second.factors());
    }

    @Test
    void strategyInCooldownIsSkipped() {
        InMemoryHistoryStore history = new InMemoryHistoryStore();
        history.deliveredAt("sel-cool", DefaultStrategies.BREATHING_RESET, TestFixtures.NOW.minus(Duration.ofMinutes(10)));
        UserContext ctx = TestFixtures.context("sel-cool", 0.2, 0.5, 0.9, FocusState.SHALLOW);

        assertEquals(DefaultStrategies.WORRY_JOURNAL, selector.select(ctx, history).strategy().name());

        history.deliveredAt("sel-cool", DefaultStrategies.WORRY_JOURNAL, TestFixtures.NOW.minus(Duration.ofMinutes(5)));
        Selection selection = selector.select(ctx, history);
        assertTrue(selection.isNoop());
        assertEquals(DeferReason.COOLDOWN_ACTIVE, selection.deferReason());
    }

    @Test
    void strategyIsEligibleAgainOnceCooldownElapsed() {
        InMemoryHistoryStore history = new InMemoryHistoryStore();
        history.deliveredAt("sel-elapsed", DefaultStrategies.BREATHING_RESET, TestFixtures.NOW.minus(Duration.ofMinutes(60)));
        UserContext ctx = TestFixtures.context("sel-elapsed", 0.2, 0.5, 0.9, FocusState.SHALLOW);

        assertEquals(DefaultStrategies.BREATHING_RESET, selector.select(ctx, history).strategy().name());
    }

    @Test
    void noApplicableStrategyIsReported() {
        UserContext ctx = TestFixtures.context("sel-none", 0.75, 0.6, 0.3, FocusState.SHALLOW);

        Selection selection = selector.select(ctx, new InMemoryHistoryStore());

        assertTrue(selection.isNoop());
        assertEquals(DeferReason.NO_ELIGIBLE_STRATEGY, selection.deferReason());
    }

    @Test
    void failingRuleExcludesOnlyThatStrategy() {
        catalog.register(definition("broken-rule", ctx -> {
            throw new IllegalStateException("rule failed");
        }, 0.0));
        UserContext ctx = TestFixtures.context("sel-broken", 0.2, 0.5, 0.9, FocusState.SHALLOW);

        assertEquals(DefaultStrategies.BREATHING_RESET, selector.select(ctx, new InMemoryHistoryStore()).strategy().name());
    }

    @Test
    void equalScoresGoToAlphabeticallyFirstName() {
        ApplicabilityRule tieGoal = ctx -> ctx.goals().contains("tie-check");
        catalog.register(definition("tie-b", tieGoal, 0.2));
        catalog.register(definition("tie-a", tieGoal, 0.2));
        UserContext ctx = TestFixtures.context("sel-tie", 0.75, 0.6, 0.3, FocusState.SHALLOW, Set.of("tie-check"), Set.of());

        for (int i = 0; i < 5; i++) {
            assertEquals("tie-a", selector.select(ctx, new InMemoryHistoryStore()).strategy().name());
        }
    }

    @Test
    void lowerCostWinsWhenOtherwiseEqual() {
        ApplicabilityRule costGoal = ctx -> ctx.goals().contains("cost-check");
        catalog.register(definition("cost-a-heavy", costGoal, 0.6));
        catalog.register(definition("cost-b-light", costGoal, 0.1));
        UserContext ctx = TestFixtures.context("sel-cost", 0.75, 0.6, 0.3, FocusState.SHALLOW, Set.of("cost-check"), Set.of());

        assertEquals("cost-b-light", selector.select(ctx, new InMemoryHistoryStore()).strategy().name());
    }

    private static double factor(Selection selection, String name) {
        return selection.factors().stream()
                .filter(f -> f.name().equals(name))
                .mapToDouble(FactorScore::value)
                .findFirst()
                .orElseThrow();
    }

    static StrategyDefinition definition(String name, ApplicabilityRule rule, double cost) {
        return new StrategyDefinition(name, StrategyKind.STRESS_RELIEF, rule, 0.5, cost, null, null,
                InterventionType.MICRO_NUDGE, Map.of(), List.of("Test message."),
                List.of(new ActionStepTemplate("Do the thing", Duration.ofMinutes(5), Difficulty.EASY, "thing done")),
                Set.of());
    }
}
