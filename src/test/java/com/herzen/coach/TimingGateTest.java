package com.herzen.coach;

import com.herzen.coach.config.CoachProperties;
import com.herzen.coach.context.ContextModels.FocusState;
import com.herzen.coach.context.ContextModels.UserContext;
import com.herzen.coach.domain.DomainModels.DeferReason;
import com.herzen.coach.history.HistoryModels.Outcome;
import com.herzen.coach.timing.GateDecision;
import com.herzen.coach.timing.TimingGate;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TimingGateTest {
    private final TimingGate gate = new TimingGate(CoachProperties.defaults(), TestFixtures.CLOCK);

    @Test
    void flowIsNeverInterrupted() {
        InMemoryHistoryStore history = new InMemoryHistoryStore();
        UserContext ctx = TestFixtures.context("gate-flow", 0.1, 0.9, 0.1, FocusState.FLOW);

        for (int i = 0; i < 3; i++) {
            GateDecision decision = gate.evaluate(ctx, history);
            assertFalse(decision.allowed());
            assertEquals(DeferReason.SUBOPTIMAL_TIMING, decision.reason());
        }
    }

    @Test
    void highCognitiveLoadDefers() {
        UserContext ctx = TestFixtures.context("gate-load", 0.9, 0.5, 0.3, FocusState.SHALLOW);

        assertFalse(gate.shouldIntervene(ctx, new InMemoryHistoryStore()));
        assertEquals(DeferReason.SUBOPTIMAL_TIMING, gate.evaluate(ctx, new InMemoryHistoryStore()).reason());
    }

    @Test
    void loadAtThresholdIsAllowed() {
        UserContext ctx = TestFixtures.context("gate-edge", 0.8, 0.5, 0.3, FocusState.SHALLOW);

        assertTrue(gate.shouldIntervene(ctx, new InMemoryHistoryStore()));
    }

    @Test
    void recentInterventionEnforcesMinimumSpacing() {
        InMemoryHistoryStore history = new InMemoryHistoryStore();
        history.deliveredAt("gate-spacing", "micro-break", TestFixtures.NOW.minus(Duration.ofMinutes(10)));
        UserContext ctx = TestFixtures.context("gate-spacing", 0.3, 0.5, 0.3, FocusState.SHALLOW);

        assertEquals(DeferReason.COOLDOWN_ACTIVE, gate.evaluate(ctx, history).reason());
    }

    @Test
    void dailyCapCountsOnlyLastTwentyFourHours() {
        InMemoryHistoryStore history = new InMemoryHistoryStore();
        history.deliveredAt("gate-cap", "micro-break", TestFixtures.NOW.minus(Duration.ofHours(30)));
        for (int i = 1; i <= 7; i++) {
            history.deliveredAt("gate-cap", "micro-break", TestFixtures.NOW.minus(Duration.ofHours(2L * i)));
        }
        UserContext ctx = TestFixtures.context("gate-cap", 0.3, 0.5, 0.3, FocusState.SHALLOW);
        assertTrue(gate.shouldIntervene(ctx, history));

        history.deliveredAt("gate-cap", "micro-break", TestFixtures.NOW.minus(Duration.ofHours(1)));
        GateDecision decision = gate.evaluate(ctx, history);
        assertFalse(decision.allowed());
        assertEquals(DeferReason.DAILY_CAP_REACHED, decision.reason());
    }

    @Test
    void outcomesDoNotCountAsDeliveries() {
        InMemoryHistoryStore history = new InMemoryHistoryStore();
        var rec = history.deliveredAt("gate-amend", "micro-break", TestFixtures.NOW.minus(Duration.ofHours(3)));
        history.amend(rec.id(), new Outcome(0.7, 0.6, true));

        assertEquals(1, history.countSince("gate-amend", TestFixtures.NOW.minus(Duration.ofHours(24))));
        assertTrue(gate.shouldIntervene(TestFixtures.context("gate-amend", 0.3, 0.5, 0.3, FocusState.SHALLOW), history));
    }

    @Test
    void repeatedDismissalsPauseInterventions() {
        InMemoryHistoryStore history = new InMemoryHistoryStore();
        var first = history.deliveredAt("gate-dismiss", "micro-break", TestFixtures.NOW.minus(Duration.ofMinutes(100)));
        var second = history.deliveredAt("gate-dismiss", "breathing-reset", TestFixtures.NOW.minus(Duration.ofMinutes(50)));
        UserContext ctx = TestFixtures.context("gate-dismiss", 0.3, 0.5, 0.3, FocusState.SHALLOW);

        history.amend(first.id(), new Outcome(0.1, 0.1, false));
        assertTrue(gate.shouldIntervene(ctx, history));

        history.amend(second.id(), new Outcome(0.0, 0.2, false));
        GateDecision decision = gate.evaluate(ctx, history);
        assertFalse(decision.allowed());
        assertEquals(DeferReason.SUBOPTIMAL_TIMING, decision.reason());
        assertTrue(decision.detail().contains("dismissed"));
    }

    @Test
    void completedOutcomesAreNotDismissals() {
        InMemoryHistoryStore history = new InMemoryHistoryStore();
        var first = history.deliveredAt("gate-completed", "micro-break", TestFixtures.NOW.minus(Duration.ofMinutes(100)));
        var second = history.deliveredAt("gate-completed", "breathing-reset", TestFixtures.NOW.minus(Duration.ofMinutes(50)));
        history.amend(first.id(), new Outcome(0.1, 0.1, false));
        history.amend(second.id(), new Outcome(0.9, 0.8, true));

        assertTrue(gate.shouldIntervene(TestFixtures.context("gate-completed", 0.3, 0.5, 0.3, FocusState.SHALLOW), history));
    }

    @Test
    void dismissalBackoffExpires() {
        InMemoryHistoryStore history = new InMemoryHistoryStore();
        var first = history.deliveredAt("gate-expired", "micro-break", TestFixtures.NOW.minus(Duration.ofHours(4)));
        var second = history.deliveredAt("gate-expired", "breathing-reset", TestFixtures.NOW.minus(Duration.ofHours(3)));
        history.amend(first.id(), new Outcome(0.1, 0.1, false));
        history.amend(second.id(), new Outcome(0.0, 0.2, false));

        assertTrue(gate.shouldIntervene(TestFixtures.context("gate-expired", 0.3, 0.5, 0.3, FocusState.SHALLOW), history));
    }
}
