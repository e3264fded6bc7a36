package com.herzen.coach.timing;

import com.herzen.coach.config.CoachProperties;
import com.herzen.coach.context.ContextModels.FocusState;
import com.herzen.coach.context.ContextModels.UserContext;
import com.herzen.coach.domain.DomainModels.DeferReason;
import com.herzen.coach.history.HistoryModels.InterventionRecord;
import com.herzen.coach.history.InterventionHistoryStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Decides whether any intervention may be delivered right now. Rules are checked in order and the
 * first one that matches decides. Reads history, never writes it.
 */
@Component
public class TimingGate {
    private static final Duration DAILY_WINDOW = Duration.ofHours(24);

    private final CoachProperties.Gate config;
    private final Clock clock;

    public TimingGate(CoachProperties properties, Clock clock) {
        this.config = properties.gate();
        this.clock = clock;
    }

    public boolean shouldIntervene(UserContext context, InterventionHistoryStore history) {
        return evaluate(context, history).allowed();
    }

    public GateDecision evaluate(UserContext context, InterventionHistoryStore history) {
        if (context.focusState() == FocusState.FLOW) {
            return GateDecision.deny(DeferReason.SUBOPTIMAL_TIMING, "user is in flow");
        }
        if (context.cognitiveLoad() > config.highLoadThreshold()) {
            return GateDecision.deny(DeferReason.SUBOPTIMAL_TIMING,
                    String.format("cognitive load %.2f above %.2f", context.cognitiveLoad(), config.highLoadThreshold()));
        }

        Instant now = clock.instant();
        Optional<InterventionRecord> last = history.lastForUser(context.userId());
        if (last.isPresent() && Duration.between(last.get().timestamp(), now).compareTo(config.minSpacing()) < 0) {
            return GateDecision.deny(DeferReason.COOLDOWN_ACTIVE,
                    "last intervention at " + last.get().timestamp() + " is within " + config.minSpacing());
        }

        long dismissed = recentDismissals(context.userId(), history, now);
        if (config.dismissalThreshold() > 0 && dismissed >= config.dismissalThreshold()) {
            return GateDecision.deny(DeferReason.SUBOPTIMAL_TIMING,
                    dismissed + " recent interventions dismissed; backing off for " + config.dismissalBackoff());
        }

        int today = history.countSince(context.userId(), now.minus(DAILY_WINDOW));
        if (today >= config.dailyCap()) {
            return GateDecision.deny(DeferReason.DAILY_CAP_REACHED, today + " interventions in the last 24h");
        }
        return GateDecision.allow();
    }

    private long recentDismissals(String userId, InterventionHistoryStore history, Instant now) {
        Instant since = now.minus(config.dismissalBackoff());
        return history.recent(userId, config.dismissalLookback()).stream()
                .filter(r -> r.hasOutcome() && !r.outcome().completed())
                .filter(r -> r.timestamp().isAfter(since))
                .count();
    }
}
