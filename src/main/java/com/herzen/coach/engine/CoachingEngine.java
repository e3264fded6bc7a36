package com.herzen.coach.engine;

import com.herzen.coach.context.ContextModels.RawSignals;
import com.herzen.coach.context.ContextModels.UserContext;
import com.herzen.coach.context.ContextService;
import com.herzen.coach.delivery.DeliveryChannel;
import com.herzen.coach.engine.EngineModels.InterventionResponse;
import com.herzen.coach.history.HistoryModels.InterventionRecord;
import com.herzen.coach.history.InterventionHistoryStore;
import com.herzen.coach.recommendation.RecommendationGenerator;
import com.herzen.coach.recommendation.RecommendationModels.Intervention;
import com.herzen.coach.recommendation.RecommendationModels.Selection;
import com.herzen.coach.recommendation.StrategySelector;
import com.herzen.coach.support.KeyedLocks;
import com.herzen.coach.timing.GateDecision;
import com.herzen.coach.timing.TimingGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one decision for one user: gate, select, build, record, deliver.
 * <p>
 * The whole sequence holds a per-user lock, so two concurrent decisions for the same user cannot
 * both pass the cooldown checks. Decisions for different users run in parallel.
 */
@Service
public class CoachingEngine {
    private static final Logger log = LoggerFactory.getLogger(CoachingEngine.class);

    /** Width of {@code intervention_records.user_id}. */
    public static final int MAX_USER_ID_LENGTH = 256;

    private final ContextService contextService;
    private final TimingGate timingGate;
    private final StrategySelector selector;
    private final RecommendationGenerator generator;
    private final InterventionHistoryStore history;
    private final DeliveryChannel deliveryChannel;
    private final KeyedLocks userLocks = new KeyedLocks();

    public CoachingEngine(ContextService contextService,
                          TimingGate timingGate,
                          StrategySelector selector,
                          RecommendationGenerator generator,
                          InterventionHistoryStore history,
                          DeliveryChannel deliveryChannel) {
        this.contextService = contextService;
        this.timingGate = timingGate;
        this.selector = selector;
        this.generator = generator;
        this.history = history;
        this.deliveryChannel = deliveryChannel;
    }

    /**
     * @throws InvalidContextException if the payload has no user id or the id is too long
     */
    public InterventionResponse decide(RawSignals signals) {
        String userId = requireUserId(signals == null ? null : signals.userId());
        RawSignals normalizedId = signals.withUserId(userId);
        return userLocks.withLock(userId, () -> run(contextService.normalize(normalizedId)));
    }

    /**
     * Decision for a user whose context comes from the signals provider.
     */
    public InterventionResponse decideFor(String userId) {
        String id = requireUserId(userId);
        RawSignals signals = contextService.fetchSignals(id);
        return userLocks.withLock(id, () -> run(contextService.normalize(signals)));
    }

    private InterventionResponse run(UserContext context) {
        GateDecision gate = timingGate.evaluate(context, history);
        if (!gate.allowed()) {
            log.info("Deferred user={}: {} ({})", context.userId(), gate.reason().code(), gate.detail());
            return InterventionResponse.deferred(gate.reason(), gate.detail(), context.confidence());
        }

        Selection selection = selector.select(context, history);
        if (selection.isNoop()) {
            log.info("Deferred user={}: {}", context.userId(), selection.deferReason().code());
            return InterventionResponse.deferred(selection.deferReason(), "no strategy available for this context",
                    context.confidence());
        }

        Intervention intervention = generator.build(selection.strategy(), context);
        InterventionRecord rec = generator.recordFor(selection.strategy(), context);
        history.record(rec);
        log.info("Selected {} for user={} (score={}, record={})",
                selection.strategy().name(), context.userId(), String.format("%.4f", selection.score()), rec.id());

        deliver(context.userId(), intervention);
        return InterventionResponse.delivered(rec.id(), selection.strategy().name(), selection.score(),
                selection.factors(), intervention, context.confidence());
    }

    private void deliver(String userId, Intervention intervention) {
        try {
            deliveryChannel.deliver(userId, intervention);
        } catch (RuntimeException e) {
            log.warn("Delivery to user={} failed; intervention stays recorded", userId, e);
        }
    }

    private static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidContextException("user_id is required");
        }
        String id = userId.trim();
        if (id.length() > MAX_USER_ID_LENGTH) {
            throw new InvalidContextException("user_id longer than " + MAX_USER_ID_LENGTH + " characters");
        }
        return id;
    }
}
