package com.herzen.coach.context;

import com.herzen.coach.config.CoachProperties;
import com.herzen.coach.context.ContextModels.RawSignals;
import com.herzen.coach.context.ContextModels.UserContext;
import com.herzen.coach.history.InterventionHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class ContextService {
    private static final Logger log = LoggerFactory.getLogger(ContextService.class);

    private final SignalsProvider signalsProvider;
    private final ContextNormalizer normalizer;
    private final InterventionHistoryStore history;
    private final CoachProperties properties;

    public ContextService(SignalsProvider signalsProvider,
                          ContextNormalizer normalizer,
                          InterventionHistoryStore history,
                          CoachProperties properties) {
        this.signalsProvider = signalsProvider;
        this.normalizer = normalizer;
        this.history = history;
        this.properties = properties;
    }

    /**
     * Fetches signals from the provider and normalizes them. A slow or failing provider
     * degrades to defaults instead of failing the decision.
     */
    public UserContext resolve(String userId) {
        return normalize(fetchSignals(userId));
    }

    public UserContext normalize(RawSignals raw) {
        return normalizer.normalize(raw, history.recent(raw.userId(), properties.history().recentLimit()));
    }

    public RawSignals fetchSignals(String userId) {
        return fetch(userId).withUserId(userId);
    }

    private RawSignals fetch(String userId) {
        Duration timeout = properties.context().fetchTimeout();
        try {
            RawSignals raw = signalsProvider.getRawSignals(userId).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return raw == null ? RawSignals.empty(userId) : raw;
        } catch (TimeoutException e) {
            log.warn("Signal fetch for user={} timed out after {}; using context defaults", userId, timeout);
        } catch (ExecutionException e) {
            log.warn("Signal fetch for user={} failed: {}; using context defaults", userId, e.getCause() == null ? e.toString() : e.getCause().toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Signal fetch for user={} interrupted; using context defaults", userId);
        }
        return RawSignals.empty(userId);
    }
}
