package com.herzen.coach.context;

import com.herzen.coach.context.ContextModels.RawSignals;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class TelemetrySignalsProvider implements SignalsProvider {
    private final Map<String, RawSignals> latest = new ConcurrentHashMap<>();

    public void publish(String userId, RawSignals signals) {
        latest.put(userId, (signals == null ? RawSignals.empty(userId) : signals).withUserId(userId));
    }

    @Override
    public CompletableFuture<RawSignals> getRawSignals(String userId) {
        return CompletableFuture.completedFuture(latest.getOrDefault(userId, RawSignals.empty(userId)));
    }
}
