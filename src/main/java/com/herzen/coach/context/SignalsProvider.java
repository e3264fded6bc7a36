package com.herzen.coach.context;

import com.herzen.coach.context.ContextModels.RawSignals;

import java.util.concurrent.CompletableFuture;

/**
 * Source of raw context signals for a user (telemetry or user-state service).
 * Implementations may complete asynchronously; callers apply their own timeout.
 */
public interface SignalsProvider {
    CompletableFuture<RawSignals> getRawSignals(String userId);
}
