package com.herzen.coach.api;

import com.herzen.coach.context.ContextModels.RawSignals;
import com.herzen.coach.context.TelemetrySignalsProvider;
import com.herzen.coach.engine.CoachingEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/telemetry")
public class TelemetryController {
    private final TelemetrySignalsProvider provider;

    public TelemetryController(TelemetrySignalsProvider provider) {
        this.provider = provider;
    }

    @PostMapping("/{userId}")
    public ResponseEntity<Void> publish(@PathVariable String userId, @RequestBody RawSignals signals) {
        if (userId.isBlank()) throw new IllegalArgumentException("userId is required");
        if (userId.trim().length() > CoachingEngine.MAX_USER_ID_LENGTH) {
            throw new IllegalArgumentException("userId longer than " + CoachingEngine.MAX_USER_ID_LENGTH + " characters");
        }
        provider.publish(userId.trim(), signals);
        return ResponseEntity.accepted().build();
    }
}
