package com.herzen.coach.api;

import com.herzen.coach.context.ContextModels.RawSignals;
import com.herzen.coach.engine.CoachingEngine;
import com.herzen.coach.engine.EngineModels.InterventionResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/interventions")
public class InterventionController {
    private final CoachingEngine engine;

    public InterventionController(CoachingEngine engine) {
        this.engine = engine;
    }

    @PostMapping
    public ResponseEntity<InterventionResponse> decide(@RequestBody RawSignals signals) {
        return ResponseEntity.ok(engine.decide(signals));
    }

    @PostMapping("/users/{userId}/evaluate")
    public ResponseEntity<InterventionResponse> evaluate(@PathVariable String userId) {
        return ResponseEntity.ok(engine.decideFor(userId));
    }
}
