package com.herzen.coach.api;

import com.herzen.coach.feedback.FeedbackAdapter;
import com.herzen.coach.feedback.FeedbackModels;
import com.herzen.coach.feedback.FeedbackService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/feedback")
public class FeedbackController {
    private final FeedbackService feedbackService;
    private final FeedbackAdapter feedbackAdapter;

    public FeedbackController(FeedbackService feedbackService, FeedbackAdapter feedbackAdapter) {
        this.feedbackService = feedbackService;
        this.feedbackAdapter = feedbackAdapter;
    }

    @PostMapping
    public ResponseEntity<FeedbackModels.FeedbackResult> outcome(@RequestBody FeedbackModels.FeedbackRequest request) {
        if (request.outcome() == null) throw new IllegalArgumentException("outcome is required");
        return ResponseEntity.ok(feedbackService.recordOutcome(request.recordId(), request.outcome().toOutcome()));
    }

    @PostMapping("/strategies/{name}")
    public ResponseEntity<FeedbackModels.WeightUpdate> strategy(@PathVariable String name,
                                                                @RequestBody FeedbackModels.StrategyFeedbackRequest request) {
        if (request.effectiveness() == null || request.effectiveness().isNaN()) {
            throw new IllegalArgumentException("effectiveness is required");
        }
        double weight = feedbackAdapter.applyFeedback(name, request.effectiveness());
        return ResponseEntity.ok(new FeedbackModels.WeightUpdate(name, weight));
    }
}
