package com.herzen.coach.feedback;

import com.herzen.coach.feedback.FeedbackModels.FeedbackResult;
import com.herzen.coach.history.HistoryModels.InterventionRecord;
import com.herzen.coach.history.HistoryModels.Outcome;
import com.herzen.coach.history.InterventionHistoryStore;
import com.herzen.coach.history.RecordNotFoundException;
import com.herzen.coach.strategy.StrategyCatalog;
import org.springframework.stereotype.Service;

@Service
public class FeedbackService {
    private final InterventionHistoryStore history;
    private final StrategyCatalog catalog;
    private final FeedbackAdapter adapter;

    public FeedbackService(InterventionHistoryStore history, StrategyCatalog catalog, FeedbackAdapter adapter) {
        this.history = history;
        this.catalog = catalog;
        this.adapter = adapter;
    }

    public FeedbackResult recordOutcome(String recordId, Outcome outcome) {
        if (recordId == null || recordId.isBlank()) throw new IllegalArgumentException("record_id is required");
        if (outcome == null) throw new IllegalArgumentException("outcome is required");

        InterventionRecord delivered = history.findById(recordId).orElseThrow(() -> new RecordNotFoundException(recordId));
        catalog.get(delivered.strategyName());

        InterventionRecord amended = history.amend(recordId, outcome);
        double weight = adapter.applyFeedback(amended.strategyName(), outcome.effectiveness());
        return new FeedbackResult(amended.rootId(), amended.id(), amended.strategyName(), weight);
    }
}
