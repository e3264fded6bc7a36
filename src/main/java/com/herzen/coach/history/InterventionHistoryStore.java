package com.herzen.coach.history;

import com.herzen.coach.history.HistoryModels.InterventionRecord;
import com.herzen.coach.history.HistoryModels.Outcome;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only per-user log of delivered interventions.
 * <p>
 * Cooldown and cap queries look at delivered records only; amended copies that carry outcomes
 * share the delivered record's timestamp and are not counted twice.
 */
public interface InterventionHistoryStore {

    void record(InterventionRecord rec);

    Optional<InterventionRecord> lastFor(String userId, String strategyName);

    Optional<InterventionRecord> lastForUser(String userId);

    int countSince(String userId, Instant since);

    /** Latest version of each of the user's last {@code limit} deliveries, oldest first. */
    List<InterventionRecord> recent(String userId, int limit);

    /** Latest version of the record with this id, following amendments. */
    Optional<InterventionRecord> findById(String id);

    /**
     * Appends a copy of the delivered record carrying {@code outcome}.
     *
     * @throws RecordNotFoundException if no delivered record has this id
     */
    InterventionRecord amend(String recordId, Outcome outcome);
}
