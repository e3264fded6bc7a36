package com.herzen.coach;

import com.herzen.coach.context.ContextModels.FocusState;
import com.herzen.coach.context.ContextModels.TimeOfDay;
import com.herzen.coach.history.HistoryModels.ContextSnapshot;
import com.herzen.coach.history.HistoryModels.InterventionRecord;
import com.herzen.coach.history.HistoryModels.Outcome;
import com.herzen.coach.history.InterventionHistoryStore;
import com.herzen.coach.history.RecordNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class InterventionHistoryStoreTest {
    @Autowired
    private InterventionHistoryStore store;

    private final Instant base = Instant.now().truncatedTo(ChronoUnit.MILLIS).minus(Duration.ofHours(5));

    @Test
    void storesSnapshotAndAnswersLastQueries() {
        InterventionRecord first = deliver("hist-last", "micro-break", base);
        InterventionRecord second = deliver("hist-last", "breathing-reset", base.plus(Duration.ofHours(1)));

        assertEquals(second.id(), store.lastForUser("hist-last").orElseThrow().id());
        assertEquals(first.id(), store.lastFor("hist-last", "micro-break").orElseThrow().id());
        assertTrue(store.lastFor("hist-last", "deep-work-block").isEmpty());
        assertTrue(store.lastForUser("hist-nobody").isEmpty());

        InterventionRecord loaded = store.findById(first.id()).orElseThrow();
        assertEquals(base, loaded.timestamp());
        assertEquals(first.contextSnapshot(), loaded.contextSnapshot());
    }

    @Test
    void amendmentAddsOutcomeWithoutCountingAsDelivery() {
        InterventionRecord delivered = deliver("hist-amend", "micro-break", base);

        InterventionRecord amended = store.amend(delivered.id(), new Outcome(0.8, 0.7, true));

        assertNotEquals(delivered.id(), amended.id());
        assertEquals(delivered.id(), amended.originalId());
        assertEquals(delivered.timestamp(), amended.timestamp());
        assertEquals(1, store.countSince("hist-amend", base.minus(Duration.ofMinutes(1))));
        assertEquals(delivered.id(), store.lastForUser("hist-amend").orElseThrow().id());

        InterventionRecord latest = store.findById(delivered.id()).orElseThrow();
        assertEquals(0.8, latest.outcome().effectiveness());
        assertEquals(latest, store.findById(amended.id()).orElseThrow());
    }

    @Test
    void laterAmendmentSupersedesEarlierOne() {
        InterventionRecord delivered = deliver("hist-twice", "micro-break", base);
        store.amend(delivered.id(), new Outcome(0.2, 0.2, false));
        InterventionRecord second = store.amend(delivered.id(), new Outcome(0.9, 0.8, true));

        assertEquals(second.id(), store.findById(delivered.id()).orElseThrow().id());
        assertEquals(delivered.id(), store.amend(second.id(), new Outcome(0.5, 0.5, true)).originalId());
    }

    @Test
    void recentReturnsLatestVersionsOldestFirst() {
        InterventionRecord a = deliver("hist-recent", "micro-break", base);
        InterventionRecord b = deliver("hist-recent", "breathing-reset", base.plus(Duration.ofMinutes(40)));
        InterventionRecord c = deliver("hist-recent", "worry-journal", base.plus(Duration.ofMinutes(80)));
        store.amend(b.id(), new Outcome(0.6, 0.5, true));

        List<InterventionRecord> recent = store.recent("hist-recent", 2);

        assertEquals(2, recent.size());
        assertEquals(b.id(), recent.get(0).originalId());
        assertTrue(recent.get(0).hasOutcome());
        assertEquals(c.id(), recent.get(1).id());
        assertEquals(3, store.recent("hist-recent", 10).size());
        assertEquals(a.id(), store.recent("hist-recent", 10).get(0).id());
    }

    @Test
    void amendingUnknownRecordFails() {
        assertThrows(RecordNotFoundException.class, () -> store.amend("missing-" + UUID.randomUUID(), new Outcome(1, 1, true)));
        assertTrue(store.findById("missing-" + UUID.randomUUID()).isEmpty());
    }

    private InterventionRecord deliver(String userId, String strategy, Instant at) {
        ContextSnapshot snapshot = new ContextSnapshot(userId, 0.4, 0.6, 0.5, FocusState.SHALLOW, "analyst",
                TimeOfDay.AFTERNOON, Set.of("routine"), Set.of("high_tab_count"));
        InterventionRecord rec = new InterventionRecord(UUID.randomUUID().toString(), null, userId, strategy, at, snapshot, null);
        store.record(rec);
        return rec;
    }
}
