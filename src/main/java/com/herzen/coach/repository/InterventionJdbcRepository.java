package com.herzen.coach.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.coach.history.HistoryModels.ContextSnapshot;
import com.herzen.coach.history.HistoryModels.InterventionRecord;
import com.herzen.coach.history.HistoryModels.Outcome;
import com.herzen.coach.history.InterventionHistoryStore;
import com.herzen.coach.history.RecordNotFoundException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.*;

/**
 * H2-backed {@link InterventionHistoryStore}. Rows are only ever inserted; an outcome is stored as
 * a new row whose {@code original_id} references the delivered record.
 */
@Repository
public class InterventionJdbcRepository implements InterventionHistoryStore {
    private static final String COLUMNS =
            "id, original_id, user_id, strategy_name, ts_millis, context_snapshot, effectiveness, satisfaction, completed";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<InterventionRecord> rowMapper = this::mapRow;

    public InterventionJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(InterventionRecord rec) {
        Outcome o = rec.outcome();
        jdbcTemplate.update(
                "INSERT INTO intervention_records(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)",
                rec.id(), rec.originalId(), rec.userId(), rec.strategyName(), rec.timestamp().toEpochMilli(),
                writeSnapshot(rec.contextSnapshot()),
                o == null ? null : o.effectiveness(),
                o == null ? null : o.satisfaction(),
                o == null ? null : o.completed());
    }

    @Override
    public Optional<InterventionRecord> lastFor(String userId, String strategyName) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM intervention_records WHERE user_id=? AND strategy_name=? AND original_id IS NULL " +
                        "ORDER BY ts_millis DESC, seq DESC LIMIT 1",
                rowMapper, userId, strategyName).stream().findFirst();
    }

    @Override
    public Optional<InterventionRecord> lastForUser(String userId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM intervention_records WHERE user_id=? AND original_id IS NULL " +
                        "ORDER BY ts_millis DESC, seq DESC LIMIT 1",
                rowMapper, userId).stream().findFirst();
    }

    @Override
    public int countSince(String userId, Instant since) {
        Integer value = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM intervention_records WHERE user_id=? AND original_id IS NULL AND ts_millis >= ?",
                Integer.class,
                userId, since.toEpochMilli());
        return value == null ? 0 : value;
    }

    @Override
    public List<InterventionRecord> recent(String userId, int limit) {
        if (userId == null || limit <= 0) return List.of();
        List<InterventionRecord> delivered = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM intervention_records WHERE user_id=? AND original_id IS NULL " +
                        "ORDER BY ts_millis DESC, seq DESC LIMIT ?",
                rowMapper, userId, limit);
        if (delivered.isEmpty()) return List.of();

        Map<String, InterventionRecord> latestAmendment = new HashMap<>();
        jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM intervention_records WHERE user_id=? AND original_id IS NOT NULL ORDER BY seq",
                rowMapper, userId).forEach(a -> latestAmendment.put(a.originalId(), a));

        List<InterventionRecord> out = new ArrayList<>(delivered.size());
        for (InterventionRecord rec : delivered) {
            out.add(latestAmendment.getOrDefault(rec.id(), rec));
        }
        Collections.reverse(out);
        return out;
    }

    @Override
    public Optional<InterventionRecord> findById(String id) {
        return findRow(id).flatMap(row -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM intervention_records WHERE id=? OR original_id=? ORDER BY seq DESC LIMIT 1",
                rowMapper, row.rootId(), row.rootId()).stream().findFirst());
    }

    @Override
    public InterventionRecord amend(String recordId, Outcome outcome) {
        InterventionRecord delivered = findRow(recordId)
                .flatMap(row -> findRow(row.rootId()))
                .orElseThrow(() -> new RecordNotFoundException(recordId));
        InterventionRecord amended = delivered.amendedWith(UUID.randomUUID().toString(), outcome);
        record(amended);
        return amended;
    }

    private Optional<InterventionRecord> findRow(String id) {
        if (id == null) return Optional.empty();
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM intervention_records WHERE id=?",
                rowMapper, id).stream().findFirst();
    }

    private InterventionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        Double effectiveness = (Double) rs.getObject(7);
        Outcome outcome = effectiveness == null ? null
                : new Outcome(effectiveness, rs.getDouble(8), rs.getBoolean(9));
        return new InterventionRecord(
                rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                Instant.ofEpochMilli(rs.getLong(5)),
                readSnapshot(rs.getString(6)),
                outcome);
    }

    private String writeSnapshot(ContextSnapshot snapshot) {
        if (snapshot == null) return null;
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Context snapshot serialization failed", e);
        }
    }

    private ContextSnapshot readSnapshot(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, ContextSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Context snapshot parse failed", e);
        }
    }
}
