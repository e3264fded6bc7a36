package com.herzen.coach.repository;

import com.herzen.coach.analytics.AnalyticsModels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Repository
public class AnalyticsJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public AnalyticsJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Map<String, Long> deliveredCounts() {
        return jdbcTemplate.query(
                "SELECT strategy_name, COUNT(*) FROM intervention_records WHERE original_id IS NULL GROUP BY strategy_name",
                (rs, n) -> new CountRow(rs.getString(1), rs.getLong(2))
        ).stream().collect(Collectors.toMap(CountRow::strategyName, CountRow::count));
    }

    /**
     * Latest outcome per delivered record. Older amendments of the same record are superseded.
     */
    public List<OutcomeRow> latestOutcomes() {
        return jdbcTemplate.query(
                "SELECT r.strategy_name, r.effectiveness, r.satisfaction, r.completed FROM intervention_records r " +
                        "WHERE r.original_id IS NOT NULL AND r.effectiveness IS NOT NULL AND r.seq = " +
                        "(SELECT MAX(a.seq) FROM intervention_records a WHERE a.original_id = r.original_id)",
                (rs, n) -> new OutcomeRow(rs.getString(1), rs.getDouble(2), rs.getDouble(3), rs.getBoolean(4))
        );
    }

    public void upsertAggregate(AnalyticsModels.StrategyAggregate a) {
        jdbcTemplate.update(
                "MERGE INTO strategy_aggregates(strategy_name, delivered, outcomes, avg_effectiveness, avg_satisfaction, completion_rate, weight, computed_at) KEY(strategy_name) VALUES (?,?,?,?,?,?,?,?)",
                a.strategyName(), a.delivered(), a.outcomes(), a.avgEffectiveness(), a.avgSatisfaction(),
                a.completionRate(), a.weight(), a.computedAt().toString()
        );
    }

    public List<AnalyticsModels.StrategyAggregate> loadAggregates() {
        return jdbcTemplate.query(
                "SELECT strategy_name, delivered, outcomes, avg_effectiveness, avg_satisfaction, completion_rate, weight, computed_at " +
                        "FROM strategy_aggregates ORDER BY strategy_name",
                (rs, n) -> new AnalyticsModels.StrategyAggregate(
                        rs.getString(1), rs.getLong(2), rs.getLong(3), rs.getDouble(4), rs.getDouble(5),
                        rs.getDouble(6), rs.getDouble(7), Instant.parse(rs.getString(8))
                )
        );
    }

    public record OutcomeRow(String strategyName, double effectiveness, double satisfaction, boolean completed) {}

    private record CountRow(String strategyName, long count) {}
}
