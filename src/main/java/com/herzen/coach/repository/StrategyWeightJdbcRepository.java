package com.herzen.coach.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

@Repository
public class StrategyWeightJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public StrategyWeightJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Map<String, Double> loadAll() {
        return jdbcTemplate.query("SELECT strategy_name, weight FROM strategy_weights",
                        (rs, n) -> new WeightRow(rs.getString(1), rs.getDouble(2)))
                .stream()
                .collect(Collectors.toMap(WeightRow::strategyName, WeightRow::weight, (a, b) -> b));
    }

    public void save(String strategyName, double weight, Instant updatedAt) {
        jdbcTemplate.update(
                "MERGE INTO strategy_weights(strategy_name, weight, updated_at) KEY(strategy_name) VALUES (?,?,?)",
                strategyName, weight, updatedAt.toString());
    }

    public record WeightRow(String strategyName, double weight) {}
}
