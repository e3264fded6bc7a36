package com.herzen.coach.analytics;

import com.herzen.coach.repository.AnalyticsJdbcRepository;
import com.herzen.coach.repository.AnalyticsJdbcRepository.OutcomeRow;
import com.herzen.coach.strategy.StrategyCatalog;
import com.herzen.coach.strategy.StrategyModels.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class AnalyticsService {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

    private final AnalyticsJdbcRepository repository;
    private final StrategyCatalog catalog;
    private final Clock clock;

    public AnalyticsService(AnalyticsJdbcRepository repository, StrategyCatalog catalog, Clock clock) {
        this.repository = repository;
        this.catalog = catalog;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${coach.analytics.recompute-delay-ms:300000}")
    public void scheduledRecompute() {
        recomputeAggregates();
    }

    public void recomputeAggregates() {
        Map<String, Long> delivered = repository.deliveredCounts();
        Map<String, List<OutcomeRow>> outcomes = repository.latestOutcomes().stream()
                .collect(Collectors.groupingBy(OutcomeRow::strategyName));
        Instant now = clock.instant();

        for (Strategy strategy : catalog.all()) {
            List<OutcomeRow> rows = outcomes.getOrDefault(strategy.name(), List.of());
            repository.upsertAggregate(new AnalyticsModels.StrategyAggregate(
                    strategy.name(),
                    delivered.getOrDefault(strategy.name(), 0L),
                    rows.size(),
                    rows.stream().mapToDouble(OutcomeRow::effectiveness).average().orElse(0.0),
                    rows.stream().mapToDouble(OutcomeRow::satisfaction).average().orElse(0.0),
                    rows.isEmpty() ? 0.0 : (double) rows.stream().filter(OutcomeRow::completed).count() / rows.size(),
                    strategy.weight(),
                    now));
        }
        log.debug("Recomputed aggregates for {} strategies", catalog.all().size());
    }

    public AnalyticsModels.StrategyOverviewResponse overview() {
        return new AnalyticsModels.StrategyOverviewResponse(repository.loadAggregates());
    }
}
