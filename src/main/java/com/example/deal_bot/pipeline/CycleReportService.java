package com.example.deal_bot.pipeline;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.springframework.stereotype.Service;

import com.example.deal_bot.entity.CycleMetrics;
import com.example.deal_bot.repo.CycleMetricsRepository;

/**
 * 直近N日のサイクル統計の集計（週次レポート・運用API用）
 */
@Service
public class CycleReportService {

    private final CycleMetricsRepository repo;
    private final Clock clock;

    public CycleReportService(CycleMetricsRepository repo, Clock clock) {
        this.repo = repo;
        this.clock = clock;
    }

    public Report report(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be >= 1");
        }
        Instant since = clock.instant().minus(Duration.ofDays(days));
        List<CycleMetrics> rows = repo.findByStartedAtGreaterThanEqualOrderByStartedAtAsc(since);

        int failedCycles = 0;
        long fetched = 0;
        long persisted = 0;
        long published = 0;
        long errors = 0;
        long publishErrors = 0;
        long calls = 0;
        for (CycleMetrics m : rows) {
            if (CycleState.FAILED.name().equals(m.getFinalState())) {
                failedCycles++;
            }
            fetched += m.getFetched();
            persisted += m.getPersisted();
            published += m.getPublished();
            errors += m.getErrors();
            publishErrors += m.getPublishErrors();
            calls += m.getUpstreamCalls();
        }

        long attempts = published + publishErrors;
        BigDecimal successRate = attempts == 0
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(published * 100).divide(BigDecimal.valueOf(attempts), 1, RoundingMode.HALF_UP);

        return new Report(
                days,
                rows.size(),
                failedCycles,
                fetched,
                persisted,
                published,
                errors,
                calls,
                successRate,
                perDay(persisted, days),
                perDay(published, days));
    }

    private static BigDecimal perDay(long total, int days) {
        return BigDecimal.valueOf(total).divide(BigDecimal.valueOf(days), 1, RoundingMode.HALF_UP);
    }

    public record Report(
            int days,
            int cycles,
            int failedCycles,
            long dealsFetched,
            long dealsPersisted,
            long postsPublished,
            long errors,
            long upstreamCalls,
            BigDecimal publishSuccessRate,
            BigDecimal avgPersistedPerDay,
            BigDecimal avgPublishedPerDay) {
    }
}
