package com.example.deal_bot.pipeline;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.deal_bot.MutableClock;
import com.example.deal_bot.entity.CycleMetrics;
import com.example.deal_bot.repo.CycleMetricsRepository;

class CycleReportServiceTest {

    @Test
    void report_aggregatesWindow() {
        CycleMetricsRepository repo = mock(CycleMetricsRepository.class);
        MutableClock clock = MutableClock.at("2024-05-08T09:00:00Z");
        when(repo.findByStartedAtGreaterThanEqualOrderByStartedAtAsc(Instant.parse("2024-05-01T09:00:00Z")))
                .thenReturn(List.of(
                        metrics("DONE", 40, 12, 3, 0, 1),
                        metrics("DONE", 35, 9, 2, 1, 1),
                        metrics("FAILED", 0, 0, 0, 1, 0)));

        CycleReportService.Report r = new CycleReportService(repo, clock).report(7);

        assertThat(r.cycles()).isEqualTo(3);
        assertThat(r.failedCycles()).isEqualTo(1);
        assertThat(r.dealsFetched()).isEqualTo(75);
        assertThat(r.dealsPersisted()).isEqualTo(21);
        assertThat(r.postsPublished()).isEqualTo(5);
        assertThat(r.errors()).isEqualTo(2);
        // 5 / (5 + 2)
        assertThat(r.publishSuccessRate()).isEqualByComparingTo("71.4");
        assertThat(r.avgPersistedPerDay()).isEqualByComparingTo("3.0");
    }

    @Test
    void report_noAttempts_hasZeroSuccessRate() {
        CycleMetricsRepository repo = mock(CycleMetricsRepository.class);
        when(repo.findByStartedAtGreaterThanEqualOrderByStartedAtAsc(any()))
                .thenReturn(List.of());

        CycleReportService.Report r = new CycleReportService(repo, MutableClock.at("2024-05-08T09:00:00Z")).report(1);

        assertThat(r.cycles()).isZero();
        assertThat(r.publishSuccessRate()).isEqualByComparingTo("0");
    }

    @Test
    void report_rejectsNonPositiveDays() {
        CycleReportService service = new CycleReportService(mock(CycleMetricsRepository.class),
                MutableClock.at("2024-05-08T09:00:00Z"));

        assertThatThrownBy(() -> service.report(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static CycleMetrics metrics(String state, int fetched, int persisted, int published,
            int errors, int publishErrors) {
        CycleMetrics m = new CycleMetrics();
        m.setFinalState(state);
        m.setFetched(fetched);
        m.setPersisted(persisted);
        m.setPublished(published);
        m.setErrors(errors);
        m.setPublishErrors(publishErrors);
        return m;
    }
}
