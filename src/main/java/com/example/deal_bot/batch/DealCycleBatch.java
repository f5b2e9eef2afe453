package com.example.deal_bot.batch;

import java.time.Clock;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.example.deal_bot.ops.AlertService;
import com.example.deal_bot.ops.KillSwitchService;
import com.example.deal_bot.pipeline.CycleReportService;
import com.example.deal_bot.pipeline.CycleStats;
import com.example.deal_bot.pipeline.DealPipelineOrchestrator;
import com.example.deal_bot.publish.PublishGovernor;

import jakarta.annotation.PreDestroy;

@Component
public class DealCycleBatch {

    private static final Logger log = LoggerFactory.getLogger(DealCycleBatch.class);

    private final DealPipelineOrchestrator orchestrator;
    private final KillSwitchService killSwitchService;
    private final AlertService alertService;
    private final PublishGovernor governor;
    private final CycleReportService reportService;
    private final Clock clock;
    private final Duration drainTimeout;

    private volatile boolean stopping;

    public DealCycleBatch(
            DealPipelineOrchestrator orchestrator,
            KillSwitchService killSwitchService,
            AlertService alertService,
            PublishGovernor governor,
            CycleReportService reportService,
            Clock clock,
            @Value("${pipeline.drain-timeout:PT2M}") Duration drainTimeout) {
        this.orchestrator = orchestrator;
        this.killSwitchService = killSwitchService;
        this.alertService = alertService;
        this.governor = governor;
        this.reportService = reportService;
        this.clock = clock;
        this.drainTimeout = drainTimeout;
    }

    @Scheduled(fixedDelayString = "${pipeline.cycle-interval:PT15M}", initialDelayString = "${pipeline.initial-delay:PT10S}")
    public void run() {
        if (stopping) {
            log.info("[DealCycle] skipped: shutting down");
            return;
        }
        if (killSwitchService.isPaused()) {
            log.warn("[DealCycle] skipped: SYSTEM IS PAUSED");
            return;
        }

        CycleStats stats = orchestrator.runCycle();
        if (stats.skipped()) {
            return;
        }
        try {
            alertService.checkAutoPause();
        } catch (RuntimeException e) {
            log.error("[DealCycle] auto-pause check failed: {}", e.getMessage());
        }
    }

    @Scheduled(cron = "${twitter.reset-cron:0 0 0 * * *}", zone = "UTC")
    public void resetPublishPeriod() {
        governor.resetPeriod(clock.instant());
    }

    @Scheduled(cron = "${pipeline.weekly-report-cron:0 0 9 * * SUN}", zone = "UTC")
    public void weeklyReport() {
        CycleReportService.Report r = reportService.report(7);
        log.info("[WeeklyReport] cycles={} failed={} fetched={} persisted={} published={} errors={} successRate={}% avgPersisted/day={} avgPublished/day={}",
                r.cycles(), r.failedCycles(), r.dealsFetched(), r.dealsPersisted(), r.postsPublished(),
                r.errors(), r.publishSuccessRate(), r.avgPersistedPerDay(), r.avgPublishedPerDay());
    }

    /** 以降のサイクルを止め、実行中のサイクルの終了を待つ */
    @PreDestroy
    public void drain() {
        stopping = true;
        if (!orchestrator.isRunning()) {
            return;
        }
        log.info("[DealCycle] waiting up to {}s for in-flight cycle", drainTimeout.toSeconds());
        try {
            if (!orchestrator.awaitIdle(drainTimeout)) {
                log.warn("[DealCycle] in-flight cycle did not finish within {}s", drainTimeout.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[DealCycle] interrupted while draining");
        }
    }

    boolean isStopping() {
        return stopping;
    }
}
