package com.example.deal_bot.ops;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.deal_bot.pipeline.CycleStats;
import com.example.deal_bot.pipeline.DealPipelineOrchestrator;
import com.example.deal_bot.publish.PublishGovernor;
import com.example.deal_bot.source.RateBudgetedFetcher;

/**
 * 直近サイクルが FAILED、または上流の残トークンが0なら 503
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final DealPipelineOrchestrator orchestrator;
    private final KillSwitchService killSwitchService;
    private final RateBudgetedFetcher fetcher;
    private final PublishGovernor governor;
    private final Clock clock;

    public HealthController(DealPipelineOrchestrator orchestrator, KillSwitchService killSwitchService,
            RateBudgetedFetcher fetcher, PublishGovernor governor, Clock clock) {
        this.orchestrator = orchestrator;
        this.killSwitchService = killSwitchService;
        this.fetcher = fetcher;
        this.governor = governor;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<?> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        boolean healthy = true;

        CycleStats last = orchestrator.lastCycle().orElse(null);
        if (last != null) {
            Map<String, Object> cycle = new LinkedHashMap<>();
            cycle.put("state", last.finalState());
            cycle.put("finishedAt", last.finishedAt());
            cycle.put("persisted", last.persisted());
            cycle.put("published", last.published());
            cycle.put("errors", last.errors());
            body.put("lastCycle", cycle);
            healthy = !last.failed();
        }

        Integer quota = null;
        try {
            int reported = fetcher.remainingQuota();
            // 負値はまだ一度も報告されていない
            if (reported >= 0) {
                quota = reported;
                if (reported == 0) {
                    healthy = false;
                }
            }
        } catch (RuntimeException e) {
            log.warn("health: quota lookup failed: {}", e.getMessage());
            healthy = false;
        }
        body.put("upstreamQuota", quota);
        body.put("paused", killSwitchService.isPaused());
        body.put("publishBudget", governor.snapshot(clock.instant()));
        body.put("status", healthy ? "UP" : "DEGRADED");
        body.put("timestamp", clock.instant().toString());

        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
