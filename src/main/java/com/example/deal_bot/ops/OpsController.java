package com.example.deal_bot.ops;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import com.example.deal_bot.pipeline.CycleReportService;
import com.example.deal_bot.pipeline.CycleStats;
import com.example.deal_bot.pipeline.DealPipelineOrchestrator;
import com.example.deal_bot.publish.PublishGovernor;
import com.example.deal_bot.repo.StateTransitionRepository;
import com.example.deal_bot.service.StateTransitionService;

@RestController
@RequestMapping("/ops")
public class OpsController {

    private final OpsKeyService opsKeyService;
    private final KillSwitchService killSwitchService;
    private final DealPipelineOrchestrator orchestrator;
    private final PublishGovernor governor;
    private final CycleReportService reportService;
    private final StateTransitionService transitions;
    private final StateTransitionRepository transitionRepo;
    private final Clock clock;

    public OpsController(
            OpsKeyService opsKeyService,
            KillSwitchService killSwitchService,
            DealPipelineOrchestrator orchestrator,
            PublishGovernor governor,
            CycleReportService reportService,
            StateTransitionService transitions,
            StateTransitionRepository transitionRepo,
            Clock clock) {
        this.opsKeyService = opsKeyService;
        this.killSwitchService = killSwitchService;
        this.orchestrator = orchestrator;
        this.governor = governor;
        this.reportService = reportService;
        this.transitions = transitions;
        this.transitionRepo = transitionRepo;
        this.clock = clock;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("paused", killSwitchService.isPaused());
        body.put("reason", killSwitchService.getReason());
        body.put("updatedAt", killSwitchService.getUpdatedAt());
        body.put("cycleRunning", orchestrator.isRunning());
        body.put("lastCycle", orchestrator.lastCycle().orElse(null));
        body.put("publishBudget", governor.snapshot(clock.instant()));
        body.put("recentSystemEvents", transitionRepo.findRecentByEntityType(
                        StateTransitionService.TYPE_SYSTEM, PageRequest.of(0, 5)).stream()
                .map(st -> st.getCreatedAt() + " " + st.getToState() + " " + st.getReasonCode())
                .toList());
        return body;
    }

    @PostMapping("/pause")
    public ResponseEntity<?> pause(
            @RequestHeader(value = "X-OPS-KEY", required = false) String opsKey,
            @RequestBody(required = false) Map<String, Object> body) {
        if (!opsKeyService.isValid(opsKey)) {
            return unauthorized();
        }
        String reason = body == null ? "" : String.valueOf(body.getOrDefault("reason", ""));
        killSwitchService.pause(reason);
        return ResponseEntity.ok(Map.of("paused", true, "reason", reason));
    }

    @PostMapping("/resume")
    public ResponseEntity<?> resume(@RequestHeader(value = "X-OPS-KEY", required = false) String opsKey) {
        if (!opsKeyService.isValid(opsKey)) {
            return unauthorized();
        }
        killSwitchService.resume();
        return ResponseEntity.ok(Map.of("paused", false));
    }

    /** 1サイクルを同期実行する。停止中は投稿段階のみ飛ばす */
    @PostMapping("/run-cycle")
    public ResponseEntity<?> runCycle(@RequestHeader(value = "X-OPS-KEY", required = false) String opsKey) {
        if (!opsKeyService.isValid(opsKey)) {
            return unauthorized();
        }
        CycleStats stats = orchestrator.runCycle();
        if (stats.skipped()) {
            throw new IllegalStateException("a cycle is already running");
        }
        return ResponseEntity.ok(stats);
    }

    @PostMapping("/reset-publish-period")
    public ResponseEntity<?> resetPublishPeriod(@RequestHeader(value = "X-OPS-KEY", required = false) String opsKey) {
        if (!opsKeyService.isValid(opsKey)) {
            return unauthorized();
        }
        governor.resetPeriod(clock.instant());
        transitions.log(StateTransitionService.TYPE_SYSTEM, "0", null, "PUBLISH_PERIOD_RESET",
                "PUBLISH_PERIOD_RESET", "manual", "USER", null);
        return ResponseEntity.ok(governor.snapshot(clock.instant()));
    }

    @GetMapping("/report")
    public ResponseEntity<?> report(
            @RequestHeader(value = "X-OPS-KEY", required = false) String opsKey,
            @RequestParam(name = "days", defaultValue = "7") int days) {
        if (!opsKeyService.isValid(opsKey)) {
            return unauthorized();
        }
        return ResponseEntity.ok(reportService.report(days));
    }

    private static ResponseEntity<?> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "invalid ops key"));
    }
}
