package com.example.deal_bot.ops;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.example.deal_bot.entity.CycleMetrics;
import com.example.deal_bot.pipeline.PipelineProperties;
import com.example.deal_bot.repo.CycleMetricsRepository;

/**
 * 直近1時間のサイクル統計からアラートを出す。同じ種類のアラートは1時間抑止。
 * 投稿エラーが続いた場合は一時停止スイッチを入れる。
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    static final String ALERT_HIGH_ERRORS = "HIGH_ERROR_RATE";
    static final String ALERT_NO_DEALS = "NO_DEALS";

    private static final int ERROR_THRESHOLD_PER_HOUR = 5;
    private static final int NO_DEALS_MIN_CYCLES = 2;
    private static final Duration WINDOW = Duration.ofHours(1);
    private static final Duration SUPPRESS_FOR = Duration.ofHours(1);

    private final CycleMetricsRepository metricsRepo;
    private final KillSwitchService killSwitch;
    private final PipelineProperties props;
    private final Clock clock;

    private final Map<String, Instant> lastAlertAt = new ConcurrentHashMap<>();

    public AlertService(CycleMetricsRepository metricsRepo, KillSwitchService killSwitch,
            PipelineProperties props, Clock clock) {
        this.metricsRepo = metricsRepo;
        this.killSwitch = killSwitch;
        this.props = props;
        this.clock = clock;
    }

    /**
     * @return 今回出したアラート種別（抑止されたものは含まない）
     */
    @Scheduled(fixedDelayString = "${ops.alert-check-interval:PT5M}", initialDelayString = "${ops.alert-check-interval:PT5M}")
    public List<String> checkAlerts() {
        Instant now = clock.instant();
        List<CycleMetrics> lastHour = metricsRepo.findByStartedAtGreaterThanEqualOrderByStartedAtAsc(now.minus(WINDOW));

        int errors = 0;
        int persisted = 0;
        for (CycleMetrics m : lastHour) {
            errors += m.getErrors();
            persisted += m.getPersisted();
        }

        List<String> raised = new ArrayList<>();
        if (errors > ERROR_THRESHOLD_PER_HOUR
                && raise(ALERT_HIGH_ERRORS, errors + " errors in the last hour", now)) {
            raised.add(ALERT_HIGH_ERRORS);
        }
        if (lastHour.size() >= NO_DEALS_MIN_CYCLES && persisted == 0
                && raise(ALERT_NO_DEALS, "no deals detected in " + lastHour.size() + " cycles", now)) {
            raised.add(ALERT_NO_DEALS);
        }
        return raised;
    }

    /**
     * 直近 windowCycles サイクルの投稿エラー合計が閾値以上なら一時停止する。
     *
     * @return 停止した場合 true
     */
    public boolean checkAutoPause() {
        PipelineProperties.AutoPause cfg = props.getAutoPause();
        int window = Math.max(1, cfg.getWindowCycles());
        List<CycleMetrics> recent = metricsRepo.findAllByOrderByStartedAtDesc(PageRequest.of(0, window));
        int publishErrors = recent.stream().mapToInt(CycleMetrics::getPublishErrors).sum();
        if (publishErrors < cfg.getPublishErrors() || killSwitch.isPaused()) {
            return false;
        }
        String detail = "AUTO_PAUSE_PUBLISH_ERRORS fail=" + publishErrors + " window=last" + window;
        killSwitch.pauseFromBatch("AUTO_PAUSE_PUBLISH_ERRORS", detail);
        return true;
    }

    private boolean raise(String type, String message, Instant now) {
        Instant last = lastAlertAt.get(type);
        if (last != null && now.isBefore(last.plus(SUPPRESS_FOR))) {
            log.debug("[Alert] {} suppressed (last at {})", type, last);
            return false;
        }
        lastAlertAt.put(type, now);
        log.warn("[Alert] {}: {}", type, message);
        return true;
    }
}
