package com.example.deal_bot.ops;

import java.time.LocalDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.deal_bot.service.StateTransitionService;

/**
 * 一時停止スイッチ。停止中は定期サイクルを実行せず、手動サイクルでも投稿段階を飛ばす。
 */
@Service
public class KillSwitchService {

    private static final Logger log = LoggerFactory.getLogger(KillSwitchService.class);

    public static final String KEY_PAUSED = "PAUSED";
    public static final String KEY_REASON = "PAUSE_REASON";

    private final SystemFlagRepository flagRepo;
    private final StateTransitionService transitions;

    public KillSwitchService(SystemFlagRepository flagRepo, StateTransitionService transitions) {
        this.flagRepo = flagRepo;
        this.transitions = transitions;
    }

    public boolean isPaused() {
        return flagRepo.findById(KEY_PAUSED)
                .map(f -> "true".equalsIgnoreCase(nz(f.getValue())))
                .orElse(false);
    }

    public String getReason() {
        return flagRepo.findById(KEY_REASON).map(SystemFlag::getValue).orElse("");
    }

    public LocalDateTime getUpdatedAt() {
        return flagRepo.findById(KEY_PAUSED).map(SystemFlag::getUpdatedAt).orElse(null);
    }

    @Transactional
    public void pause(String reason) {
        pause("KILL_SWITCH", reason, "USER");
    }

    /** 自動停止（投稿エラー多発など） */
    @Transactional
    public void pauseFromBatch(String reasonCode, String detail) {
        pause(reasonCode, detail, "BATCH");
    }

    @Transactional
    public void resume() {
        if (!isPaused()) return;
        saveFlag(KEY_PAUSED, "false");
        saveFlag(KEY_REASON, "");
        log.info("Pipeline resumed manually.");
        transitions.log(StateTransitionService.TYPE_SYSTEM, "0", "PAUSED", "RUNNING",
                "RESUME", "Manual resume", "USER", null);
    }

    private void pause(String reasonCode, String reason, String actor) {
        if (isPaused()) return;
        saveFlag(KEY_PAUSED, "true");
        saveFlag(KEY_REASON, nz(reason));
        log.error("KILL SWITCH ACTIVATED ({}): {}", reasonCode, reason);
        transitions.log(StateTransitionService.TYPE_SYSTEM, "0", "RUNNING", "PAUSED",
                reasonCode, reason, actor, null);
    }

    private void saveFlag(String key, String val) {
        SystemFlag f = flagRepo.findById(key).orElseGet(() -> new SystemFlag(key, null));
        f.setValue(val);
        flagRepo.save(f);
    }

    private static String nz(String s) {
        return (s == null) ? "" : s;
    }
}
