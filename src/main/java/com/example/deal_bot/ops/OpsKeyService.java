package com.example.deal_bot.ops;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * X-OPS-KEY の検証。system_flags の OPS_KEY を優先し、無ければ ops.key 設定値と比較する。
 */
@Service
public class OpsKeyService {

    private static final Logger log = LoggerFactory.getLogger(OpsKeyService.class);

    public static final String KEY_OPS = "OPS_KEY";

    private final SystemFlagRepository repo;
    private final String configuredKey;

    public OpsKeyService(SystemFlagRepository repo, @Value("${ops.key:}") String configuredKey) {
        this.repo = repo;
        this.configuredKey = configuredKey;
    }

    public boolean isValid(String provided) {
        if (provided == null || provided.isBlank()) return false;
        String expected = repo.findById(KEY_OPS)
                .map(SystemFlag::getValue)
                .filter(v -> !v.isBlank())
                .orElse(configuredKey);
        if (expected == null || expected.isBlank()) {
            log.warn("No ops key configured; rejecting ops request");
            return false;
        }
        return expected.equals(provided);
    }
}
