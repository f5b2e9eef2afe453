package com.example.deal_bot.source;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.annotation.PostConstruct;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "keepa")
public class KeepaProperties {

    private static final Logger log = LoggerFactory.getLogger(KeepaProperties.class);

    private String apiKey;
    @NotBlank(message = "apiBase is required")
    private String apiBase = "https://api.keepa.com";
    @Positive(message = "domainId must be positive")
    private int domainId = 1;

    // ===== レート予算 =====
    @Positive(message = "tokensPerMinute must be positive")
    private int tokensPerMinute = 1200;
    @PositiveOrZero(message = "tokenBuffer must not be negative")
    private int tokenBuffer = 10;
    @NotNull(message = "minRequestInterval is required")
    private Duration minRequestInterval = Duration.ofMillis(50);

    @NotNull(message = "requestTimeout is required")
    private Duration requestTimeout = Duration.ofSeconds(20);

    /** 一次検索が0件のとき割引下限を緩めて再検索する */
    private boolean useFallback = true;

    @PostConstruct
    public void validate() {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("keepa.api-key is not configured; the real price-data source cannot authenticate");
        }
        if (tokenBuffer >= tokensPerMinute) {
            log.warn("keepa.token-buffer ({}) >= tokens-per-minute ({}); budget clamped to 1 call per window",
                    tokenBuffer, tokensPerMinute);
        }
    }
}
