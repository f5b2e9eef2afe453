package com.example.deal_bot.publish;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.annotation.PostConstruct;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "twitter")
public class TwitterProperties {

    private static final Logger log = LoggerFactory.getLogger(TwitterProperties.class);

    /** false の場合、サイクルは投稿段階を飛ばす */
    private boolean enabled = true;

    @NotBlank(message = "apiBase is required")
    private String apiBase = "https://api.twitter.com";
    private String bearerToken;
    @NotNull(message = "requestTimeout is required")
    private Duration requestTimeout = Duration.ofSeconds(15);

    // ===== 投稿レート =====
    @Positive(message = "maxPostsPerHour must be positive")
    private int maxPostsPerHour = 20;
    @NotNull(message = "minPostInterval is required")
    private Duration minPostInterval = Duration.ofSeconds(300);

    @Min(value = 40, message = "maxLength must be at least 40")
    private int maxLength = 280;
    @Min(value = 10, message = "maxTitleLength must be at least 10")
    private int maxTitleLength = 100;

    @PostConstruct
    public void validate() {
        if (enabled && (bearerToken == null || bearerToken.isBlank())) {
            log.warn("twitter.bearer-token is not configured; the real publisher cannot authenticate");
        }
    }
}
