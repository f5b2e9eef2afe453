package com.example.deal_bot.pipeline;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * パイプライン設定（prefix: pipeline）
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    @NotNull(message = "cycleInterval is required")
    private Duration cycleInterval = Duration.ofMinutes(15);
    @Positive(message = "batchSize must be positive")
    private int batchSize = 10;

    @NotNull(message = "detectCooldown is required")
    private Duration detectCooldown = Duration.ofHours(24);
    @NotNull(message = "publishCooldown is required")
    private Duration publishCooldown = Duration.ofHours(24);

    /** メモリに保持するクールダウン状態の上限件数 */
    @Positive(message = "dedupCacheSize must be positive")
    private int dedupCacheSize = 10_000;

    /** 一次検索0件時の再検索で使う割引下限(%) */
    @PositiveOrZero(message = "fallbackMinDiscount must not be negative")
    private int fallbackMinDiscount = 10;

    @NotBlank(message = "productUrlTemplate is required")
    private String productUrlTemplate = "https://www.amazon.com/dp/{id}";
    private String affiliateTag;

    @NotNull(message = "defaultCommissionWeight is required")
    @PositiveOrZero(message = "defaultCommissionWeight must not be negative")
    private BigDecimal defaultCommissionWeight = new BigDecimal("2.0");
    @Valid
    private List<Category> categories = new ArrayList<>();

    @Valid
    private Persist persist = new Persist();
    @Valid
    private Niche niche = new Niche();
    @Valid
    private FanOut fanOut = new FanOut();
    @Valid
    private AutoPause autoPause = new AutoPause();

    public List<String> categoryIds() {
        List<String> ids = new ArrayList<>();
        for (Category c : categories) {
            ids.add(c.getId());
        }
        return ids;
    }

    @Data
    public static class Category {
        @NotBlank(message = "category id is required")
        private String id;
        private String name;
        @PositiveOrZero(message = "commissionWeight must not be negative")
        private BigDecimal commissionWeight;
    }

    /** 保存ティア */
    @Data
    public static class Persist {
        private BigDecimal minDiscount = new BigDecimal("15");
        private BigDecimal minPrice = new BigDecimal("15");
        private BigDecimal maxPrice = new BigDecimal("300");
        private BigDecimal minSavings = new BigDecimal("5.00");
        @PositiveOrZero(message = "minTitleLength must not be negative")
        private int minTitleLength = 10;
        private Double minRating = 3.5;
        private Integer minReviews = 10;
        private Integer maxPopularityRank = 100_000;
        private boolean requirePrime = false;
        private BigDecimal primeExemptWeight = new BigDecimal("8.0");
        private boolean requireFulfilledByPlatform = false;
    }

    /** 投稿ティア（ニッチモード） */
    @Data
    public static class Niche {
        private boolean enabled = true;
        private BigDecimal minDiscount = new BigDecimal("20");
        private BigDecimal minPrice = new BigDecimal("20");
        private BigDecimal maxPrice = new BigDecimal("200");
        private Double minRating = 4.0;
        private Integer minReviews = 50;
        /** これ未満はサンプル・トライアルサイズとみなす */
        private BigDecimal sampleSizePriceFloor = new BigDecimal("15");

        private List<String> categoryKeywords = new ArrayList<>(List.of(
                "beauty", "cosmetics", "makeup", "skincare", "skin care",
                "hair care", "haircare", "nail", "fragrance", "perfume",
                "personal care", "luxury beauty", "premium beauty"));
        private List<String> titleKeywords = new ArrayList<>(List.of(
                "lipstick", "foundation", "concealer", "mascara", "eyeshadow",
                "blush", "bronzer", "primer", "setting spray", "powder",
                "eyeliner", "brow", "eyebrow", "highlighter", "contour",
                "serum", "moisturizer", "cleanser", "toner", "cream",
                "lotion", "oil", "mask", "exfoliant", "sunscreen",
                "shampoo", "conditioner", "hair mask", "styling",
                "nail polish", "nail care", "cuticle", "manicure",
                "perfume", "cologne", "body spray", "body mist",
                "makeup brush", "beauty sponge", "applicator"));
        private List<String> brands = new ArrayList<>(List.of(
                "maybelline", "loreal", "revlon", "covergirl", "neutrogena",
                "olay", "clinique", "estee lauder", "mac", "sephora",
                "ulta", "nyx", "urban decay", "too faced", "benefit",
                "fenty beauty", "rare beauty", "glossier", "drunk elephant",
                "the ordinary", "cerave", "la roche posay", "vichy"));
    }

    /** カテゴリ並列取得 */
    @Data
    public static class FanOut {
        private boolean enabled = true;
        @Min(value = 1, message = "topCategories must be at least 1")
        private int topCategories = 5;
        @Min(value = 1, message = "workers must be at least 1")
        private int workers = 3;
        @Min(value = 1, message = "productsPerCategory must be at least 1")
        private int productsPerCategory = 20;
        @NotNull(message = "interRequestPause is required")
        private Duration interRequestPause = Duration.ofMillis(100);
        private boolean enrichProducts = true;
    }

    /** 直近サイクルの投稿エラーが閾値に達したら停止 */
    @Data
    public static class AutoPause {
        @Min(value = 1, message = "windowCycles must be at least 1")
        private int windowCycles = 5;
        @Min(value = 1, message = "publishErrors must be at least 1")
        private int publishErrors = 5;
    }
}
