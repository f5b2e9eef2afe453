package com.example.deal_bot.deal;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.example.deal_bot.pipeline.PipelineProperties;

/**
 * 2段階フィルタ。
 * 保存ティア: 記録する価値があるか（一般品質条件）。
 * 投稿ティア: ニッチモード時のみ、ニッチ一致＋より厳しい条件。
 * 評価・レビュー数・ランク等が欠けている場合はそれだけでは除外しない。
 */
@Component
public class FilterChain {

    // ===== 禁止ワード =====
    private static final Set<String> RESTRICTED_KEYWORDS = Set.of(
            "adult", "sexual", "intimate", "lingerie", "erotic",
            "tobacco", "alcohol", "weapon", "drug");

    private final PipelineProperties.Persist persist;
    private final PipelineProperties.Niche niche;
    private final NicheClassifier nicheClassifier;
    private final CommissionWeights weights;

    public FilterChain(PipelineProperties props, NicheClassifier nicheClassifier, CommissionWeights weights) {
        this.persist = props.getPersist();
        this.niche = props.getNiche();
        this.nicheClassifier = nicheClassifier;
        this.weights = weights;
    }

    public boolean passesPersistTier(Candidate c) {
        return persistRejection(c).isEmpty();
    }

    /** 最初に引っかかった保存ティアの理由。通過なら empty */
    public Optional<String> persistRejection(Candidate c) {
        BigDecimal discount = c.discountPercent();
        BigDecimal price = c.currentPrice();

        if (discount.compareTo(persist.getMinDiscount()) < 0) {
            return Optional.of("DISCOUNT_TOO_LOW(" + discount + "%)");
        }
        if (price.compareTo(persist.getMinPrice()) < 0 || price.compareTo(persist.getMaxPrice()) > 0) {
            return Optional.of("PRICE_OUT_OF_RANGE(" + price + ")");
        }
        if (c.savings().compareTo(persist.getMinSavings()) < 0) {
            return Optional.of("SAVINGS_TOO_LOW(" + c.savings() + ")");
        }
        String title = c.title() == null ? "" : c.title().trim();
        if (title.length() < persist.getMinTitleLength()) {
            return Optional.of("TITLE_TOO_SHORT");
        }
        String restricted = restrictedKeyword(title);
        if (restricted != null) {
            return Optional.of("RESTRICTED_KEYWORD(" + restricted + ")");
        }
        if (c.rating() != null && persist.getMinRating() != null && c.rating() < persist.getMinRating()) {
            return Optional.of("RATING_TOO_LOW(" + c.rating() + ")");
        }
        if (c.reviewCount() != null && persist.getMinReviews() != null && c.reviewCount() < persist.getMinReviews()) {
            return Optional.of("TOO_FEW_REVIEWS(" + c.reviewCount() + ")");
        }
        if (c.popularityRank() != null && persist.getMaxPopularityRank() != null
                && c.popularityRank() > persist.getMaxPopularityRank()) {
            return Optional.of("RANK_TOO_LOW(" + c.popularityRank() + ")");
        }
        if (persist.isRequirePrime() && Boolean.FALSE.equals(c.primeEligible())
                && weights.weightOf(c.categoryId()).compareTo(persist.getPrimeExemptWeight()) < 0) {
            return Optional.of("NOT_PRIME");
        }
        if (persist.isRequireFulfilledByPlatform() && Boolean.FALSE.equals(c.fulfilledByPlatform())) {
            return Optional.of("NOT_FULFILLED_BY_PLATFORM");
        }
        return Optional.empty();
    }

    public boolean passesPublishTier(Candidate c, boolean nicheMode) {
        return publishRejection(c, nicheMode).isEmpty();
    }

    public Optional<String> publishRejection(Candidate c, boolean nicheMode) {
        if (!nicheMode) {
            return Optional.empty();
        }
        if (!nicheClassifier.matches(c)) {
            return Optional.of("NOT_NICHE");
        }
        BigDecimal price = c.currentPrice();
        if (price.compareTo(niche.getSampleSizePriceFloor()) < 0) {
            return Optional.of("SAMPLE_SIZE_PRICE(" + price + ")");
        }
        if (c.discountPercent().compareTo(niche.getMinDiscount()) < 0) {
            return Optional.of("NICHE_DISCOUNT_TOO_LOW(" + c.discountPercent() + "%)");
        }
        if (price.compareTo(niche.getMinPrice()) < 0 || price.compareTo(niche.getMaxPrice()) > 0) {
            return Optional.of("NICHE_PRICE_OUT_OF_RANGE(" + price + ")");
        }
        if (c.rating() != null && niche.getMinRating() != null && c.rating() < niche.getMinRating()) {
            return Optional.of("NICHE_RATING_TOO_LOW(" + c.rating() + ")");
        }
        if (c.reviewCount() != null && niche.getMinReviews() != null && c.reviewCount() < niche.getMinReviews()) {
            return Optional.of("NICHE_TOO_FEW_REVIEWS(" + c.reviewCount() + ")");
        }
        return Optional.empty();
    }

    static String restrictedKeyword(String title) {
        String lower = title.toLowerCase(Locale.ROOT);
        return RESTRICTED_KEYWORDS.stream().filter(lower::contains).findFirst().orElse(null);
    }
}
