package com.example.deal_bot.deal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

import lombok.Builder;

/**
 * 検出された値下がり商品（検証済み）。
 * 割引率は保持せず、常に現在価格と基準価格から計算する。
 */
@Builder(toBuilder = true)
public record Candidate(
        String productId,
        String title,
        BigDecimal currentPrice,
        BigDecimal referencePrice,
        String categoryId,
        String categoryName,
        String brand,
        Integer popularityRank,
        Double rating,
        Integer reviewCount,
        Boolean primeEligible,
        Boolean fulfilledByPlatform,
        String imageUrl,
        String productUrl,
        Instant detectedAt) {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal ZERO_PERCENT = BigDecimal.ZERO.setScale(2);

    public BigDecimal discountPercent() {
        return discountPercentOf(currentPrice, referencePrice);
    }

    /** reference - current（0未満は0）。基準価格が無ければ0 */
    public BigDecimal savings() {
        if (referencePrice == null || currentPrice == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal s = referencePrice.subtract(currentPrice);
        return s.signum() < 0 ? BigDecimal.ZERO : s;
    }

    /**
     * (reference - current) / reference * 100 を小数2桁(HALF_UP)で返す。
     * 基準価格が無い・0以下なら0、値上がりも0。
     */
    public static BigDecimal discountPercentOf(BigDecimal current, BigDecimal reference) {
        if (current == null || reference == null || reference.signum() <= 0) {
            return ZERO_PERCENT;
        }
        BigDecimal pct = reference.subtract(current)
                .multiply(HUNDRED)
                .divide(reference, 2, RoundingMode.HALF_UP);
        return pct.signum() < 0 ? ZERO_PERCENT : pct;
    }
}
