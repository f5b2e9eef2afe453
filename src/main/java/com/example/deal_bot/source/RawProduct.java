package com.example.deal_bot.source;

import java.math.BigDecimal;

import lombok.Builder;

/**
 * 商品詳細（getProduct の結果）。未検証、全フィールド null 許容。
 */
@Builder
public record RawProduct(
        String productId,
        String title,
        BigDecimal currentPrice,
        BigDecimal referencePrice,
        String categoryName,
        String brand,
        Integer popularityRank,
        Double rating,
        Integer reviewCount,
        Boolean primeEligible,
        Boolean fulfilledByPlatform,
        String imageUrl) {
}
