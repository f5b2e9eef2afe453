package com.example.deal_bot.source;

import java.math.BigDecimal;

import lombok.Builder;

/**
 * 価格データソースから返る未検証の値下がりイベント。全フィールド null 許容。
 */
@Builder(toBuilder = true)
public record RawDeal(
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
        String imageUrl) {

    /**
     * 商品詳細で欠けている項目を補完する。既に値がある項目は上書きしない。
     */
    public RawDeal withDetails(RawProduct p) {
        if (p == null) {
            return this;
        }
        return toBuilder()
                .title(firstNonBlank(title, p.title()))
                .currentPrice(currentPrice != null ? currentPrice : p.currentPrice())
                .referencePrice(referencePrice != null ? referencePrice : p.referencePrice())
                .categoryName(firstNonBlank(categoryName, p.categoryName()))
                .brand(firstNonBlank(brand, p.brand()))
                .popularityRank(popularityRank != null ? popularityRank : p.popularityRank())
                .rating(rating != null ? rating : p.rating())
                .reviewCount(reviewCount != null ? reviewCount : p.reviewCount())
                .primeEligible(primeEligible != null ? primeEligible : p.primeEligible())
                .fulfilledByPlatform(fulfilledByPlatform != null ? fulfilledByPlatform : p.fulfilledByPlatform())
                .imageUrl(firstNonBlank(imageUrl, p.imageUrl()))
                .build();
    }

    public RawDeal withCategoryId(String id) {
        return toBuilder().categoryId(id).build();
    }

    private static String firstNonBlank(String a, String b) {
        return (a != null && !a.isBlank()) ? a : b;
    }
}
