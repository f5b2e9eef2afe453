package com.example.deal_bot.source;

import java.math.BigDecimal;

import com.example.deal_bot.pipeline.PipelineProperties;

/**
 * 値下がり検索条件。categoryId が null なら全カテゴリ対象。
 * maxPopularityRank / minRating が null の場合はその条件を付けない。
 */
public record DealQuery(
        String categoryId,
        int minDiscountPercent,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        Integer maxPopularityRank,
        Double minRating,
        int page) {

    /** 保存ティアの閾値をそのまま上流の絞り込みに使う */
    public static DealQuery primary(PipelineProperties props, String categoryId) {
        PipelineProperties.Persist p = props.getPersist();
        return new DealQuery(
                categoryId,
                p.getMinDiscount().intValue(),
                p.getMinPrice(),
                p.getMaxPrice(),
                p.getMaxPopularityRank(),
                p.getMinRating(),
                0);
    }

    /** 割引下限のみ緩め、ランク・評価の条件を外した再検索用 */
    public static DealQuery fallback(PipelineProperties props, String categoryId) {
        PipelineProperties.Persist p = props.getPersist();
        return new DealQuery(
                categoryId,
                props.getFallbackMinDiscount(),
                p.getMinPrice(),
                p.getMaxPrice(),
                null,
                null,
                0);
    }
}
