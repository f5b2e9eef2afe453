package com.example.deal_bot.deal;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.example.deal_bot.pipeline.PipelineProperties;

/**
 * カテゴリ別の手数料重み。ランキングとカテゴリ選択にのみ使い、合否判定には使わない。
 */
@Component
public class CommissionWeights {

    private final Map<String, BigDecimal> weights = new HashMap<>();
    private final BigDecimal defaultWeight;

    public CommissionWeights(PipelineProperties props) {
        this.defaultWeight = props.getDefaultCommissionWeight() != null
                ? props.getDefaultCommissionWeight()
                : new BigDecimal("2.0");
        for (PipelineProperties.Category c : props.getCategories()) {
            if (c.getId() != null && c.getCommissionWeight() != null) {
                weights.put(c.getId(), c.getCommissionWeight());
            }
        }
    }

    public BigDecimal weightOf(String categoryId) {
        if (categoryId == null) {
            return defaultWeight;
        }
        return weights.getOrDefault(categoryId, defaultWeight);
    }

    /** 重み降順。同じ重みは入力順を保つ */
    public List<String> sortByWeight(List<String> categoryIds) {
        List<String> sorted = new ArrayList<>(categoryIds);
        sorted.sort(Comparator.comparing(this::weightOf).reversed());
        return sorted;
    }
}
