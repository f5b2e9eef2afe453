package com.example.deal_bot.deal;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

/**
 * 投稿候補の順位付け。
 * スコア降順 → 割引率降順 → 検出時刻昇順 → 商品ID昇順 の全順序。
 */
@Component
public class CandidateRanker {

    static final Comparator<ScoredCandidate> ORDER = Comparator
            .comparing(ScoredCandidate::score, Comparator.reverseOrder())
            .thenComparing((ScoredCandidate s) -> s.candidate().discountPercent(), Comparator.reverseOrder())
            .thenComparing((ScoredCandidate s) -> s.candidate().detectedAt(),
                    Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing((ScoredCandidate s) -> s.candidate().productId(),
                    Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final CommissionWeights weights;

    public CandidateRanker(CommissionWeights weights) {
        this.weights = weights;
    }

    public List<ScoredCandidate> rank(List<Candidate> candidates) {
        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            scored.add(score(c));
        }
        scored.sort(ORDER);
        return scored;
    }

    /** 上位 batchSize 件のみ。残りは今サイクルの対象外 */
    public List<ScoredCandidate> top(List<Candidate> candidates, int batchSize) {
        List<ScoredCandidate> ranked = rank(candidates);
        if (ranked.size() <= batchSize) {
            return ranked;
        }
        return new ArrayList<>(ranked.subList(0, Math.max(0, batchSize)));
    }

    public ScoredCandidate score(Candidate c) {
        BigDecimal weight = weights.weightOf(c.categoryId());
        return new ScoredCandidate(c, weight, weight.multiply(c.discountPercent()));
    }
}
