package com.example.deal_bot.deal;

import java.time.Instant;
import java.util.Optional;

import com.example.deal_bot.entity.DealRecord;
import com.example.deal_bot.pipeline.CycleStats;

/**
 * 商品・投稿・サイクル統計の永続化。
 * 接続できない場合は StoreUnavailableException を投げる。
 */
public interface DealStore {

    /** @return 保存した deal の ID */
    Long saveCandidate(Candidate candidate);

    Optional<DealRecord> findRecent(String productId, Instant since);

    void markPublished(Long dealId, String postId, String content, Instant at);

    void recordMetrics(CycleStats stats);
}
