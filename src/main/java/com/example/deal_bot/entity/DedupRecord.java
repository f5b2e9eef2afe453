package com.example.deal_bot.entity;

import java.time.Instant;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 商品ごとの最終検出/最終投稿時刻。削除せず、クールダウンは時刻から判定する。
 */
@Entity
@Table(name = "dedup_records")
@Getter
@Setter
@NoArgsConstructor
public class DedupRecord {

    @Id
    @Column(name = "product_id", length = 20)
    private String productId;

    @Column(name = "last_detected_at")
    private Instant lastDetectedAt;

    @Column(name = "last_published_at")
    private Instant lastPublishedAt;

    @Column(name = "published_post_id", length = 64)
    private String publishedPostId;

    public DedupRecord(String productId) {
        this.productId = productId;
    }
}
