package com.example.deal_bot.entity;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 保存ティアを通過した値下がり商品
 */
@Entity
@Table(name = "deals", indexes = {
        @Index(name = "idx_deals_product_detected", columnList = "product_id, detected_at")
})
@Getter
@Setter
@NoArgsConstructor
public class DealRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "deal_id")
    private Long id;

    @Column(name = "product_id", nullable = false, length = 20)
    private String productId;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "current_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal currentPrice;

    @Column(name = "reference_price", precision = 12, scale = 2)
    private BigDecimal referencePrice;

    @Column(name = "discount_percent", nullable = false, precision = 5, scale = 2)
    private BigDecimal discountPercent;

    @Column(name = "savings_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal savingsAmount;

    @Column(name = "category_id", length = 32)
    private String categoryId;

    @Column(name = "category_name", length = 200)
    private String categoryName;

    @Column(name = "brand", length = 200)
    private String brand;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @Column(name = "product_url", length = 500)
    private String productUrl;

    @Column(name = "affiliate_url", length = 500)
    private String affiliateUrl;

    @Column(name = "posted", nullable = false)
    private boolean posted;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "post_id", length = 64)
    private String postId;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        if (detectedAt == null) detectedAt = createdAt;
    }
}
