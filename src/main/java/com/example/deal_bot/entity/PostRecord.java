package com.example.deal_bot.entity;

import java.time.Instant;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "posts")
@Getter
@Setter
@NoArgsConstructor
public class PostRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "post_id", nullable = false, length = 64)
    private String postId;

    @Column(name = "deal_id", nullable = false)
    private Long dealId;

    @Column(name = "product_id", nullable = false, length = 20)
    private String productId;

    @Column(name = "content", nullable = false, length = 1000)
    private String content;

    @Column(name = "posted_at", nullable = false)
    private Instant postedAt;
}
