package com.example.deal_bot.entity;

import java.time.Instant;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 1サイクル1行の実行統計
 */
@Entity
@Table(name = "cycle_metrics", indexes = {
        @Index(name = "idx_cycle_metrics_started", columnList = "started_at")
})
@Getter
@Setter
@NoArgsConstructor
public class CycleMetrics {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "cycle_id", nullable = false, length = 64)
    private String cycleId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "final_state", nullable = false, length = 20)
    private String finalState;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    private int fetched;
    private int invalid;
    private int persisted;

    @Column(name = "filtered_out")
    private int filteredOut;

    @Column(name = "publish_candidates")
    private int publishCandidates;

    private int published;
    private int errors;

    @Column(name = "publish_errors")
    private int publishErrors;

    @Column(name = "upstream_calls")
    private long upstreamCalls;

    @Column(name = "categories_checked")
    private int categoriesChecked;

    @Column(name = "categories_failed")
    private int categoriesFailed;

    @Column(name = "elapsed_millis")
    private long elapsedMillis;
}
