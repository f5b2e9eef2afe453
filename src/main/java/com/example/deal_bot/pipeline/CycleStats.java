package com.example.deal_bot.pipeline;

import java.time.Duration;
import java.time.Instant;

import lombok.Builder;

/**
 * 1サイクルの結果。FAILED でも途中までの件数を持つ。
 */
@Builder
public record CycleStats(
        String cycleId,
        Instant startedAt,
        Instant finishedAt,
        CycleState finalState,
        String failureReason,
        boolean skipped,
        int fetched,
        int invalid,
        int persisted,
        int filteredOut,
        int publishCandidates,
        int considered,
        int published,
        int errors,
        int publishErrors,
        long upstreamCalls,
        int categoriesChecked,
        int categoriesFailed,
        Duration elapsed) {

    /** 前のサイクルが実行中で、今回は何もしなかった */
    public static CycleStats skipped(Instant now) {
        return CycleStats.builder()
                .startedAt(now)
                .finishedAt(now)
                .skipped(true)
                .failureReason("CYCLE_IN_PROGRESS")
                .elapsed(Duration.ZERO)
                .build();
    }

    public boolean failed() {
        return finalState == CycleState.FAILED;
    }
}
