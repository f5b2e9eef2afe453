package com.example.deal_bot.publish;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

class PublishGovernorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void firstPublish_isAllowed() {
        PublishGovernor governor = new PublishGovernor(20, Duration.ofSeconds(300));

        assertThat(governor.canPublish(T0)).isTrue();
    }

    @Test
    void minInterval_blocksUntilElapsed() {
        PublishGovernor governor = new PublishGovernor(20, Duration.ofSeconds(300));
        governor.recordPublish(T0);

        assertThat(governor.canPublish(T0.plusSeconds(299))).isFalse();
        assertThat(governor.canPublish(T0.plusSeconds(300))).isTrue();
    }

    @Test
    void hourlyCap_blocksAndRollsOverAtNextClockHour() {
        PublishGovernor governor = new PublishGovernor(3, Duration.ZERO);
        Instant at = T0.plus(Duration.ofMinutes(50));
        for (int i = 0; i < 3; i++) {
            assertThat(governor.canPublish(at.plusSeconds(i))).isTrue();
            governor.recordPublish(at.plusSeconds(i));
        }

        assertThat(governor.canPublish(at.plusSeconds(10))).isFalse();
        assertThat(governor.snapshot(at.plusSeconds(10)).remainingThisHour()).isZero();
        // 11:00 に新しい時間枠
        assertThat(governor.canPublish(T0.plus(Duration.ofHours(1)))).isTrue();
        assertThat(governor.snapshot(T0.plus(Duration.ofHours(1))).publishedThisHour()).isZero();
    }

    @Test
    void resetPeriod_clearsCountButKeepsSpacing() {
        PublishGovernor governor = new PublishGovernor(20, Duration.ofSeconds(300));
        Instant lastPost = Instant.parse("2024-05-01T23:59:00Z");
        Instant midnight = Instant.parse("2024-05-02T00:00:00Z");
        governor.recordPublish(lastPost);

        governor.resetPeriod(midnight);

        assertThat(governor.snapshot(midnight).publishedThisHour()).isZero();
        assertThat(governor.snapshot(midnight).lastPublishedAt()).isEqualTo(lastPost);
        // 23:59:00 から 61秒しか経っていない
        assertThat(governor.canPublish(midnight.plusSeconds(1))).isFalse();
        assertThat(governor.canPublish(lastPost.plusSeconds(300))).isTrue();
    }

    @Test
    void resetPeriod_reopensExhaustedHour() {
        PublishGovernor governor = new PublishGovernor(1, Duration.ofSeconds(60));
        governor.recordPublish(T0);
        assertThat(governor.canPublish(T0.plusSeconds(120))).isFalse();

        governor.resetPeriod(T0.plusSeconds(120));

        assertThat(governor.canPublish(T0.plusSeconds(121))).isTrue();
    }

    @Test
    void simulatedTimeline_neverExceedsCapOrSpacing() {
        int cap = 20;
        Duration minInterval = Duration.ofSeconds(120);
        PublishGovernor governor = new PublishGovernor(cap, minInterval);
        List<Instant> published = new ArrayList<>();

        // 6時間分、37秒刻みで投稿を試みる
        for (Instant t = T0; t.isBefore(T0.plus(Duration.ofHours(6))); t = t.plusSeconds(37)) {
            if (governor.canPublish(t)) {
                governor.recordPublish(t);
                published.add(t);
            }
        }

        assertThat(published).isNotEmpty();
        for (int i = 1; i < published.size(); i++) {
            assertThat(Duration.between(published.get(i - 1), published.get(i)))
                    .isGreaterThanOrEqualTo(minInterval);
        }
        published.stream()
                .collect(Collectors.groupingBy(t -> t.truncatedTo(ChronoUnit.HOURS),
                        Collectors.counting()))
                .values()
                .forEach(n -> assertThat(n).isLessThanOrEqualTo(cap));
    }

    @Test
    void concurrentRecordAndRead_countsEveryPublish() throws Exception {
        PublishGovernor governor = new PublishGovernor(100, Duration.ofSeconds(1));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> results = new ArrayList<>();
        // 投稿記録と health/ops からの参照が同時に走る
        for (int i = 0; i < 40; i++) {
            Instant at = T0.plusSeconds(i);
            results.add(pool.submit(() -> {
                start.await();
                governor.canPublish(at);
                governor.recordPublish(at);
                return governor.snapshot(at);
            }));
        }
        start.countDown();
        for (Future<?> f : results) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        PublishGovernor.Snapshot snap = governor.snapshot(T0.plusSeconds(40));
        assertThat(snap.publishedThisHour()).isEqualTo(40);
        assertThat(snap.lastPublishedAt()).isEqualTo(T0.plusSeconds(39));
        assertThat(governor.canPublish(T0.plusSeconds(39))).isFalse();
        assertThat(governor.canPublish(T0.plusSeconds(40))).isTrue();
    }
}
