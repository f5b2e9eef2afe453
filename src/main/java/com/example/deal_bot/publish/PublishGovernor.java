package com.example.deal_bot.publish;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 外部投稿レートの制御。
 * 1時間（時計の時）あたりの上限と、前回投稿からの最小間隔の両方を満たすときだけ投稿可。
 */
@Component
public class PublishGovernor {

    private static final Logger log = LoggerFactory.getLogger(PublishGovernor.class);

    private final int maxPerHour;
    private final Duration minInterval;

    // ===== PublishBudgetState (guarded by lock) =====
    private final ReentrantLock lock = new ReentrantLock();
    private Instant hourStart;
    private int countThisHour;
    private Instant lastPublishedAt;

    @Autowired
    public PublishGovernor(TwitterProperties props) {
        this(props.getMaxPostsPerHour(), props.getMinPostInterval());
    }

    public PublishGovernor(int maxPerHour, Duration minInterval) {
        this.maxPerHour = maxPerHour;
        this.minInterval = minInterval;
    }

    public boolean canPublish(Instant now) {
        lock.lock();
        try {
            rollHour(now);
            return allowed(now);
        } finally {
            lock.unlock();
        }
    }

    /** 投稿成功後に呼ぶ。最終投稿時刻は後退しない */
    public void recordPublish(Instant now) {
        lock.lock();
        try {
            rollHour(now);
            countThisHour++;
            if (lastPublishedAt == null || now.isAfter(lastPublishedAt)) {
                lastPublishedAt = now;
            }
        } finally {
            lock.unlock();
        }
    }

    /** 日次リセット等。時間内カウントだけを消し、最小間隔の基準は残す */
    public void resetPeriod(Instant now) {
        lock.lock();
        try {
            log.info("Publish budget reset (count was {})", countThisHour);
            hourStart = now.truncatedTo(ChronoUnit.HOURS);
            countThisHour = 0;
        } finally {
            lock.unlock();
        }
    }

    public Snapshot snapshot(Instant now) {
        lock.lock();
        try {
            rollHour(now);
            return new Snapshot(countThisHour, Math.max(0, maxPerHour - countThisHour), lastPublishedAt);
        } finally {
            lock.unlock();
        }
    }

    private boolean allowed(Instant now) {
        if (countThisHour >= maxPerHour) {
            return false;
        }
        return lastPublishedAt == null || !now.isBefore(lastPublishedAt.plus(minInterval));
    }

    private void rollHour(Instant now) {
        Instant current = now.truncatedTo(ChronoUnit.HOURS);
        if (hourStart == null || current.isAfter(hourStart)) {
            hourStart = current;
            countThisHour = 0;
        }
    }

    public record Snapshot(int publishedThisHour, int remainingThisHour, Instant lastPublishedAt) {
    }
}
