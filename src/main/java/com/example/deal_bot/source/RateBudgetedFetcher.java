package com.example.deal_bot.source;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 上流APIのトークン予算を守るラッパー。
 * 60秒窓あたり (tokensPerMinute - buffer) 回まで、かつ最小間隔を空けて呼び出す。
 * 台帳は全ワーカーで共有し、待機は呼び出したスレッドだけがブロックする。
 */
@Component
public class RateBudgetedFetcher {

    private static final Logger log = LoggerFactory.getLogger(RateBudgetedFetcher.class);

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final PriceDataSource source;
    private final Clock clock;
    private final Sleeper sleeper;
    private final int windowCap;
    private final Duration minSpacing;

    // ===== RateLedger (guarded by lock) =====
    private final ReentrantLock lock = new ReentrantLock();
    private Instant windowStart;
    private int callsInWindow;
    private Instant lastCallAt;

    private final AtomicLong callsIssued = new AtomicLong();

    @Autowired
    public RateBudgetedFetcher(PriceDataSource source, KeepaProperties props, Clock clock, Sleeper sleeper) {
        this(source, props.getTokensPerMinute(), props.getTokenBuffer(), props.getMinRequestInterval(),
                clock, sleeper);
    }

    public RateBudgetedFetcher(PriceDataSource source, int tokensPerMinute, int buffer, Duration minSpacing,
            Clock clock, Sleeper sleeper) {
        this.source = source;
        this.windowCap = Math.max(1, tokensPerMinute - buffer);
        this.minSpacing = minSpacing == null ? Duration.ZERO : minSpacing;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public List<RawDeal> listPriceDrops(DealQuery query) {
        acquire();
        List<RawDeal> deals = source.listPriceDrops(query);
        return deals == null ? List.of() : deals;
    }

    public Optional<RawProduct> getProduct(String productId) {
        acquire();
        Optional<RawProduct> product = source.getProduct(productId);
        return product == null ? Optional.empty() : product;
    }

    /** 残トークン照会は予算を消費しない */
    public int remainingQuota() {
        return source.remainingQuota();
    }

    public long callsIssued() {
        return callsIssued.get();
    }

    /**
     * 台帳上で実行スロットを予約し、スロット時刻まで待つ。
     * 予約はデータの有無に関わらず1回としてカウントする。
     */
    void acquire() {
        Instant now;
        Instant slot;
        boolean windowFull = false;

        lock.lock();
        try {
            now = clock.instant();
            if (windowStart == null || !now.isBefore(windowStart.plus(WINDOW))) {
                windowStart = now;
                callsInWindow = 0;
            }

            slot = now;
            if (callsInWindow >= windowCap) {
                slot = windowStart.plus(WINDOW);
                windowStart = slot;
                callsInWindow = 0;
                windowFull = true;
            }

            if (lastCallAt != null) {
                Instant earliest = lastCallAt.plus(minSpacing);
                if (slot.isBefore(earliest)) {
                    slot = earliest;
                }
            }
            // 間隔調整で窓をまたいだ場合は新しい窓として数える
            if (!slot.isBefore(windowStart.plus(WINDOW))) {
                windowStart = slot;
                callsInWindow = 0;
            }

            lastCallAt = slot;
            callsInWindow++;
        } finally {
            lock.unlock();
        }
        callsIssued.incrementAndGet();

        Duration wait = Duration.between(now, slot);
        if (windowFull) {
            log.info("Rate budget reached ({} calls/window), waiting {} ms for next window",
                    windowCap, wait.toMillis());
        }
        if (wait.isNegative() || wait.isZero()) {
            return;
        }
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Interrupted while waiting for rate budget", e);
        }
    }
}
