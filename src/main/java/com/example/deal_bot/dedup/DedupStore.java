package com.example.deal_bot.dedup;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.example.deal_bot.deal.StoreUnavailableException;
import com.example.deal_bot.entity.DedupRecord;
import com.example.deal_bot.pipeline.PipelineProperties;
import com.example.deal_bot.repo.DedupRecordRepository;

/**
 * 商品IDごとの検出・投稿クールダウン。
 * 2つのクールダウンは独立した期間を持つ。メモリにキャッシュし、書き込みはリポジトリへ即時反映する。
 * キャッシュは最近参照した cacheSize 件まで。溢れた分は次回参照時にリポジトリから読み直す。
 */
@Service
public class DedupStore {

    private static final Logger log = LoggerFactory.getLogger(DedupStore.class);

    private final DedupRecordRepository repo;
    private final Duration detectCooldown;
    private final Duration publishCooldown;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Entry> cache;

    @Autowired
    public DedupStore(DedupRecordRepository repo, PipelineProperties props) {
        this(repo, props.getDetectCooldown(), props.getPublishCooldown(), props.getDedupCacheSize());
    }

    public DedupStore(DedupRecordRepository repo, Duration detectCooldown, Duration publishCooldown,
            int cacheSize) {
        this.repo = repo;
        this.detectCooldown = detectCooldown;
        this.publishCooldown = publishCooldown;
        this.cache = new LinkedHashMap<String, DedupStore.Entry>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, DedupStore.Entry> eldest) {
                return size() > cacheSize;
            }
        };
    }

    public boolean isInDetectCooldown(String productId, Instant now) {
        lock.lock();
        try {
            return within(load(productId).lastDetectedAt, detectCooldown, now);
        } finally {
            lock.unlock();
        }
    }

    public boolean isInPublishCooldown(String productId, Instant now) {
        lock.lock();
        try {
            return within(load(productId).lastPublishedAt, publishCooldown, now);
        } finally {
            lock.unlock();
        }
    }

    public void recordDetected(String productId, Instant now) {
        lock.lock();
        try {
            Entry e = load(productId);
            Entry next = new Entry(now, e.lastPublishedAt, e.postId);
            write(productId, next);
        } finally {
            lock.unlock();
        }
    }

    public void recordPublished(String productId, Instant now, String postId) {
        lock.lock();
        try {
            Entry e = load(productId);
            Entry next = new Entry(e.lastDetectedAt, now, postId);
            write(productId, next);
        } finally {
            lock.unlock();
        }
    }

    private static boolean within(Instant at, Duration cooldown, Instant now) {
        return at != null && now.isBefore(at.plus(cooldown));
    }

    // ===== 以下は lock 保持中に呼ぶ =====

    private Entry load(String productId) {
        Entry cached = cache.get(productId);
        if (cached != null) {
            return cached;
        }
        Entry loaded;
        try {
            loaded = repo.findById(productId)
                    .map(r -> new Entry(r.getLastDetectedAt(), r.getLastPublishedAt(), r.getPublishedPostId()))
                    .orElse(Entry.NONE);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("dedup lookup failed for " + productId, e);
        }
        cache.put(productId, loaded);
        return loaded;
    }

    private void write(String productId, Entry next) {
        try {
            DedupRecord r = repo.findById(productId).orElseGet(() -> new DedupRecord(productId));
            r.setLastDetectedAt(next.lastDetectedAt);
            r.setLastPublishedAt(next.lastPublishedAt);
            r.setPublishedPostId(next.postId);
            repo.save(r);
        } catch (DataAccessException e) {
            // 書き込めなかった状態はキャッシュにも載せない
            cache.remove(productId);
            throw new StoreUnavailableException("dedup write failed for " + productId, e);
        }
        cache.put(productId, next);
        log.debug("dedup {} detected={} published={}", productId, next.lastDetectedAt, next.lastPublishedAt);
    }

    private record Entry(Instant lastDetectedAt, Instant lastPublishedAt, String postId) {
        static final Entry NONE = new Entry(null, null, null);
    }
}
