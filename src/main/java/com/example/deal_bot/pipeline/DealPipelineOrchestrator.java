package com.example.deal_bot.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.deal_bot.dedup.DedupStore;
import com.example.deal_bot.deal.Candidate;
import com.example.deal_bot.deal.CandidateParser;
import com.example.deal_bot.deal.CandidateRanker;
import com.example.deal_bot.deal.DealStore;
import com.example.deal_bot.deal.FilterChain;
import com.example.deal_bot.deal.NicheClassifier;
import com.example.deal_bot.deal.ParseResult;
import com.example.deal_bot.deal.ScoredCandidate;
import com.example.deal_bot.deal.StoreUnavailableException;
import com.example.deal_bot.entity.DealRecord;
import com.example.deal_bot.ops.KillSwitchService;
import com.example.deal_bot.publish.PostComposer;
import com.example.deal_bot.publish.PublishException;
import com.example.deal_bot.publish.PublishGovernor;
import com.example.deal_bot.publish.Publisher;
import com.example.deal_bot.publish.TwitterProperties;
import com.example.deal_bot.service.StateTransitionService;
import com.example.deal_bot.source.DealSearchService;
import com.example.deal_bot.source.FanOutResult;
import com.example.deal_bot.source.RateBudgetedFetcher;
import com.example.deal_bot.source.RawDeal;
import com.example.deal_bot.source.UpstreamException;

/**
 * 1サイクル = 取得 → 保存フィルタ → 投稿フィルタ → 順位付け → 投稿。
 * どの段階で失敗しても例外は外に出さず、途中までの件数を FAILED として返す。
 * 同時に実行できるサイクルは1つだけ。
 * 保存済みで未投稿の候補は backlog に残し、検出クールダウンが切れるまで次サイクル以降の投稿対象にする。
 */
@Service
public class DealPipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DealPipelineOrchestrator.class);

    private final DealSearchService search;
    private final RateBudgetedFetcher fetcher;
    private final CandidateParser parser;
    private final FilterChain filters;
    private final NicheClassifier niche;
    private final CandidateRanker ranker;
    private final DedupStore dedup;
    private final DealStore store;
    private final PublishGovernor governor;
    private final Publisher publisher;
    private final PostComposer composer;
    private final KillSwitchService killSwitch;
    private final PipelineProperties props;
    private final TwitterProperties twitterProps;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<CycleStats> lastStats = new AtomicReference<>();
    private final Object idleMonitor = new Object();

    // running フラグを取ったスレッドだけが触る
    private final Map<String, Pending> backlog = new LinkedHashMap<>();

    public DealPipelineOrchestrator(
            DealSearchService search,
            RateBudgetedFetcher fetcher,
            CandidateParser parser,
            FilterChain filters,
            NicheClassifier niche,
            CandidateRanker ranker,
            DedupStore dedup,
            DealStore store,
            PublishGovernor governor,
            Publisher publisher,
            PostComposer composer,
            KillSwitchService killSwitch,
            PipelineProperties props,
            TwitterProperties twitterProps,
            Clock clock) {
        this.search = search;
        this.fetcher = fetcher;
        this.parser = parser;
        this.filters = filters;
        this.niche = niche;
        this.ranker = ranker;
        this.dedup = dedup;
        this.store = store;
        this.governor = governor;
        this.publisher = publisher;
        this.composer = composer;
        this.killSwitch = killSwitch;
        this.props = props;
        this.twitterProps = twitterProps;
        this.clock = clock;
    }

    public CycleStats runCycle() {
        Instant startedAt = clock.instant();
        if (!running.compareAndSet(false, true)) {
            log.warn("[DealCycle] previous cycle still running, skipped");
            return CycleStats.skipped(startedAt);
        }
        try {
            CycleStats stats = execute(startedAt);
            lastStats.set(stats);
            return stats;
        } finally {
            synchronized (idleMonitor) {
                running.set(false);
                idleMonitor.notifyAll();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<CycleStats> lastCycle() {
        return Optional.ofNullable(lastStats.get());
    }

    /**
     * 実行中のサイクルが終わるまで最大 timeout 待つ。
     *
     * @return アイドルになったら true
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (running.get()) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    return false;
                }
                idleMonitor.wait(remainingMs);
            }
        }
        return true;
    }

    private CycleStats execute(Instant startedAt) {
        String cycleId = StateTransitionService.newCorrelationId();
        long callsBefore = fetcher.callsIssued();
        Tally t = new Tally();
        CycleState state = CycleState.FETCHING;
        String failure = null;

        log.info("[DealCycle] start cycleId={}", cycleId);
        try {
            // ===== FETCHING =====
            FanOutResult fetched = search.fetch();
            t.fetched = fetched.deals().size();
            t.categoriesChecked = fetched.categoriesChecked();
            t.categoriesFailed = fetched.categoriesFailed();
            if (fetched.allFailed()) {
                throw new UpstreamException("all " + fetched.categoriesFailed() + " categories failed");
            }

            // ===== PERSIST_FILTERING =====
            state = CycleState.PERSIST_FILTERING;
            Set<String> persistedNow = persistStage(fetched.deals(), startedAt, t);

            // ===== PUBLISH_FILTERING =====
            state = CycleState.PUBLISH_FILTERING;
            boolean nicheMode = props.getNiche().isEnabled();
            List<Candidate> eligible = publishFilterStage(persistedNow, nicheMode, t);
            t.publishCandidates = eligible.size();

            // ===== RANKING =====
            state = CycleState.RANKING;
            List<ScoredCandidate> ranked = ranker.top(eligible, props.getBatchSize());
            t.considered = ranked.size();

            // ===== PUBLISHING =====
            state = CycleState.PUBLISHING;
            if (killSwitch.isPaused()) {
                log.info("[DealCycle] kill switch paused, publish stage skipped ({} ranked)", ranked.size());
            } else if (!twitterProps.isEnabled()) {
                log.info("[DealCycle] publisher disabled, publish stage skipped ({} ranked)", ranked.size());
            } else {
                publishStage(ranked, nicheMode, t);
            }

            state = CycleState.DONE;
        } catch (UpstreamException e) {
            failure = "UPSTREAM_UNAVAILABLE: " + e.getMessage();
            t.errors++;
            log.error("[DealCycle] failed in {}: {}", state, e.getMessage());
        } catch (StoreUnavailableException e) {
            failure = "STORE_UNAVAILABLE: " + e.getMessage();
            t.errors++;
            log.error("[DealCycle] failed in {}: {}", state, e.getMessage());
        } catch (RuntimeException e) {
            failure = "UNEXPECTED: " + e.getMessage();
            t.errors++;
            log.error("[DealCycle] unexpected failure in {}", state, e);
        }

        Instant finishedAt = clock.instant();
        CycleStats stats = CycleStats.builder()
                .cycleId(cycleId)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .finalState(failure == null ? CycleState.DONE : CycleState.FAILED)
                .failureReason(failure)
                .fetched(t.fetched)
                .invalid(t.invalid)
                .persisted(t.persisted)
                .filteredOut(t.filteredOut)
                .publishCandidates(t.publishCandidates)
                .considered(t.considered)
                .published(t.published)
                .errors(t.errors)
                .publishErrors(t.publishErrors)
                .upstreamCalls(fetcher.callsIssued() - callsBefore)
                .categoriesChecked(t.categoriesChecked)
                .categoriesFailed(t.categoriesFailed)
                .elapsed(Duration.between(startedAt, finishedAt))
                .build();

        try {
            store.recordMetrics(stats);
        } catch (RuntimeException e) {
            log.error("[DealCycle] failed to record metrics cycleId={}: {}", cycleId, e.getMessage());
        }

        log.info("[DealCycle] end cycleId={} state={} fetched={} persisted={} filtered={} candidates={} published={} errors={} calls={} elapsed={}ms",
                cycleId, stats.finalState(), stats.fetched(), stats.persisted(), stats.filteredOut(),
                stats.publishCandidates(), stats.published(), stats.errors(), stats.upstreamCalls(),
                stats.elapsed().toMillis());
        return stats;
    }

    /** @return このサイクルで保存した商品ID */
    private Set<String> persistStage(List<RawDeal> deals, Instant now, Tally t) {
        Set<String> persistedNow = new HashSet<>();
        for (RawDeal raw : deals) {
            ParseResult parsed = parser.parse(raw, now);
            if (!parsed.ok()) {
                t.invalid++;
                t.filteredOut++;
                log.debug("[DealCycle] invalid deal {}: {}", raw == null ? null : raw.productId(), parsed.errors());
                continue;
            }
            Candidate c = parsed.candidate();

            if (dedup.isInDetectCooldown(c.productId(), now)) {
                t.filteredOut++;
                continue;
            }
            Optional<String> rejection = filters.persistRejection(c);
            if (rejection.isPresent()) {
                t.filteredOut++;
                log.debug("[DealCycle] {} rejected: {}", c.productId(), rejection.get());
                continue;
            }

            Long dealId;
            try {
                dealId = store.saveCandidate(c);
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                t.errors++;
                log.warn("[DealCycle] save failed for {}: {}", c.productId(), e.getMessage());
                continue;
            }
            dedup.recordDetected(c.productId(), now);
            backlog.put(c.productId(), new Pending(c, dealId));
            persistedNow.add(c.productId());
            t.persisted++;
        }
        return persistedNow;
    }

    /**
     * 今回保存した候補と前サイクルからの持ち越し分に投稿ティアを適用する。
     * 投稿対象になり得ないものは backlog から外す。
     */
    private List<Candidate> publishFilterStage(Set<String> persistedNow, boolean nicheMode, Tally t) {
        Instant now = clock.instant();
        List<Candidate> eligible = new ArrayList<>();
        for (Pending p : new ArrayList<>(backlog.values())) {
            Candidate c = p.candidate();
            String productId = c.productId();

            if (!now.isBefore(c.detectedAt().plus(props.getDetectCooldown()))) {
                // 次に検出されたとき最新価格で保存し直される
                backlog.remove(productId);
                log.debug("[DealCycle] {} expired from backlog", productId);
                continue;
            }
            if (!persistedNow.contains(productId) && !stillUnposted(p, t)) {
                continue;
            }
            if (dedup.isInPublishCooldown(productId, now)) {
                backlog.remove(productId);
                log.debug("[DealCycle] {} in publish cooldown", productId);
                continue;
            }
            Optional<String> rejection = filters.publishRejection(c, nicheMode);
            if (rejection.isPresent()) {
                backlog.remove(productId);
                log.debug("[DealCycle] {} not publishable: {}", productId, rejection.get());
                continue;
            }
            eligible.add(c);
        }
        return eligible;
    }

    /** 持ち越し分の保存レコードが残っていて未投稿か。照会に失敗した分は今回だけ見送る */
    private boolean stillUnposted(Pending p, Tally t) {
        String productId = p.candidate().productId();
        Optional<DealRecord> row;
        try {
            row = store.findRecent(productId, p.candidate().detectedAt());
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            t.errors++;
            log.warn("[DealCycle] backlog lookup failed for {}: {}", productId, e.getMessage());
            return false;
        }
        if (row.isEmpty() || row.get().isPosted()) {
            backlog.remove(productId);
            log.debug("[DealCycle] {} dropped from backlog (row {})", productId,
                    row.isEmpty() ? "missing" : "already posted");
            return false;
        }
        return true;
    }

    private void publishStage(List<ScoredCandidate> ranked, boolean nicheMode, Tally t) {
        for (ScoredCandidate sc : ranked) {
            Candidate c = sc.candidate();
            Instant at = clock.instant();
            if (!governor.canPublish(at)) {
                log.info("[DealCycle] publish budget exhausted, {} published this cycle", t.published);
                break;
            }

            String text = composer.compose(c, nicheMode && niche.matches(c));
            String postId;
            try {
                postId = publisher.publish(text);
            } catch (PublishException e) {
                t.errors++;
                t.publishErrors++;
                log.warn("[DealCycle] publish failed for {} (retryable={}): {}",
                        c.productId(), e.isRetryable(), e.getMessage());
                if (!e.isRetryable()) {
                    backlog.remove(c.productId());
                }
                continue;
            }

            Long dealId = backlog.remove(c.productId()).dealId();
            governor.recordPublish(at);
            dedup.recordPublished(c.productId(), at, postId);
            t.published++;
            log.info("[DealCycle] published {} postId={} score={}", c.productId(), postId, sc.score());

            try {
                store.markPublished(dealId, postId, text, at);
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                t.errors++;
                log.error("[DealCycle] markPublished failed for {}: {}", c.productId(), e.getMessage());
            }
        }
    }

    private record Pending(Candidate candidate, Long dealId) {
    }

    /** サイクル内の集計用 */
    private static final class Tally {
        int fetched;
        int invalid;
        int persisted;
        int filteredOut;
        int publishCandidates;
        int considered;
        int published;
        int errors;
        int publishErrors;
        int categoriesChecked;
        int categoriesFailed;
    }
}
