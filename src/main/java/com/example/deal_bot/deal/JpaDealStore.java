package com.example.deal_bot.deal;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.deal_bot.entity.CycleMetrics;
import com.example.deal_bot.entity.DealRecord;
import com.example.deal_bot.entity.PostRecord;
import com.example.deal_bot.pipeline.CycleStats;
import com.example.deal_bot.repo.CycleMetricsRepository;
import com.example.deal_bot.repo.DealRecordRepository;
import com.example.deal_bot.repo.PostRecordRepository;
import com.example.deal_bot.service.StateTransitionService;

@Service
public class JpaDealStore implements DealStore {

    private static final Logger log = LoggerFactory.getLogger(JpaDealStore.class);

    private final DealRecordRepository dealRepo;
    private final PostRecordRepository postRepo;
    private final CycleMetricsRepository metricsRepo;
    private final AffiliateLinkBuilder links;
    private final StateTransitionService transitions;
    private final TransactionTemplate tx;

    public JpaDealStore(
            DealRecordRepository dealRepo,
            PostRecordRepository postRepo,
            CycleMetricsRepository metricsRepo,
            AffiliateLinkBuilder links,
            StateTransitionService transitions,
            PlatformTransactionManager txManager) {
        this.dealRepo = dealRepo;
        this.postRepo = postRepo;
        this.metricsRepo = metricsRepo;
        this.links = links;
        this.transitions = transitions;
        this.tx = new TransactionTemplate(txManager);
    }

    @Override
    public Long saveCandidate(Candidate c) {
        return guarded("saveCandidate", () -> {
            DealRecord d = new DealRecord();
            d.setProductId(c.productId());
            d.setTitle(c.title());
            d.setCurrentPrice(c.currentPrice());
            d.setReferencePrice(c.referencePrice());
            d.setDiscountPercent(c.discountPercent());
            d.setSavingsAmount(c.savings());
            d.setCategoryId(c.categoryId());
            d.setCategoryName(c.categoryName());
            d.setBrand(c.brand());
            d.setImageUrl(c.imageUrl());
            d.setProductUrl(c.productUrl());
            d.setAffiliateUrl(links.affiliateUrl(c.productId()));
            d.setDetectedAt(c.detectedAt());
            return dealRepo.save(d).getId();
        });
    }

    @Override
    public Optional<DealRecord> findRecent(String productId, Instant since) {
        return guarded("findRecent", () ->
                dealRepo.findFirstByProductIdAndDetectedAtGreaterThanEqualOrderByDetectedAtDesc(productId, since));
    }

    @Override
    public void markPublished(Long dealId, String postId, String content, Instant at) {
        guarded("markPublished", () -> tx.execute(status -> {
            DealRecord d = dealRepo.findById(dealId)
                    .orElseThrow(() -> new IllegalStateException("deal not found: " + dealId));
            d.setPosted(true);
            d.setPostedAt(at);
            d.setPostId(postId);
            dealRepo.save(d);

            PostRecord p = new PostRecord();
            p.setPostId(postId);
            p.setDealId(dealId);
            p.setProductId(d.getProductId());
            p.setContent(content);
            p.setPostedAt(at);
            postRepo.save(p);

            transitions.log(StateTransitionService.TYPE_DEAL, String.valueOf(dealId),
                    "PERSISTED", "PUBLISHED", "POSTED", "postId=" + postId, "BATCH", null);
            return null;
        }));
    }

    @Override
    public void recordMetrics(CycleStats s) {
        guarded("recordMetrics", () -> {
            CycleMetrics m = new CycleMetrics();
            m.setCycleId(s.cycleId());
            m.setStartedAt(s.startedAt());
            m.setFinishedAt(s.finishedAt());
            m.setFinalState(s.finalState() == null ? "SKIPPED" : s.finalState().name());
            m.setFailureReason(s.failureReason());
            m.setFetched(s.fetched());
            m.setInvalid(s.invalid());
            m.setPersisted(s.persisted());
            m.setFilteredOut(s.filteredOut());
            m.setPublishCandidates(s.publishCandidates());
            m.setPublished(s.published());
            m.setErrors(s.errors());
            m.setPublishErrors(s.publishErrors());
            m.setUpstreamCalls(s.upstreamCalls());
            m.setCategoriesChecked(s.categoriesChecked());
            m.setCategoriesFailed(s.categoriesFailed());
            m.setElapsedMillis(s.elapsed() == null ? 0 : s.elapsed().toMillis());
            return metricsRepo.save(m);
        });
    }

    /** 接続系の障害だけを StoreUnavailableException に変換する */
    private <T> T guarded(String op, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            log.error("Store unavailable during {}: {}", op, e.getMessage());
            throw new StoreUnavailableException("store unavailable during " + op, e);
        }
    }
}
