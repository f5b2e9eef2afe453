package com.example.deal_bot.source;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.deal_bot.deal.CommissionWeights;
import com.example.deal_bot.pipeline.PipelineProperties;

/**
 * 手数料重みの高いカテゴリから上位K件を選び、固定サイズのワーカープールで並列取得する。
 * 一部カテゴリの失敗は集計して続行し、例外は呼び出し元へ投げない。
 */
@Component
public class CategoryFanOut {

    private static final Logger log = LoggerFactory.getLogger(CategoryFanOut.class);

    private final RateBudgetedFetcher fetcher;
    private final CommissionWeights weights;
    private final PipelineProperties props;
    private final Sleeper sleeper;

    public CategoryFanOut(RateBudgetedFetcher fetcher, CommissionWeights weights,
            PipelineProperties props, Sleeper sleeper) {
        this.fetcher = fetcher;
        this.weights = weights;
        this.props = props;
        this.sleeper = sleeper;
    }

    public FanOutResult fetchCategories(List<String> categoryIds, int concurrencyLimit) {
        if (categoryIds == null || categoryIds.isEmpty()) {
            return FanOutResult.empty();
        }
        List<String> selected = selectCategories(categoryIds);

        int poolSize = Math.max(1, Math.min(concurrencyLimit, selected.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<CategoryResult> completion = new ExecutorCompletionService<>(pool);
        Map<String, List<RawDeal>> byCategory = new HashMap<>();
        int failed = 0;
        int received = 0;
        try {
            for (String categoryId : selected) {
                completion.submit(() -> fetchCategory(categoryId));
            }
            for (int i = 0; i < selected.size(); i++) {
                Future<CategoryResult> future = completion.take();
                received++;
                try {
                    CategoryResult result = future.get();
                    if (result.failed()) {
                        failed++;
                    } else {
                        byCategory.put(result.categoryId(), result.deals());
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.warn("[FanOut] category task failed: {}", cause.toString());
                    failed++;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            failed += selected.size() - received;
            log.warn("[FanOut] interrupted; {} categories not completed", selected.size() - received);
        } finally {
            pool.shutdown();
        }

        List<RawDeal> merged = merge(selected, byCategory);
        log.info("[FanOut] categories={} ok={} failed={} deals={}",
                selected.size(), byCategory.size(), failed, merged.size());
        return new FanOutResult(merged, byCategory.size(), failed);
    }

    List<String> selectCategories(List<String> categoryIds) {
        List<String> sorted = weights.sortByWeight(categoryIds);
        int topK = Math.max(1, props.getFanOut().getTopCategories());
        return sorted.size() > topK ? new ArrayList<>(sorted.subList(0, topK)) : sorted;
    }

    private CategoryResult fetchCategory(String categoryId) {
        List<RawDeal> listed;
        try {
            listed = fetcher.listPriceDrops(DealQuery.primary(props, categoryId));
        } catch (RuntimeException e) {
            log.warn("[FanOut] category {} fetch failed: {}", categoryId, e.getMessage());
            return CategoryResult.failed(categoryId);
        }

        PipelineProperties.FanOut cfg = props.getFanOut();
        int limit = Math.max(0, cfg.getProductsPerCategory());
        List<RawDeal> deals = new ArrayList<>();
        for (RawDeal deal : listed) {
            if (deals.size() >= limit) {
                break;
            }
            RawDeal tagged = deal.withCategoryId(categoryId);
            if (cfg.isEnrichProducts() && tagged.productId() != null) {
                if (!deals.isEmpty() && !pause(cfg)) {
                    // 割り込み時は補完せずに残りを返す
                    deals.add(tagged);
                    continue;
                }
                tagged = enrich(tagged);
            }
            deals.add(tagged);
        }
        log.debug("[FanOut] category {} listed={} kept={}", categoryId, listed.size(), deals.size());
        return CategoryResult.ok(categoryId, deals);
    }

    private RawDeal enrich(RawDeal deal) {
        try {
            return fetcher.getProduct(deal.productId()).map(deal::withDetails).orElse(deal);
        } catch (UpstreamException e) {
            log.warn("[FanOut] product {} lookup failed, keeping listing data: {}", deal.productId(), e.getMessage());
            return deal;
        }
    }

    private boolean pause(PipelineProperties.FanOut cfg) {
        if (cfg.getInterRequestPause() == null || cfg.getInterRequestPause().isZero()) {
            return true;
        }
        try {
            sleeper.sleep(cfg.getInterRequestPause());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** カテゴリ選択順に連結し、同一商品は最初に現れたものを残す */
    private static List<RawDeal> merge(List<String> order, Map<String, List<RawDeal>> byCategory) {
        LinkedHashMap<String, RawDeal> merged = new LinkedHashMap<>();
        for (String categoryId : order) {
            List<RawDeal> deals = byCategory.get(categoryId);
            if (deals == null) {
                continue;
            }
            for (RawDeal d : deals) {
                String key = d.productId() == null ? "\u0000" + merged.size() : d.productId();
                merged.putIfAbsent(key, d);
            }
        }
        return new ArrayList<>(merged.values());
    }

    private record CategoryResult(String categoryId, List<RawDeal> deals, boolean failed) {
        static CategoryResult ok(String categoryId, List<RawDeal> deals) {
            return new CategoryResult(categoryId, deals, false);
        }

        static CategoryResult failed(String categoryId) {
            return new CategoryResult(categoryId, List.of(), true);
        }
    }
}
