package com.example.deal_bot.source;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.deal_bot.pipeline.PipelineProperties;

/**
 * サイクルの取得段階。カテゴリ並列取得か、単一クエリ（＋フォールバック）かを設定で切り替える。
 */
@Service
public class DealSearchService {

    private static final Logger log = LoggerFactory.getLogger(DealSearchService.class);

    private final CategoryFanOut fanOut;
    private final RateBudgetedFetcher fetcher;
    private final PipelineProperties props;
    private final KeepaProperties keepaProps;

    public DealSearchService(CategoryFanOut fanOut, RateBudgetedFetcher fetcher,
            PipelineProperties props, KeepaProperties keepaProps) {
        this.fanOut = fanOut;
        this.fetcher = fetcher;
        this.props = props;
        this.keepaProps = keepaProps;
    }

    /**
     * @throws UpstreamException 単一ソースモードで上流に到達できない場合
     */
    public FanOutResult fetch() {
        List<String> categoryIds = props.categoryIds();
        if (props.getFanOut().isEnabled() && !categoryIds.isEmpty()) {
            return fanOut.fetchCategories(categoryIds, props.getFanOut().getWorkers());
        }
        return FanOutResult.single(searchSingleSource());
    }

    public List<RawDeal> searchSingleSource() {
        List<RawDeal> deals = fetcher.listPriceDrops(DealQuery.primary(props, null));
        if (deals.isEmpty() && keepaProps.isUseFallback()) {
            log.info("No deals with primary query, retrying with fallback discount {}%",
                    props.getFallbackMinDiscount());
            deals = fetcher.listPriceDrops(DealQuery.fallback(props, null));
            if (deals.isEmpty()) {
                log.warn("No deals found even with fallback query");
            }
        }
        return deals;
    }
}
