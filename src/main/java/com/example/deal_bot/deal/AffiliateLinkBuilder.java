package com.example.deal_bot.deal;

import org.springframework.stereotype.Component;

import com.example.deal_bot.pipeline.PipelineProperties;

@Component
public class AffiliateLinkBuilder {

    private final PipelineProperties props;

    public AffiliateLinkBuilder(PipelineProperties props) {
        this.props = props;
    }

    public String productUrl(String productId) {
        return props.getProductUrlTemplate().replace("{id}", productId);
    }

    /** アフィリエイトタグ未設定なら商品URLをそのまま返す */
    public String affiliateUrl(String productId) {
        String base = productUrl(productId);
        String tag = props.getAffiliateTag();
        if (tag == null || tag.isBlank()) {
            return base;
        }
        return base + (base.contains("?") ? "&" : "?") + "tag=" + tag.trim();
    }
}
