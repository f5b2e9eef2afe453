package com.example.deal_bot.deal;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.example.deal_bot.source.RawDeal;

/**
 * 上流の生データを Candidate に変換する。
 * 必須項目が欠ける場合は例外ではなく ParseResult のエラーとして返す。
 */
@Component
public class CandidateParser {

    private final AffiliateLinkBuilder links;

    public CandidateParser(AffiliateLinkBuilder links) {
        this.links = links;
    }

    public ParseResult parse(RawDeal raw, Instant detectedAt) {
        List<String> errors = new ArrayList<>();
        if (raw == null) {
            return ParseResult.invalid(List.of("raw deal is null"));
        }
        String id = trimToNull(raw.productId());
        String title = normalizeTitle(raw.title());

        if (id == null) {
            errors.add("productId is required");
        }
        if (title == null) {
            errors.add("title is required");
        }
        if (raw.currentPrice() == null || raw.currentPrice().signum() <= 0) {
            errors.add("currentPrice must be > 0");
        }
        if (!errors.isEmpty()) {
            return ParseResult.invalid(errors);
        }

        Candidate c = Candidate.builder()
                .productId(id)
                .title(title)
                .currentPrice(raw.currentPrice())
                .referencePrice(raw.referencePrice() != null && raw.referencePrice().signum() > 0
                        ? raw.referencePrice() : null)
                .categoryId(trimToNull(raw.categoryId()))
                .categoryName(trimToNull(raw.categoryName()))
                .brand(trimToNull(raw.brand()))
                .popularityRank(raw.popularityRank() != null && raw.popularityRank() > 0
                        ? raw.popularityRank() : null)
                .rating(raw.rating() != null && raw.rating() >= 0 && raw.rating() <= 5.0 ? raw.rating() : null)
                .reviewCount(raw.reviewCount() != null && raw.reviewCount() >= 0 ? raw.reviewCount() : null)
                .primeEligible(raw.primeEligible())
                .fulfilledByPlatform(raw.fulfilledByPlatform())
                .imageUrl(trimToNull(raw.imageUrl()))
                .productUrl(links.productUrl(id))
                .detectedAt(detectedAt)
                .build();
        return ParseResult.ok(c);
    }

    static String normalizeTitle(String title) {
        if (title == null) {
            return null;
        }
        String t = title.replaceAll("\\s+", " ").trim();
        return t.isEmpty() ? null : t;
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
