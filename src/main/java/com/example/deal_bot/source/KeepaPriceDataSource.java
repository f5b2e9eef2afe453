package com.example.deal_bot.source;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Keepa API クライアント（real profile）。
 * 価格はセント単位、-1 は欠損、評価は 10〜50 スケール。
 */
@Component
@Profile("real")
public class KeepaPriceDataSource implements PriceDataSource {

    private static final Logger log = LoggerFactory.getLogger(KeepaPriceDataSource.class);

    // Keepa の csv 価格種別インデックス
    private static final int IDX_SALES_RANK = 3;
    private static final int IDX_RATING = 16;
    private static final int IDX_REVIEW_COUNT = 17;
    private static final int SORT_BY_DELTA_PERCENT = 15;

    private final KeepaProperties config;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    private final AtomicInteger tokensLeft = new AtomicInteger(-1);

    public KeepaPriceDataSource(KeepaProperties config, WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper) {
        this.config = config;
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<RawDeal> listPriceDrops(DealQuery query) {
        String selection = toSelectionJson(query);
        log.debug("GET /deal category={} minDiscount={}", query.categoryId(), query.minDiscountPercent());

        JsonNode root = get("/deal", "selection", selection);
        JsonNode dr = root.path("deals").path("dr");
        if (!dr.isArray()) {
            return List.of();
        }
        List<RawDeal> deals = new ArrayList<>();
        for (JsonNode node : dr) {
            deals.add(parseDeal(node));
        }
        log.info("GET /deal category={} returned {} deals (tokensLeft={})",
                query.categoryId(), deals.size(), tokensLeft.get());
        return deals;
    }

    @Override
    public Optional<RawProduct> getProduct(String productId) {
        JsonNode root = get("/product", "asin", productId);
        JsonNode products = root.path("products");
        if (!products.isArray() || products.isEmpty()) {
            log.warn("No product found for id={}", productId);
            return Optional.empty();
        }
        return Optional.of(parseProduct(products.get(0)));
    }

    /** 直近レスポンスの tokensLeft。まだ1度も呼んでいなければ -1（ここでは問い合わせない） */
    @Override
    public int remainingQuota() {
        return tokensLeft.get();
    }

    private JsonNode get(String path, String paramName, String paramValue) {
        try {
            JsonNode root = webClient()
                    .get()
                    .uri(config.getApiBase() + path, b -> {
                        b.queryParam("key", config.getApiKey())
                                .queryParam("domain", config.getDomainId());
                        if ("/product".equals(path)) {
                            b.queryParam("stats", 90).queryParam("rating", 1).queryParam("buybox", 1);
                        }
                        b.queryParam(paramName, "{value}");
                        return b.build(Map.of("value", paramValue));
                    })
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(config.getRequestTimeout());
            if (root == null) {
                throw new UpstreamException("Keepa " + path + ": empty response");
            }
            if (root.has("tokensLeft")) {
                tokensLeft.set(root.path("tokensLeft").asInt());
            }
            if (root.hasNonNull("error")) {
                throw new UpstreamException("Keepa " + path + " error: " + root.path("error").path("message").asText());
            }
            return root;
        } catch (WebClientResponseException e) {
            log.error("Keepa {} failed status={} body={}", path, e.getStatusCode(), e.getResponseBodyAsString());
            throw new UpstreamException("Keepa " + path + " failed: " + e.getStatusCode(), e);
        } catch (UpstreamException e) {
            throw e;
        } catch (Exception e) {
            log.error("Keepa {} error", path, e);
            throw new UpstreamException("Keepa " + path + " error: " + e.getMessage(), e);
        }
    }

    private String toSelectionJson(DealQuery q) {
        Map<String, Object> sel = new LinkedHashMap<>();
        sel.put("page", q.page());
        sel.put("domainId", config.getDomainId());
        sel.put("deltaPercentRange", List.of(q.minDiscountPercent(), 100));
        sel.put("currentRange", List.of(toCents(q.minPrice()), toCents(q.maxPrice())));
        sel.put("sortType", SORT_BY_DELTA_PERCENT);
        if (q.maxPopularityRank() != null) {
            sel.put("salesRankRange", List.of(1, q.maxPopularityRank()));
        }
        if (q.minRating() != null) {
            sel.put("minRating", (int) Math.round(q.minRating() * 10));
        }
        if (q.categoryId() != null) {
            sel.put("includeCategories", List.of(Long.parseLong(q.categoryId())));
        }
        try {
            return objectMapper.writeValueAsString(sel);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Failed to encode deal selection", e);
        }
    }

    // ===== parsing =====

    static RawDeal parseDeal(JsonNode d) {
        JsonNode categories = d.path("categories");
        return RawDeal.builder()
                .productId(textOrNull(d, "asin"))
                .title(textOrNull(d, "title"))
                .currentPrice(firstPositiveCents(d.path("current")))
                .referencePrice(firstAvgCents(d.path("avg")))
                .categoryId(categories.isArray() && !categories.isEmpty() ? categories.get(0).asText() : null)
                .brand(textOrNull(d, "brand"))
                .popularityRank(positiveInt(lastValue(d.path("salesRank"))))
                .rating(ratingOf(lastValue(d.path("rating"))))
                .reviewCount(nonNegativeInt(lastValue(d.path("reviewCount"))))
                .imageUrl(firstImage(d))
                .build();
    }

    static RawProduct parseProduct(JsonNode p) {
        JsonNode stats = p.path("stats");
        JsonNode current = stats.path("current");
        JsonNode tree = p.path("categoryTree");
        return RawProduct.builder()
                .productId(textOrNull(p, "asin"))
                .title(textOrNull(p, "title"))
                .currentPrice(firstPositiveCents(current))
                .referencePrice(firstPositiveCents(stats.path("avg90")))
                .categoryName(tree.isArray() && !tree.isEmpty() ? textOrNull(tree.get(tree.size() - 1), "name") : null)
                .brand(textOrNull(p, "brand"))
                .popularityRank(positiveInt(current.path(IDX_SALES_RANK)))
                .rating(ratingOf(current.path(IDX_RATING)))
                .reviewCount(nonNegativeInt(current.path(IDX_REVIEW_COUNT)))
                .primeEligible(booleanOrNull(stats, "buyBoxIsPrimeEligible"))
                .fulfilledByPlatform(booleanOrNull(stats, "buyBoxIsFBA"))
                .imageUrl(firstImage(p))
                .build();
    }

    private static BigDecimal firstPositiveCents(JsonNode node) {
        if (node.isNumber()) {
            return centsOrNull(node.asLong());
        }
        if (node.isArray()) {
            for (JsonNode v : node) {
                if (v.isNumber() && v.asLong() > 0) {
                    return centsOrNull(v.asLong());
                }
            }
        }
        return null;
    }

    private static BigDecimal firstAvgCents(JsonNode avg) {
        if (!avg.isArray()) {
            return null;
        }
        for (JsonNode inner : avg) {
            BigDecimal v = firstPositiveCents(inner);
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    private static BigDecimal centsOrNull(long cents) {
        return cents > 0 ? BigDecimal.valueOf(cents).movePointLeft(2) : null;
    }

    private static JsonNode lastValue(JsonNode node) {
        if (node.isArray()) {
            return node.isEmpty() ? node : node.get(node.size() - 1);
        }
        return node;
    }

    private static Integer positiveInt(JsonNode v) {
        return v.isNumber() && v.asInt() > 0 ? v.asInt() : null;
    }

    private static Integer nonNegativeInt(JsonNode v) {
        return v.isNumber() && v.asInt() >= 0 ? v.asInt() : null;
    }

    private static Double ratingOf(JsonNode v) {
        return v.isNumber() && v.asInt() > 0 ? v.asInt() / 10.0 : null;
    }

    private static Boolean booleanOrNull(JsonNode n, String field) {
        JsonNode v = n.path(field);
        return v.isBoolean() ? v.asBoolean() : null;
    }

    private static String textOrNull(JsonNode n, String field) {
        JsonNode v = n.path(field);
        return v.isTextual() ? v.asText() : null;
    }

    private static String firstImage(JsonNode n) {
        String csv = textOrNull(n, "imagesCSV");
        if (csv == null || csv.isBlank()) {
            return null;
        }
        return "https://images-na.ssl-images-amazon.com/images/I/" + csv.split(",")[0];
    }

    private static long toCents(BigDecimal price) {
        return price == null ? 0 : price.movePointRight(2).longValue();
    }

    private WebClient webClient() {
        return webClientBuilder
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
