package com.example.deal_bot.source;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.example.deal_bot.ops.SystemFlagService;

/**
 * ローカル用の固定サンプルデータ。
 * KEEPA_STUB_FAIL_CATEGORIES（カンマ区切り）に含まれるカテゴリは UpstreamException を投げる。
 */
public class StubPriceDataSource implements PriceDataSource {

    static final String FAIL_CATEGORIES_KEY = "KEEPA_STUB_FAIL_CATEGORIES";
    static final String QUOTA_KEY = "KEEPA_STUB_QUOTA";

    private static final List<RawDeal> CATALOG = List.of(
            sample("B0STUB0001", "Hydrating Face Serum Deluxe with Hyaluronic Acid", "29.25", "39.00",
                    "11055981", "Luxury Beauty", "CeraVe", 1200, 4.3, 2847),
            sample("B0STUB0002", "Matte Liquid Lipstick Long Wear Set", "24.00", "36.00",
                    "11055981", "Luxury Beauty", "Maybelline", 3400, 4.4, 912),
            sample("B0STUB0003", "Stainless Steel Nonstick Cookware 10-Piece", "89.99", "149.99",
                    "1055398", "Home & Kitchen", "HomeChef", 5600, 4.5, 3120),
            sample("B0STUB0004", "Professional Makeup Brush Set 15 Pieces", "21.99", "32.99",
                    "3375251", "Beauty Tools & Accessories", "BrushPro", 8800, 4.2, 540),
            sample("B0STUB0005", "Wireless Noise Cancelling Headphones", "119.00", "199.00",
                    "172282", "Electronics", "SoundMax", 1500, 4.1, 6021),
            sample("B0STUB0006", "Building Blocks Castle Kit 1200 Pieces", "39.99", "59.99",
                    "165796011", "Toys & Games", "BrickWorks", 22000, 4.7, 880));

    private final SystemFlagService flags;

    public StubPriceDataSource(SystemFlagService flags) {
        this.flags = flags;
    }

    @Override
    public List<RawDeal> listPriceDrops(DealQuery query) {
        String categoryId = query.categoryId();
        if (categoryId != null && flags.getList(FAIL_CATEGORIES_KEY).contains(categoryId)) {
            throw new UpstreamException("stub listing failure for category=" + categoryId);
        }
        List<RawDeal> out = new ArrayList<>();
        for (RawDeal d : CATALOG) {
            if (categoryId == null || categoryId.equals(d.categoryId())) {
                out.add(d);
            }
        }
        return out;
    }

    @Override
    public Optional<RawProduct> getProduct(String productId) {
        return CATALOG.stream()
                .filter(d -> d.productId().equals(productId))
                .findFirst()
                .map(d -> RawProduct.builder()
                        .productId(d.productId())
                        .title(d.title())
                        .categoryName(d.categoryName())
                        .primeEligible(true)
                        .fulfilledByPlatform(true)
                        .build());
    }

    @Override
    public int remainingQuota() {
        return flags.getInt(QUOTA_KEY, 1200);
    }

    private static RawDeal sample(String id, String title, String current, String reference,
            String categoryId, String categoryName, String brand, int rank, double rating, int reviews) {
        return RawDeal.builder()
                .productId(id)
                .title(title)
                .currentPrice(new BigDecimal(current))
                .referencePrice(new BigDecimal(reference))
                .categoryId(categoryId)
                .categoryName(categoryName)
                .brand(brand)
                .popularityRank(rank)
                .rating(rating)
                .reviewCount(reviews)
                .build();
    }
}
