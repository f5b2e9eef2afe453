package com.example.deal_bot.source;

import java.util.List;
import java.util.Optional;

/**
 * 価格履歴サービス（Keepa等）へのアクセス口。
 * 返すデータは未検証の生データで、検証は deal パッケージ側で行う。
 */
public interface PriceDataSource {

    /**
     * Search current price drops matching the query.
     *
     * @throws UpstreamException on transport/protocol failure
     */
    List<RawDeal> listPriceDrops(DealQuery query);

    /**
     * Look up one product. Empty when the upstream has no such product.
     *
     * @throws UpstreamException on transport/protocol failure
     */
    Optional<RawProduct> getProduct(String productId);

    /**
     * Remaining upstream token balance, as last reported.
     * Never issues a request of its own; -1 when nothing has been reported yet.
     */
    int remainingQuota();
}
