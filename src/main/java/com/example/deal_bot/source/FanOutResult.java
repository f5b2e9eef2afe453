package com.example.deal_bot.source;

import java.util.List;

/**
 * 取得結果。単一ソース検索でも同じ形で返す（categoriesChecked=0）。
 */
public record FanOutResult(List<RawDeal> deals, int categoriesChecked, int categoriesFailed) {

    public static FanOutResult empty() {
        return new FanOutResult(List.of(), 0, 0);
    }

    public static FanOutResult single(List<RawDeal> deals) {
        return new FanOutResult(List.copyOf(deals), 0, 0);
    }

    /** 対象カテゴリが1つ以上あり、全て失敗した */
    public boolean allFailed() {
        return categoriesFailed > 0 && categoriesChecked == 0;
    }
}
