package com.example.deal_bot.deal;

import java.util.List;

/**
 * 生データ→Candidate の変換結果。ok なら candidate は非null、そうでなければ errors に理由。
 */
public record ParseResult(Candidate candidate, List<String> errors) {

    public static ParseResult ok(Candidate c) {
        return new ParseResult(c, List.of());
    }

    public static ParseResult invalid(List<String> errors) {
        return new ParseResult(null, List.copyOf(errors));
    }

    public boolean ok() {
        return candidate != null && errors.isEmpty();
    }
}
