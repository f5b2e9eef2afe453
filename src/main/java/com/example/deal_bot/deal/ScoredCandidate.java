package com.example.deal_bot.deal;

import java.math.BigDecimal;

/**
 * score = commissionWeight * discountPercent
 */
public record ScoredCandidate(Candidate candidate, BigDecimal commissionWeight, BigDecimal score) {
}
