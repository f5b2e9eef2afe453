package com.example.deal_bot.deal;

import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.deal_bot.TestFixtures;

class CandidateRankerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private CandidateRanker ranker;

    @BeforeEach
    void setUp() {
        ranker = new CandidateRanker(new CommissionWeights(TestFixtures.props()));
    }

    @Test
    void score_isWeightTimesDiscount() {
        ScoredCandidate sc = ranker.score(TestFixtures.serum().build());

        assertThat(sc.commissionWeight()).isEqualByComparingTo("10.0");
        assertThat(sc.score()).isEqualByComparingTo("250.000");
    }

    @Test
    void score_unknownCategoryUsesDefaultWeight() {
        ScoredCandidate sc = ranker.score(TestFixtures.serum().categoryId("garden").build());

        assertThat(sc.commissionWeight()).isEqualByComparingTo("2.0");
    }

    @Test
    void higherCommissionBeatsHigherDiscount() {
        // beauty 25% * 10 = 250, home 50% * 4 = 200
        Candidate beauty = TestFixtures.serum().productId("B").build();
        Candidate home = TestFixtures.serum().productId("H").categoryId("home")
                .currentPrice(new BigDecimal("19.50")).build();

        List<ScoredCandidate> ranked = ranker.rank(List.of(home, beauty));

        assertThat(ranked).extracting(s -> s.candidate().productId()).containsExactly("B", "H");
    }

    @Test
    void ties_breakByDiscountThenDetectedAtThenProductId() {
        // 同スコア: beauty 20% * 10 = 200 と home 50% * 4 = 200
        Candidate beauty20 = TestFixtures.serum().productId("A").currentPrice(new BigDecimal("31.20")).build();
        Candidate home50 = TestFixtures.serum().productId("Z").categoryId("home")
                .currentPrice(new BigDecimal("19.50")).build();
        Candidate early = TestFixtures.serum().productId("M").detectedAt(T0.minusSeconds(60)).build();
        Candidate lateB = TestFixtures.serum().productId("Q2").detectedAt(T0).build();
        Candidate lateA = TestFixtures.serum().productId("Q1").detectedAt(T0).build();

        assertThat(ranker.rank(List.of(beauty20, home50)))
                .extracting(s -> s.candidate().productId()).containsExactly("Z", "A");
        assertThat(ranker.rank(List.of(lateB, lateA, early)))
                .extracting(s -> s.candidate().productId()).containsExactly("M", "Q1", "Q2");
    }

    @Test
    void ordering_isIndependentOfInputOrder() {
        List<Candidate> input = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            String category = i % 3 == 0 ? "beauty" : i % 3 == 1 ? "home" : "toys";
            input.add(TestFixtures.serum()
                    .productId(String.format("P%02d", i))
                    .categoryId(category)
                    .currentPrice(new BigDecimal(20 + (i % 7)))
                    .referencePrice(new BigDecimal("40.00"))
                    .detectedAt(T0.plusSeconds(i % 4))
                    .build());
        }
        List<String> expected = ids(ranker.rank(input));

        Random random = new Random(42);
        for (int round = 0; round < 20; round++) {
            List<Candidate> shuffled = new ArrayList<>(input);
            Collections.shuffle(shuffled, random);
            assertThat(ids(ranker.rank(shuffled))).containsExactlyElementsOf(expected);
        }
    }

    @Test
    void top_truncatesToBatchSize() {
        List<Candidate> input = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            input.add(TestFixtures.serum().productId("P" + (100 + i)).build());
        }

        List<ScoredCandidate> top = ranker.top(input, 10);

        assertThat(top).hasSize(10);
        assertThat(ids(top)).doesNotContain("P110", "P111");
        assertThat(ranker.top(input.subList(0, 3), 10)).hasSize(3);
    }

    private static List<String> ids(List<ScoredCandidate> ranked) {
        return ranked.stream().map(s -> s.candidate().productId()).toList();
    }
}
