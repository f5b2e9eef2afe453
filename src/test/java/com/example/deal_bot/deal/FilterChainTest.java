package com.example.deal_bot.deal;

import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.deal_bot.TestFixtures;
import com.example.deal_bot.pipeline.PipelineProperties;

class FilterChainTest {

    private PipelineProperties props;
    private FilterChain filters;

    @BeforeEach
    void setUp() {
        props = TestFixtures.props();
        rebuild();
    }

    private void rebuild() {
        filters = new FilterChain(props, new NicheClassifier(props), new CommissionWeights(props));
    }

    // ===== 保存ティア =====

    @Test
    void typicalBeautyDeal_passesBothTiers() {
        Candidate c = TestFixtures.serum().build();

        assertThat(filters.passesPersistTier(c)).isTrue();
        assertThat(filters.passesPublishTier(c, true)).isTrue();
    }

    @Test
    void persist_rejectsLowDiscount() {
        Candidate c = TestFixtures.serum().currentPrice(new BigDecimal("35.00")).build();

        assertThat(filters.persistRejection(c)).hasValueSatisfying(r -> assertThat(r).startsWith("DISCOUNT_TOO_LOW"));
    }

    @Test
    void persist_rejectsPriceOutsideRange() {
        Candidate cheap = TestFixtures.serum().currentPrice(new BigDecimal("8.00")).referencePrice(new BigDecimal("10.00")).build();
        Candidate pricey = TestFixtures.serum().currentPrice(new BigDecimal("350")).referencePrice(new BigDecimal("500")).build();

        assertThat(filters.persistRejection(cheap)).hasValueSatisfying(r -> assertThat(r).startsWith("PRICE_OUT_OF_RANGE"));
        assertThat(filters.persistRejection(pricey)).hasValueSatisfying(r -> assertThat(r).startsWith("PRICE_OUT_OF_RANGE"));
    }

    @Test
    void persist_rejectsSmallAbsoluteSavings() {
        // 20% off but only 4.00 saved
        Candidate c = TestFixtures.serum().currentPrice(new BigDecimal("16.00")).referencePrice(new BigDecimal("20.00")).build();

        assertThat(filters.persistRejection(c)).hasValueSatisfying(r -> assertThat(r).startsWith("SAVINGS_TOO_LOW"));
    }

    @Test
    void persist_rejectsRestrictedKeywordCaseInsensitive() {
        Candidate c = TestFixtures.serum().title("Premium ALCOHOL Free Toner Pads").build();

        assertThat(filters.persistRejection(c)).hasValue("RESTRICTED_KEYWORD(alcohol)");
    }

    @Test
    void persist_rejectsShortTitle() {
        Candidate c = TestFixtures.serum().title("Serum").build();

        assertThat(filters.persistRejection(c)).hasValue("TITLE_TOO_SHORT");
    }

    @Test
    void persist_rejectsPoorQualitySignalsOnlyWhenPresent() {
        Candidate lowRating = TestFixtures.serum().rating(3.1).build();
        Candidate fewReviews = TestFixtures.serum().reviewCount(3).build();
        Candidate badRank = TestFixtures.serum().popularityRank(250_000).build();
        Candidate unknown = TestFixtures.serum().rating(null).reviewCount(null).popularityRank(null).build();

        assertThat(filters.persistRejection(lowRating)).hasValueSatisfying(r -> assertThat(r).startsWith("RATING_TOO_LOW"));
        assertThat(filters.persistRejection(fewReviews)).hasValueSatisfying(r -> assertThat(r).startsWith("TOO_FEW_REVIEWS"));
        assertThat(filters.persistRejection(badRank)).hasValueSatisfying(r -> assertThat(r).startsWith("RANK_TOO_LOW"));
        assertThat(filters.persistRejection(unknown)).isEmpty();
    }

    @Test
    void persist_primeRequirement_exemptsHighCommissionCategories() {
        props.getPersist().setRequirePrime(true);
        rebuild();

        Candidate beauty = TestFixtures.serum().primeEligible(false).build();
        Candidate home = TestFixtures.serum().categoryId("home").primeEligible(false).build();
        Candidate homeUnknown = TestFixtures.serum().categoryId("home").primeEligible(null).build();

        assertThat(filters.persistRejection(beauty)).isEmpty();
        assertThat(filters.persistRejection(home)).hasValue("NOT_PRIME");
        assertThat(filters.persistRejection(homeUnknown)).isEmpty();
    }

    @Test
    void persist_fulfilmentRequirement() {
        props.getPersist().setRequireFulfilledByPlatform(true);
        rebuild();

        Candidate c = TestFixtures.serum().fulfilledByPlatform(false).build();

        assertThat(filters.persistRejection(c)).hasValue("NOT_FULFILLED_BY_PLATFORM");
    }

    // ===== 投稿ティア =====

    @Test
    void publish_nicheDisabled_passesEverything() {
        Candidate gadget = TestFixtures.serum().title("USB Charging Cable Pack").categoryName("Electronics").build();

        assertThat(filters.passesPublishTier(gadget, false)).isTrue();
    }

    @Test
    void publish_rejectsNonNicheProduct() {
        Candidate gadget = TestFixtures.serum().title("USB Charging Cable Pack").categoryName("Electronics").build();

        assertThat(filters.publishRejection(gadget, true)).hasValue("NOT_NICHE");
    }

    @Test
    void publish_nicheMatchedByBrandOnly() {
        Candidate c = TestFixtures.serum().title("Daily Facial Essentials Kit").categoryName("Health").brand("CeraVe").build();

        assertThat(filters.publishRejection(c, true)).isEmpty();
    }

    @Test
    void publish_rejectsSampleSizePrices() {
        Candidate sample = TestFixtures.serum().currentPrice(new BigDecimal("8.00")).referencePrice(new BigDecimal("10.00")).build();

        assertThat(filters.publishRejection(sample, true))
                .hasValueSatisfying(r -> assertThat(r).startsWith("SAMPLE_SIZE_PRICE"));
    }

    @Test
    void publish_appliesStricterNicheThresholds() {
        Candidate lowDiscount = TestFixtures.serum().currentPrice(new BigDecimal("33.00")).build();
        Candidate lowRating = TestFixtures.serum().rating(3.8).build();
        Candidate fewReviews = TestFixtures.serum().reviewCount(20).build();
        Candidate belowNicheMin = TestFixtures.serum().currentPrice(new BigDecimal("18.00")).referencePrice(new BigDecimal("30.00")).build();

        assertThat(filters.publishRejection(lowDiscount, true)).hasValueSatisfying(r -> assertThat(r).startsWith("NICHE_DISCOUNT_TOO_LOW"));
        assertThat(filters.publishRejection(lowRating, true)).hasValueSatisfying(r -> assertThat(r).startsWith("NICHE_RATING_TOO_LOW"));
        assertThat(filters.publishRejection(fewReviews, true)).hasValueSatisfying(r -> assertThat(r).startsWith("NICHE_TOO_FEW_REVIEWS"));
        assertThat(filters.publishRejection(belowNicheMin, true)).hasValueSatisfying(r -> assertThat(r).startsWith("NICHE_PRICE_OUT_OF_RANGE"));
    }

    @Test
    void publish_missingRatingAndReviews_doNotReject() {
        Candidate c = TestFixtures.serum().rating(null).reviewCount(null).build();

        assertThat(filters.publishRejection(c, true)).isEmpty();
    }
}
