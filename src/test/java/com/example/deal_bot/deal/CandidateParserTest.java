package com.example.deal_bot.deal;

import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.deal_bot.TestFixtures;
import com.example.deal_bot.pipeline.PipelineProperties;
import com.example.deal_bot.source.RawDeal;

class CandidateParserTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private PipelineProperties props;
    private CandidateParser parser;

    @BeforeEach
    void setUp() {
        props = TestFixtures.props();
        parser = new CandidateParser(new AffiliateLinkBuilder(props));
    }

    @Test
    void parse_validDeal() {
        RawDeal raw = RawDeal.builder()
                .productId(" X1 ")
                .title("  Hydrating   Face Serum\n Deluxe ")
                .currentPrice(new BigDecimal("29.25"))
                .referencePrice(new BigDecimal("39.00"))
                .categoryId("beauty")
                .rating(4.3)
                .reviewCount(2847)
                .build();

        ParseResult result = parser.parse(raw, NOW);

        assertThat(result.ok()).isTrue();
        Candidate c = result.candidate();
        assertThat(c.productId()).isEqualTo("X1");
        assertThat(c.title()).isEqualTo("Hydrating Face Serum Deluxe");
        assertThat(c.discountPercent()).isEqualByComparingTo("25.00");
        assertThat(c.productUrl()).isEqualTo("https://www.amazon.com/dp/X1");
        assertThat(c.detectedAt()).isEqualTo(NOW);
    }

    @Test
    void parse_collectsAllMissingRequiredFields() {
        RawDeal raw = RawDeal.builder().title("   ").currentPrice(BigDecimal.ZERO).build();

        ParseResult result = parser.parse(raw, NOW);

        assertThat(result.ok()).isFalse();
        assertThat(result.candidate()).isNull();
        assertThat(result.errors()).hasSize(3);
    }

    @Test
    void parse_nullRawDeal_isInvalidNotException() {
        ParseResult result = parser.parse(null, NOW);

        assertThat(result.ok()).isFalse();
        assertThat(result.errors()).isNotEmpty();
    }

    @Test
    void parse_dropsOutOfRangeOptionalValues() {
        RawDeal raw = RawDeal.builder()
                .productId("X2")
                .title("Some product title")
                .currentPrice(new BigDecimal("20"))
                .referencePrice(new BigDecimal("-1"))
                .rating(7.5)
                .reviewCount(-3)
                .popularityRank(0)
                .build();

        Candidate c = parser.parse(raw, NOW).candidate();

        assertThat(c.referencePrice()).isNull();
        assertThat(c.rating()).isNull();
        assertThat(c.reviewCount()).isNull();
        assertThat(c.popularityRank()).isNull();
        assertThat(c.discountPercent()).isEqualByComparingTo("0");
    }

    @Test
    void affiliateUrl_appendsTagWhenConfigured() {
        AffiliateLinkBuilder links = new AffiliateLinkBuilder(props);
        assertThat(links.affiliateUrl("X1")).isEqualTo("https://www.amazon.com/dp/X1");

        props.setAffiliateTag("dealbot-20");
        assertThat(links.affiliateUrl("X1")).isEqualTo("https://www.amazon.com/dp/X1?tag=dealbot-20");
    }
}
