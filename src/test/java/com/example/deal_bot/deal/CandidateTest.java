package com.example.deal_bot.deal;

import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.example.deal_bot.TestFixtures;

class CandidateTest {

    @ParameterizedTest
    @CsvSource({
            "29.25, 39.00, 25.00",
            "8.00, 10.00, 20.00",
            "19.99, 29.99, 33.34",
            "10.00, 10.00, 0.00",
            "12.00, 10.00, 0.00",
            "10.00, 0, 0.00"
    })
    void discountPercent_isDerivedFromPrices(String current, String reference, String expected) {
        BigDecimal pct = Candidate.discountPercentOf(new BigDecimal(current), new BigDecimal(reference));

        assertThat(pct).isEqualByComparingTo(expected);
        assertThat(pct.scale()).isEqualTo(2);
    }

    @Test
    void discountPercent_isZeroWithoutReferencePrice() {
        Candidate c = TestFixtures.serum().referencePrice(null).build();

        assertThat(c.discountPercent()).isEqualByComparingTo("0");
        assertThat(c.savings()).isEqualByComparingTo("0");
    }

    @Test
    void discountPercent_followsPriceChanges() {
        Candidate c = TestFixtures.serum().build();
        Candidate cheaper = c.toBuilder().currentPrice(new BigDecimal("19.50")).build();

        assertThat(c.discountPercent()).isEqualByComparingTo("25.00");
        assertThat(cheaper.discountPercent()).isEqualByComparingTo("50.00");
        assertThat(cheaper.savings()).isEqualByComparingTo("19.50");
    }
}
