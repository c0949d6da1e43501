package com.aitrader.backend.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PrecisionUtilsTest {

    @Test
    void roundQuantityTruncatesTowardZero() {
        assertThat(PrecisionUtils.roundQuantity(new BigDecimal("0.12345"), 3)).isEqualByComparingTo("0.123");
        assertThat(PrecisionUtils.roundQuantity(new BigDecimal("0.9999"), 2)).isEqualByComparingTo("0.99");
        assertThat(PrecisionUtils.roundQuantity(new BigDecimal("7.9"), 0)).isEqualByComparingTo("7");
    }

    @Test
    void roundQuantityNeverExceedsInput() {
        String[] samples = {"0.0019", "1.23456789", "250.5", "0.333333", "99999.99999"};
        for (String sample : samples) {
            BigDecimal input = new BigDecimal(sample);
            for (int precision = 0; precision <= 6; precision++) {
                assertThat(PrecisionUtils.roundQuantity(input, precision)).isLessThanOrEqualTo(input);
            }
        }
    }

    @Test
    void roundPriceUsesHalfUp() {
        assertThat(PrecisionUtils.roundPrice(new BigDecimal("101.005"), 2)).isEqualByComparingTo("101.01");
        assertThat(PrecisionUtils.roundPrice(new BigDecimal("101.004"), 2)).isEqualByComparingTo("101.00");
    }

    @Test
    void precisionOfReadsTickSize() {
        assertThat(PrecisionUtils.precisionOf("0.01")).isEqualTo(2);
        assertThat(PrecisionUtils.precisionOf("0.00100000")).isEqualTo(3);
        assertThat(PrecisionUtils.precisionOf("1")).isZero();
        assertThat(PrecisionUtils.precisionOf("1e-4")).isEqualTo(4);
        assertThat(PrecisionUtils.precisionOf(null)).isZero();
    }
}
