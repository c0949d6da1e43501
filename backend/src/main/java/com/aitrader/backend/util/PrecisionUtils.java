package com.aitrader.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Exchange precision helpers. Quantities truncate toward zero so a position is never
 * sized up; prices use half-up rounding.
 */
public final class PrecisionUtils {

    private PrecisionUtils() {
    }

    public static BigDecimal roundQuantity(BigDecimal quantity, int precision) {
        if (quantity == null) {
            return null;
        }
        return quantity.setScale(precision, RoundingMode.DOWN);
    }

    public static BigDecimal roundPrice(BigDecimal price, int precision) {
        if (price == null) {
            return null;
        }
        return price.setScale(precision, RoundingMode.HALF_UP);
    }

    public static BigDecimal decimal(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return new BigDecimal(value.trim());
    }

    /**
     * Number of decimal places implied by a tick such as "0.01" or "1e-4".
     */
    public static int precisionOf(String tick) {
        BigDecimal value = decimal(tick);
        if (value == null || value.signum() <= 0) {
            return 0;
        }
        return Math.max(0, value.stripTrailingZeros().scale());
    }

    public static String plain(BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros().toPlainString();
    }
}
