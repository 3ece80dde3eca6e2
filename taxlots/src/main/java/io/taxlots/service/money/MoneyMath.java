package io.taxlots.service.money;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money helpers shared by the calculators.
 *
 * All arithmetic stays exact; {@link #toReportScale(BigDecimal)} is the only
 * rounding step and belongs to presentation.
 */
public final class MoneyMath {

    public static final int REPORT_SCALE = 2;

    private MoneyMath() {}

    /**
     * quantity * price, exact.
     */
    public static BigDecimal value(int quantity, BigDecimal price) {
        return price.multiply(BigDecimal.valueOf(quantity));
    }

    /**
     * amount * rate, exact.
     */
    public static BigDecimal convert(BigDecimal amount, BigDecimal rate) {
        return amount.multiply(rate);
    }

    /**
     * Round to two decimals, HALF_UP.
     */
    public static BigDecimal toReportScale(BigDecimal amount) {
        return amount.setScale(REPORT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Format as {@code $12.30} / {@code -$12.30}.
     */
    public static String format(BigDecimal amount, String symbol) {
        BigDecimal rounded = toReportScale(amount);
        if (rounded.signum() < 0) {
            return "-" + symbol + rounded.negate().toPlainString();
        }
        return symbol + rounded.toPlainString();
    }
}
