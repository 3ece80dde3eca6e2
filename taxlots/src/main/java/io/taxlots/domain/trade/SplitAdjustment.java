package io.taxlots.domain.trade;

import io.taxlots.domain.common.InvalidRecordException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Share split to apply to trades recorded before the split took effect.
 *
 * Trades of {@code symbol} dated strictly before {@code effectiveDate} get their
 * quantity multiplied by {@code ratio} and their price divided by it, so cost
 * stays the same while quantities line up with post-split sales.
 */
public record SplitAdjustment(
        String symbol,
        LocalDate effectiveDate,
        int ratio) {

    public SplitAdjustment {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidRecordException("Split adjustment needs a symbol");
        }
        if (effectiveDate == null) {
            throw new InvalidRecordException("Split adjustment for " + symbol + " needs an effective date");
        }
        if (ratio <= 0) {
            throw new InvalidRecordException("Split ratio for " + symbol + " must be positive: " + ratio);
        }
    }

    /**
     * Parse {@code SYMBOL:yyyy-MM-dd:RATIO}.
     */
    public static SplitAdjustment parse(String spec) {
        String[] parts = spec.trim().split(":");
        if (parts.length != 3) {
            throw new InvalidRecordException("Split adjustment must be SYMBOL:yyyy-MM-dd:RATIO, got '" + spec + "'");
        }
        try {
            return new SplitAdjustment(parts[0].trim(), LocalDate.parse(parts[1].trim()),
                    Integer.parseInt(parts[2].trim()));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new InvalidRecordException("Malformed split adjustment '" + spec + "': " + e.getMessage());
        }
    }

    public boolean appliesTo(Trade trade) {
        return trade.symbol().equals(symbol) && trade.tradeDate().isBefore(effectiveDate);
    }

    public Trade apply(Trade trade) {
        if (!appliesTo(trade)) {
            return trade;
        }
        int quantity;
        try {
            quantity = Math.multiplyExact(trade.quantity(), ratio);
        } catch (ArithmeticException e) {
            throw new InvalidRecordException(null, null, String.format(
                    "Split of %s by %d overflows quantity %d of trade %s", symbol, ratio, trade.quantity(),
                    trade.tradeId()), e);
        }
        BigDecimal divisor = BigDecimal.valueOf(ratio);
        return new Trade(trade.tradeId(), trade.timestamp(), trade.side(), trade.symbol(), quantity,
                trade.unitPrice().divide(divisor, MathContext.DECIMAL128).stripTrailingZeros());
    }
}
