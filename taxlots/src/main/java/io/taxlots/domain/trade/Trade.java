package io.taxlots.domain.trade;

import io.taxlots.domain.common.InvalidRecordException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A single executed trade in the trade currency.
 *
 * Buys double as lots: a buy's quantity is what the lot matcher can consume.
 * Sells and forfeits are disposals; a forfeit consumes lots without proceeds.
 * The record is immutable; partial consumption is expressed through
 * {@link #withQuantity(int)} copies, never by changing a caller's instance.
 */
public record Trade(
        String tradeId,
        LocalDateTime timestamp,
        TradeSide side,
        String symbol,
        int quantity,
        BigDecimal unitPrice) {

    public Trade {
        if (tradeId == null || tradeId.isBlank()) {
            throw new InvalidRecordException("Trade id is required");
        }
        if (timestamp == null) {
            throw new InvalidRecordException("Trade " + tradeId + " has no timestamp");
        }
        if (side == null) {
            throw new InvalidRecordException("Trade " + tradeId + " has no side");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidRecordException("Trade " + tradeId + " has no symbol");
        }
        if (quantity <= 0) {
            throw new InvalidRecordException("Trade " + tradeId + " quantity must be positive: " + quantity);
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new InvalidRecordException("Trade " + tradeId + " price must be non-negative: " + unitPrice);
        }
    }

    public static Trade buy(String tradeId, LocalDateTime timestamp, String symbol, int quantity, BigDecimal unitPrice) {
        return new Trade(tradeId, timestamp, TradeSide.BUY, symbol, quantity, unitPrice);
    }

    public static Trade sell(String tradeId, LocalDateTime timestamp, String symbol, int quantity, BigDecimal unitPrice) {
        return new Trade(tradeId, timestamp, TradeSide.SELL, symbol, quantity, unitPrice);
    }

    /**
     * Forfeit of {@code quantity} shares; carries a zero price.
     */
    public static Trade forfeit(String tradeId, LocalDateTime timestamp, String symbol, int quantity) {
        return new Trade(tradeId, timestamp, TradeSide.FORFEIT, symbol, quantity, BigDecimal.ZERO);
    }

    public boolean isBuy() {
        return side == TradeSide.BUY;
    }

    public boolean isSell() {
        return side == TradeSide.SELL;
    }

    public boolean isForfeit() {
        return side == TradeSide.FORFEIT;
    }

    public LocalDate tradeDate() {
        return timestamp.toLocalDate();
    }

    /**
     * Quantity times unit price, full precision.
     */
    public BigDecimal value() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    /**
     * Copy of this trade with a different quantity.
     */
    public Trade withQuantity(int newQuantity) {
        return new Trade(tradeId, timestamp, side, symbol, newQuantity, unitPrice);
    }

    @Override
    public String toString() {
        return String.format("%s %s %d %s @ %s", timestamp.toLocalDate(), side, quantity, symbol,
                unitPrice.toPlainString());
    }
}
