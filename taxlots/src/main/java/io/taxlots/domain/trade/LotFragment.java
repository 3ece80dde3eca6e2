package io.taxlots.domain.trade;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Part of a buy lot consumed by one sale.
 *
 * Keeps the buy's own price and timestamp so the cost leg can be valued
 * at the exchange rate of the purchase date.
 */
public record LotFragment(
        String buyTradeId,
        int quantity,
        BigDecimal unitPrice,
        LocalDateTime timestamp) {

    public static LotFragment of(Trade buy, int quantity) {
        return new LotFragment(buy.tradeId(), quantity, buy.unitPrice(), buy.timestamp());
    }

    public LocalDate buyDate() {
        return timestamp.toLocalDate();
    }

    /**
     * Cost of this fragment in trade currency: price * quantity.
     */
    public BigDecimal cost() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
