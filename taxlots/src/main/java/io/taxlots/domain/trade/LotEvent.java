package io.taxlots.domain.trade;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One entry of the per-symbol FIFO ledger.
 *
 * A buy adds one event for the whole lot. A disposal adds one event per lot it drew
 * from, with a negative {@code change}. {@code balance} is the symbol's holding right
 * after this event in chronological order; it goes negative while a sale is waiting
 * for a lot bought later.
 *
 * @param tradeId    trade that caused the event
 * @param lotTradeId buy lot added or drawn from
 * @param lotPrice   unit price of that lot
 * @param salePrice  unit sale price, null unless {@code type} is SALE
 * @param gain       (salePrice - lotPrice) * quantity in trade currency, null unless SALE
 */
public record LotEvent(
        LocalDateTime timestamp,
        String symbol,
        LotEventType type,
        String tradeId,
        String lotTradeId,
        int change,
        BigDecimal lotPrice,
        BigDecimal salePrice,
        BigDecimal gain,
        int balance) {

    public boolean isDisposal() {
        return change < 0;
    }
}
