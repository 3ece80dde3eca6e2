package io.taxlots.service.lot;

import io.taxlots.domain.common.TaxDataException;
import io.taxlots.domain.trade.Trade;

/**
 * Exception thrown when a sale cannot be fully funded by buys of the same symbol.
 *
 * Usually means the input is incomplete (a missing transfer-in or an earlier statement
 * that was not loaded). The run stops; nothing is partially filled.
 */
public class InsufficientLotsException extends TaxDataException {

    private final String symbol;
    private final int shortfall;
    private final Trade sale;

    public InsufficientLotsException(String symbol, int shortfall, Trade sale) {
        super(String.format("[%s] Not enough buy lots to fund sale %s (%s): short by %d",
                symbol, sale.tradeId(), sale, shortfall));
        this.symbol = symbol;
        this.shortfall = shortfall;
        this.sale = sale;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getShortfall() {
        return shortfall;
    }

    public Trade getSale() {
        return sale;
    }
}
