package io.taxlots.domain.report;

import io.taxlots.domain.cash.CashEvent;
import io.taxlots.domain.trade.Trade;

import java.util.List;

/**
 * Normalized records handed from the ingestion boundary to the tax computation.
 *
 * Trades must already be in chronological order; FIFO treatment follows list order.
 */
public record TaxInput(
        List<Trade> trades,
        List<CashEvent> dividends,
        List<CashEvent> withholdings) {

    public TaxInput {
        trades = List.copyOf(trades);
        dividends = List.copyOf(dividends);
        withholdings = List.copyOf(withholdings);
    }

    public static TaxInput tradesOnly(List<Trade> trades) {
        return new TaxInput(trades, List.of(), List.of());
    }
}
