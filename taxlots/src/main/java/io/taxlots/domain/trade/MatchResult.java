package io.taxlots.domain.trade;

import java.util.List;

/**
 * Output of FIFO matching.
 *
 * @param sales         one entry per sale, in input order
 * @param forfeitures   one entry per forfeit, in input order
 * @param remainingLots unconsumed buy lots carrying their remaining quantity
 * @param history       buys and per-lot disposals in chronological order, with running balance
 */
public record MatchResult(
        List<SaleMatch> sales,
        List<Forfeiture> forfeitures,
        List<Trade> remainingLots,
        List<LotEvent> history) {

    public MatchResult {
        sales = List.copyOf(sales);
        forfeitures = List.copyOf(forfeitures);
        remainingLots = List.copyOf(remainingLots);
        history = List.copyOf(history);
    }

    public int remainingQuantity(String symbol) {
        return remainingLots.stream()
                .filter(lot -> lot.symbol().equals(symbol))
                .mapToInt(Trade::quantity)
                .sum();
    }
}
