package io.taxlots.service.lot;

import io.taxlots.domain.trade.Forfeiture;
import io.taxlots.domain.trade.LotEvent;
import io.taxlots.domain.trade.LotEventType;
import io.taxlots.domain.trade.LotFragment;
import io.taxlots.domain.trade.MatchResult;
import io.taxlots.domain.trade.SaleMatch;
import io.taxlots.domain.trade.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * FIFO Lot Matcher - assigns every disposal the buy lots that funded it.
 *
 * Algorithm:
 * 1. Buys are copied into one FIFO queue per symbol, in input order.
 * 2. Disposals (sales and forfeits) are processed in input order.
 * 3. A disposal takes min(remaining, lot quantity) from the head lot of its symbol's
 *    queue until covered; exhausted lots leave the queue.
 * 4. Every buy of the symbol is eligible, whatever its date. If the queue runs dry
 *    first, the run fails with {@link InsufficientLotsException}.
 *
 * Sales become {@link SaleMatch}es; forfeits become {@link Forfeiture}s and realize nothing.
 * The result also carries the per-symbol lot ledger ({@link LotEvent}) in chronological order.
 *
 * Input order is the FIFO order: callers sort trades chronologically first.
 * Caller-owned trades are never modified; consumption happens on private working lots.
 *
 * Symbols are independent, so {@link #matchBySymbol(List, ExecutorService)} can match
 * them on a pool without any locking.
 */
public final class FifoLotMatcher {
    private static final Logger log = LoggerFactory.getLogger(FifoLotMatcher.class);

    /**
     * Match all disposals against buys, sequentially.
     *
     * @param trades chronologically ordered buys, sells and forfeits, any symbols
     * @return sales and forfeits in input order, unconsumed lots in input order, lot history
     * @throws InsufficientLotsException if a disposal exceeds the buys of its symbol
     */
    public MatchResult match(List<Trade> trades) {
        List<WorkingLot> lots = new ArrayList<>();
        Map<String, Deque<WorkingLot>> queues = new HashMap<>();
        List<Trade> disposals = new ArrayList<>();

        for (Trade trade : trades) {
            if (trade.isBuy()) {
                WorkingLot lot = new WorkingLot(trade);
                lots.add(lot);
                queues.computeIfAbsent(trade.symbol(), s -> new ArrayDeque<>()).addLast(lot);
            } else {
                disposals.add(trade);
            }
        }

        List<SaleMatch> sales = new ArrayList<>();
        List<Forfeiture> forfeitures = new ArrayList<>();
        for (Trade disposal : disposals) {
            Deque<WorkingLot> queue = queues.computeIfAbsent(disposal.symbol(), s -> new ArrayDeque<>());
            List<LotFragment> fragments = consume(disposal, queue);
            if (disposal.isForfeit()) {
                forfeitures.add(new Forfeiture(disposal, fragments));
            } else {
                sales.add(new SaleMatch(disposal, fragments));
            }
        }

        List<Trade> remaining = lots.stream()
                .filter(WorkingLot::isOpen)
                .map(WorkingLot::toTrade)
                .toList();

        log.debug("[FifoLotMatcher] Matched {} sales and {} forfeits against {} buys, {} lots remain",
                sales.size(), forfeitures.size(), lots.size(), remaining.size());

        return new MatchResult(sales, forfeitures, remaining, history(trades, sales, forfeitures));
    }

    /**
     * Match each symbol as an independent task on the given executor.
     *
     * Sales and forfeits come back in input order and the history is identical to
     * {@link #match(List)}. Remaining lots are ordered by buy timestamp (stable, so
     * equal timestamps keep input order per symbol).
     *
     * @throws InsufficientLotsException if any symbol has an unfunded disposal
     */
    public MatchResult matchBySymbol(List<Trade> trades, ExecutorService executor) {
        Map<String, List<Trade>> bySymbol = new LinkedHashMap<>();
        for (Trade trade : trades) {
            bySymbol.computeIfAbsent(trade.symbol(), s -> new ArrayList<>()).add(trade);
        }

        Map<String, Future<MatchResult>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, List<Trade>> entry : bySymbol.entrySet()) {
            List<Trade> symbolTrades = entry.getValue();
            futures.put(entry.getKey(), executor.submit(() -> match(symbolTrades)));
        }

        Map<String, MatchResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, Future<MatchResult>> entry : futures.entrySet()) {
            results.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
        }

        Map<String, Iterator<SaleMatch>> salesBySymbol = new HashMap<>();
        Map<String, Iterator<Forfeiture>> forfeituresBySymbol = new HashMap<>();
        results.forEach((symbol, result) -> {
            salesBySymbol.put(symbol, result.sales().iterator());
            forfeituresBySymbol.put(symbol, result.forfeitures().iterator());
        });

        List<SaleMatch> sales = new ArrayList<>();
        List<Forfeiture> forfeitures = new ArrayList<>();
        for (Trade trade : trades) {
            if (trade.isSell()) {
                sales.add(salesBySymbol.get(trade.symbol()).next());
            } else if (trade.isForfeit()) {
                forfeitures.add(forfeituresBySymbol.get(trade.symbol()).next());
            }
        }

        List<Trade> remaining = new ArrayList<>();
        results.values().forEach(result -> remaining.addAll(result.remainingLots()));
        remaining.sort(Comparator.comparing(Trade::timestamp));

        log.debug("[FifoLotMatcher] Matched {} symbols in parallel, {} sales, {} forfeits, {} lots remain",
                results.size(), sales.size(), forfeitures.size(), remaining.size());

        return new MatchResult(sales, forfeitures, remaining, history(trades, sales, forfeitures));
    }

    private List<LotFragment> consume(Trade disposal, Deque<WorkingLot> queue) {
        int toCover = disposal.quantity();
        List<LotFragment> fragments = new ArrayList<>();

        while (toCover > 0 && !queue.isEmpty()) {
            WorkingLot head = queue.peekFirst();

            int take = Math.min(toCover, head.quantity);
            fragments.add(LotFragment.of(head.source, take));
            head.quantity -= take;
            toCover -= take;

            if (!head.isOpen()) {
                queue.pollFirst();
            }
        }

        if (toCover > 0) {
            log.error("[FifoLotMatcher] {} {} of {} x{} short by {}",
                    disposal.side(), disposal.tradeId(), disposal.symbol(), disposal.quantity(), toCover);
            throw new InsufficientLotsException(disposal.symbol(), toCover, disposal);
        }

        return fragments;
    }

    /**
     * Chronological lot ledger: one event per buy, one per fragment of each disposal.
     * Buys are listed ahead of disposals sharing their timestamp.
     */
    private static List<LotEvent> history(List<Trade> trades, List<SaleMatch> sales, List<Forfeiture> forfeitures) {
        List<LotEvent> unbalanced = new ArrayList<>();
        for (Trade trade : trades) {
            if (trade.isBuy()) {
                unbalanced.add(new LotEvent(trade.timestamp(), trade.symbol(), LotEventType.BUY, trade.tradeId(),
                        trade.tradeId(), trade.quantity(), trade.unitPrice(), null, null, 0));
            }
        }
        for (SaleMatch sale : sales) {
            Trade trade = sale.sale();
            for (LotFragment fragment : sale.fragments()) {
                BigDecimal gain = trade.unitPrice().subtract(fragment.unitPrice())
                        .multiply(BigDecimal.valueOf(fragment.quantity()));
                unbalanced.add(new LotEvent(trade.timestamp(), trade.symbol(), LotEventType.SALE, trade.tradeId(),
                        fragment.buyTradeId(), -fragment.quantity(), fragment.unitPrice(), trade.unitPrice(), gain, 0));
            }
        }
        for (Forfeiture forfeiture : forfeitures) {
            Trade trade = forfeiture.forfeit();
            for (LotFragment fragment : forfeiture.fragments()) {
                unbalanced.add(new LotEvent(trade.timestamp(), trade.symbol(), LotEventType.FORFEITURE, trade.tradeId(),
                        fragment.buyTradeId(), -fragment.quantity(), fragment.unitPrice(), null, null, 0));
            }
        }

        // stable: equal timestamps keep buys first, then disposals in input order
        unbalanced.sort(Comparator.comparing(LotEvent::timestamp));

        Map<String, Integer> balances = new HashMap<>();
        List<LotEvent> history = new ArrayList<>(unbalanced.size());
        for (LotEvent event : unbalanced) {
            int balance = balances.merge(event.symbol(), event.change(), Integer::sum);
            history.add(new LotEvent(event.timestamp(), event.symbol(), event.type(), event.tradeId(),
                    event.lotTradeId(), event.change(), event.lotPrice(), event.salePrice(), event.gain(), balance));
        }
        return history;
    }

    private static MatchResult await(String symbol, Future<MatchResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while matching " + symbol, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Matching failed for " + symbol, cause);
        }
    }

    /**
     * Private copy of a buy whose quantity shrinks as disposals consume it.
     */
    private static final class WorkingLot {
        private final Trade source;
        private int quantity;

        WorkingLot(Trade source) {
            this.source = source;
            this.quantity = source.quantity();
        }

        boolean isOpen() {
            return quantity > 0;
        }

        Trade toTrade() {
            return quantity == source.quantity() ? source : source.withQuantity(quantity);
        }
    }
}
