package io.taxlots.domain.report;

import io.taxlots.domain.cash.CashEvent;
import io.taxlots.domain.trade.Forfeiture;
import io.taxlots.domain.trade.LotEvent;
import io.taxlots.domain.trade.Trade;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

/**
 * Everything a batch run produces, in full precision.
 */
public record TaxReport(
        List<SaleProfit> sales,
        List<Forfeiture> forfeitures,
        List<Trade> remainingLots,
        List<LotEvent> lotHistory,
        List<DividendIncome> dividends,
        List<CashEvent> orphanWithholdings) {

    public TaxReport {
        sales = List.copyOf(sales);
        forfeitures = List.copyOf(forfeitures);
        remainingLots = List.copyOf(remainingLots);
        lotHistory = List.copyOf(lotHistory);
        dividends = List.copyOf(dividends);
        orphanWithholdings = List.copyOf(orphanWithholdings);
    }

    public BigDecimal totalProceeds() {
        return sum(sales, SaleProfit::proceeds);
    }

    public BigDecimal totalCostBasis() {
        return sum(sales, SaleProfit::costBasis);
    }

    public BigDecimal totalProfit() {
        return sum(sales, SaleProfit::profit);
    }

    public BigDecimal totalReportingProfit() {
        return sum(sales, SaleProfit::reportingProfit);
    }

    public BigDecimal totalDividends() {
        return sum(dividends, d -> d.reconciliation().gross());
    }

    public BigDecimal totalWithheld() {
        return sum(dividends, d -> d.reconciliation().withheld());
    }

    public BigDecimal totalReportingDividends() {
        return sum(dividends, DividendIncome::reportingGross);
    }

    public BigDecimal totalReportingWithheld() {
        return sum(dividends, DividendIncome::reportingWithheld);
    }

    private static <T> BigDecimal sum(List<T> items, Function<T, BigDecimal> field) {
        return items.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
