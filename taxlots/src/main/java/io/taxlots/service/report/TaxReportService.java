package io.taxlots.service.report;

import io.taxlots.domain.cash.ReconciliationResult;
import io.taxlots.domain.report.DividendIncome;
import io.taxlots.domain.report.SaleProfit;
import io.taxlots.domain.report.TaxInput;
import io.taxlots.domain.report.TaxReport;
import io.taxlots.domain.trade.MatchResult;
import io.taxlots.service.dividend.DividendReconciler;
import io.taxlots.service.fx.ExchangeRateTable;
import io.taxlots.service.lot.FifoLotMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the tax computation for one batch: FIFO matching, dividend reconciliation,
 * then valuation against the rate table.
 *
 * With parallelism above 1, symbols are matched on a short-lived fixed pool.
 * Any {@link io.taxlots.domain.common.TaxDataException} ends the computation.
 */
public final class TaxReportService {
    private static final Logger log = LoggerFactory.getLogger(TaxReportService.class);

    private final FifoLotMatcher lotMatcher;
    private final DividendReconciler dividendReconciler;
    private final RealizedGainCalculator gainCalculator;
    private final int parallelism;

    public TaxReportService() {
        this(new FifoLotMatcher(), new DividendReconciler(), new RealizedGainCalculator(), 1);
    }

    public TaxReportService(FifoLotMatcher lotMatcher,
                            DividendReconciler dividendReconciler,
                            RealizedGainCalculator gainCalculator,
                            int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
        this.lotMatcher = lotMatcher;
        this.dividendReconciler = dividendReconciler;
        this.gainCalculator = gainCalculator;
        this.parallelism = parallelism;
    }

    public TaxReport compute(TaxInput input, ExchangeRateTable rates) {
        log.info("[TaxReportService] Computing report: {} trades, {} dividends, {} withholdings",
                input.trades().size(), input.dividends().size(), input.withholdings().size());

        MatchResult matched = match(input);
        ReconciliationResult reconciled = dividendReconciler.reconcile(input.dividends(), input.withholdings());

        List<SaleProfit> sales = matched.sales().stream()
                .map(sale -> gainCalculator.calculate(sale, rates))
                .toList();
        List<DividendIncome> dividends = reconciled.records().stream()
                .map(record -> gainCalculator.calculate(record, rates))
                .toList();

        TaxReport report = new TaxReport(sales, matched.forfeitures(), matched.remainingLots(), matched.history(),
                dividends, reconciled.orphanWithholdings());

        log.info("[TaxReportService] {} sales, {} forfeits, {} open lots, {} dividends, {} orphan withholdings",
                sales.size(), report.forfeitures().size(), report.remainingLots().size(), dividends.size(),
                report.orphanWithholdings().size());

        return report;
    }

    private MatchResult match(TaxInput input) {
        if (parallelism == 1) {
            return lotMatcher.match(input.trades());
        }

        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "lot-matcher-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            return lotMatcher.matchBySymbol(input.trades(), executor);
        } finally {
            executor.shutdownNow();
        }
    }
}
