package io.taxlots.bootstrap;

import io.taxlots.application.service.TaxReportJob;
import io.taxlots.domain.common.TaxDataException;
import io.taxlots.domain.report.DividendIncome;
import io.taxlots.domain.report.SaleProfit;
import io.taxlots.domain.report.TaxReport;
import io.taxlots.domain.trade.Forfeiture;
import io.taxlots.domain.trade.LotFragment;
import io.taxlots.domain.trade.Trade;
import io.taxlots.infrastructure.fx.TabSeparatedRateFeed;
import io.taxlots.infrastructure.ib.IbActivityReportParser;
import io.taxlots.infrastructure.ib.IbRecordMapper;
import io.taxlots.infrastructure.ib.IbReportDirectorySource;
import io.taxlots.infrastructure.report.JsonTaxReportWriter;
import io.taxlots.security.InputValidator;
import io.taxlots.service.dividend.DividendReconciler;
import io.taxlots.service.lot.FifoLotMatcher;
import io.taxlots.service.report.RealizedGainCalculator;
import io.taxlots.service.report.TaxReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;

import static io.taxlots.service.money.MoneyMath.format;
import static io.taxlots.service.money.MoneyMath.toReportScale;

/**
 * Batch entry point.
 *
 * Reads all IB statements from TAXLOTS_REPORTS_DIR, values them with the rate
 * feed at TAXLOTS_RATE_FEED, logs a summary and writes the JSON report to
 * TAXLOTS_OUTPUT. Exits with status 1 on any data or configuration error.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== taxlots: FIFO realized gains and dividend report ===");
        log.info("═══════════════════════════════════════════════════════════════");

        try {
            AppConfig config = AppConfig.fromEnv();
            InputValidator validator = new InputValidator();
            StartupConfigValidator.validate(config, validator);

            TaxReport report = createJob(config, validator).run();
            logSummary(report);
        } catch (TaxDataException e) {
            log.error("❌ Input data error, correct the record and run again: {}", e.getMessage());
            System.exit(1);
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            log.error("❌ {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static TaxReportJob createJob(AppConfig config, InputValidator validator) {
        IbRecordMapper mapper = new IbRecordMapper(config.tradeCurrency(), config.splits(), validator);
        TaxReportService reportService = new TaxReportService(
                new FifoLotMatcher(),
                new DividendReconciler(),
                new RealizedGainCalculator(),
                config.matchParallelism());

        return new TaxReportJob(
                new IbReportDirectorySource(config.reportsDir(), new IbActivityReportParser(), mapper),
                new TabSeparatedRateFeed(config.rateFeed()),
                reportService,
                new JsonTaxReportWriter(config.output()));
    }

    private static void logSummary(TaxReport report) {
        log.info("Sales ({}):", report.sales().size());
        for (SaleProfit sale : report.sales()) {
            Trade trade = sale.match().sale();
            log.info("  {} {} {} x {}", trade.tradeDate(), trade.symbol(), trade.quantity(), format(trade.unitPrice(), "$"));
            log.info("    Income: {} // {} (rate {})",
                    format(sale.proceeds(), "$"), toReportScale(sale.reportingProceeds()), sale.saleRate());
            for (LotFragment fragment : sale.match().fragments()) {
                log.info("    * {} {} x {}", fragment.buyDate(), fragment.quantity(), format(fragment.unitPrice(), "$"));
            }
            log.info("    Profit: {} // {}", format(sale.profit(), "$"), toReportScale(sale.reportingProfit()));
        }

        if (!report.forfeitures().isEmpty()) {
            log.info("Forfeits ({}):", report.forfeitures().size());
            for (Forfeiture forfeiture : report.forfeitures()) {
                log.info("  {}", forfeiture.forfeit());
                for (LotFragment fragment : forfeiture.fragments()) {
                    log.info("    * {} {} x {}", fragment.buyDate(), fragment.quantity(), format(fragment.unitPrice(), "$"));
                }
            }
        }

        if (report.remainingLots().isEmpty()) {
            log.info("Buy lots left: (none)");
        } else {
            log.info("Buy lots left:");
            report.remainingLots().forEach(lot -> log.info("  {}", lot));
        }

        log.info("Dividends ({}):", report.dividends().size());
        for (DividendIncome dividend : report.dividends()) {
            log.info("  {} {} gross {} withheld {} // gross {} withheld {}",
                    dividend.reconciliation().dividend().date(),
                    dividend.reconciliation().dividend().symbol(),
                    format(dividend.reconciliation().gross(), "$"),
                    format(dividend.reconciliation().withheld(), "$"),
                    toReportScale(dividend.reportingGross()),
                    toReportScale(dividend.reportingWithheld()));
        }
        if (!report.orphanWithholdings().isEmpty()) {
            log.warn("⚠️  {} withholding entries have no matching dividend", report.orphanWithholdings().size());
        }

        log.info("Total profit: {} // {}", format(report.totalProfit(), "$"), toReportScale(report.totalReportingProfit()));
        log.info("Total dividends: {} // {}, withheld {} // {}",
                format(report.totalDividends(), "$"), toReportScale(report.totalReportingDividends()),
                format(report.totalWithheld(), "$"), toReportScale(report.totalReportingWithheld()));
    }

    private App() {}
}
