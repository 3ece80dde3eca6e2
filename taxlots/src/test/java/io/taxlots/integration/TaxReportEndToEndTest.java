package io.taxlots.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.taxlots.application.service.TaxReportJob;
import io.taxlots.domain.report.SaleProfit;
import io.taxlots.domain.report.TaxReport;
import io.taxlots.domain.trade.SplitAdjustment;
import io.taxlots.domain.trade.Trade;
import io.taxlots.infrastructure.fx.TabSeparatedRateFeed;
import io.taxlots.infrastructure.ib.IbActivityReportParser;
import io.taxlots.infrastructure.ib.IbRecordMapper;
import io.taxlots.infrastructure.ib.IbReportDirectorySource;
import io.taxlots.infrastructure.report.JsonTaxReportWriter;
import io.taxlots.security.InputValidator;
import io.taxlots.service.dividend.DividendReconciler;
import io.taxlots.service.fx.ExchangeRateTable;
import io.taxlots.service.lot.FifoLotMatcher;
import io.taxlots.service.money.MoneyMath;
import io.taxlots.service.report.RealizedGainCalculator;
import io.taxlots.service.report.TaxReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full run over two years of statements: parse, split-adjust, match, value, write.
 */
@DisplayName("Tax Report End-to-End Tests")
public class TaxReportEndToEndTest {

    @TempDir
    Path tempDir;

    private Path reports;
    private Path rateFeed;
    private Path output;

    @BeforeEach
    public void setUp() throws Exception {
        reports = Paths.get(getClass().getResource("/ib_reports").toURI());
        rateFeed = Paths.get(getClass().getResource("/rates/usd_rub.dat").toURI());
        output = tempDir.resolve("tax-report.json");
    }

    private TaxReportJob job(int parallelism) {
        IbRecordMapper mapper = new IbRecordMapper("USD",
            List.of(SplitAdjustment.parse("SGOL:2019-12-24:10")), new InputValidator());
        return new TaxReportJob(
            new IbReportDirectorySource(reports, new IbActivityReportParser(), mapper),
            new TabSeparatedRateFeed(rateFeed),
            new TaxReportService(new FifoLotMatcher(), new DividendReconciler(), new RealizedGainCalculator(), parallelism),
            new JsonTaxReportWriter(output));
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Sales are matched FIFO across years and valued per leg")
    public void testSales() {
        TaxReport report = job(1).run();

        List<SaleProfit> sales = report.sales();
        assertEquals(3, sales.size());

        SaleProfit voo2019 = sales.get(0);
        assertEquals("VOO", voo2019.match().symbol());
        assertEquals(4, voo2019.match().amount());
        assertAmount("105.60", voo2019.profit());
        assertAmount("72160.0478", voo2019.reportingProceeds());
        assertAmount("67202.72768", voo2019.reportingCostBasis());
        assertAmount("4957.32012", voo2019.reportingProfit());

        SaleProfit sgol = sales.get(1);
        assertEquals("SGOL", sgol.match().symbol());
        assertEquals(20, sgol.match().amount());
        assertEquals("U1234567_2019.csv#8", sgol.match().fragments().get(0).buyTradeId());
        assertAmount("55.20", sgol.profit());
        assertAmount("19258.7816", sgol.reportingProceeds());
        assertAmount("15964.258", sgol.reportingCostBasis());
        assertAmount("3294.5236", sgol.reportingProfit());

        SaleProfit voo2020 = sales.get(2);
        assertEquals(6, voo2020.match().amount());
        assertAmount("269.40", voo2020.profit());
        assertAmount("114787.44", voo2020.reportingProceeds());
        assertAmount("100804.09152", voo2020.reportingCostBasis());
        assertAmount("13983.34848", voo2020.reportingProfit());

        assertAmount("430.20", report.totalProfit());
        assertAmount("22235.1922", report.totalReportingProfit());
        assertEquals(new BigDecimal("22235.19"), MoneyMath.toReportScale(report.totalReportingProfit()));
    }

    @Test
    @DisplayName("Split-adjusted lot stays open after partial sale")
    public void testRemainingLots() {
        TaxReport report = job(1).run();

        assertEquals(1, report.remainingLots().size());
        Trade lot = report.remainingLots().get(0);
        assertEquals("SGOL", lot.symbol());
        assertEquals(10, lot.quantity());
        assertAmount("12.34", lot.unitPrice());
        assertEquals("U1234567_2019.csv#8", lot.tradeId());
    }

    @Test
    @DisplayName("Dividends reconcile with withholdings, orphans are reported")
    public void testDividends() {
        TaxReport report = job(1).run();

        assertEquals(2, report.dividends().size());
        assertAmount("27.85", report.totalDividends());
        assertAmount("2.79", report.totalWithheld());
        assertEquals(new BigDecimal("1782.05"), MoneyMath.toReportScale(report.totalReportingDividends()));
        assertEquals(new BigDecimal("178.53"), MoneyMath.toReportScale(report.totalReportingWithheld()));

        assertEquals(1, report.orphanWithholdings().size());
        assertEquals("SGOL", report.orphanWithholdings().get(0).symbol());
    }

    @Test
    @DisplayName("Parallel matching produces the same report")
    public void testParallelRun() {
        TaxReport sequential = job(1).run();
        TaxReport parallel = job(3).run();

        assertEquals(sequential.sales(), parallel.sales());
        assertEquals(sequential.remainingLots(), parallel.remainingLots());
    }

    @Test
    @DisplayName("Report file carries rounded totals")
    public void testReportFile() throws Exception {
        job(1).run();

        JsonNode tree = new ObjectMapper().readTree(Files.readString(output));
        assertEquals(3, tree.get("sales").size());
        assertAmount("430.20", tree.get("totals").get("profit").decimalValue());
        assertAmount("22235.19", tree.get("totals").get("reportingProfit").decimalValue());
        assertEquals(1, tree.get("orphanWithholdings").size());
    }

    @Test
    @DisplayName("Holiday gap uses the last published rate")
    public void testHolidayRate() throws Exception {
        ExchangeRateTable table = ExchangeRateTable.build(new TabSeparatedRateFeed(rateFeed).load());

        assertEquals(new BigDecimal("61.9057"), table.rateFor(LocalDate.of(2020, 1, 5)));
        assertEquals(LocalDate.of(2018, 7, 27), table.firstDate());
        assertEquals(LocalDate.of(2020, 2, 10), table.lastDate());
    }
}
