package io.taxlots.infrastructure.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.taxlots.application.port.output.TaxReportSink;
import io.taxlots.domain.cash.CashEvent;
import io.taxlots.domain.cash.DividendReconciliation;
import io.taxlots.domain.report.DividendIncome;
import io.taxlots.domain.report.SaleProfit;
import io.taxlots.domain.report.TaxReport;
import io.taxlots.domain.trade.Forfeiture;
import io.taxlots.domain.trade.LotEvent;
import io.taxlots.domain.trade.LotFragment;
import io.taxlots.domain.trade.Trade;
import io.taxlots.service.money.MoneyMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a {@link TaxReport} as JSON.
 *
 * Money is rounded to two decimals here (and only here); prices, rates and
 * quantities are written as-is. Dates are ISO strings.
 */
public final class JsonTaxReportWriter implements TaxReportSink {
    private static final Logger log = LoggerFactory.getLogger(JsonTaxReportWriter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

    private final Path output;

    public JsonTaxReportWriter(Path output) {
        this.output = output;
    }

    @Override
    public void write(TaxReport report) {
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            write(report, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report to " + output, e);
        }
        log.info("[JsonTaxReportWriter] Report written to {}", output);
    }

    public void write(TaxReport report, Writer writer) throws IOException {
        MAPPER.writeValue(writer, toJson(report));
    }

    static ObjectNode toJson(TaxReport report) {
        ObjectNode root = MAPPER.createObjectNode();

        ArrayNode sales = root.putArray("sales");
        for (SaleProfit sale : report.sales()) {
            sales.add(sale(sale));
        }

        ArrayNode forfeitures = root.putArray("forfeitures");
        for (Forfeiture forfeiture : report.forfeitures()) {
            ObjectNode node = trade(forfeiture.forfeit());
            node.set("fragments", fragments(forfeiture.fragments()));
            forfeitures.add(node);
        }

        ArrayNode lots = root.putArray("remainingLots");
        for (Trade lot : report.remainingLots()) {
            lots.add(trade(lot));
        }

        ArrayNode history = root.putArray("lotHistory");
        for (LotEvent event : report.lotHistory()) {
            history.add(lotEvent(event));
        }

        ArrayNode dividends = root.putArray("dividends");
        for (DividendIncome dividend : report.dividends()) {
            dividends.add(dividend(dividend));
        }

        ArrayNode orphans = root.putArray("orphanWithholdings");
        for (CashEvent orphan : report.orphanWithholdings()) {
            orphans.add(cashEvent(orphan));
        }

        ObjectNode totals = root.putObject("totals");
        totals.put("proceeds", money(report.totalProceeds()));
        totals.put("costBasis", money(report.totalCostBasis()));
        totals.put("profit", money(report.totalProfit()));
        totals.put("reportingProfit", money(report.totalReportingProfit()));
        totals.put("dividends", money(report.totalDividends()));
        totals.put("withheld", money(report.totalWithheld()));
        totals.put("reportingDividends", money(report.totalReportingDividends()));
        totals.put("reportingWithheld", money(report.totalReportingWithheld()));

        return root;
    }

    private static ObjectNode sale(SaleProfit profit) {
        ObjectNode node = trade(profit.match().sale());
        node.put("rate", profit.saleRate());
        node.put("proceeds", money(profit.proceeds()));
        node.put("costBasis", money(profit.costBasis()));
        node.put("profit", money(profit.profit()));
        node.put("reportingProceeds", money(profit.reportingProceeds()));
        node.put("reportingCostBasis", money(profit.reportingCostBasis()));
        node.put("reportingProfit", money(profit.reportingProfit()));

        node.set("fragments", fragments(profit.match().fragments()));
        return node;
    }

    private static ArrayNode fragments(List<LotFragment> fragments) {
        ArrayNode array = MAPPER.createArrayNode();
        for (LotFragment fragment : fragments) {
            ObjectNode f = array.addObject();
            f.put("buyTradeId", fragment.buyTradeId());
            f.set("timestamp", temporal(fragment.timestamp()));
            f.put("quantity", fragment.quantity());
            f.put("unitPrice", fragment.unitPrice());
            f.put("cost", money(fragment.cost()));
        }
        return array;
    }

    private static ObjectNode lotEvent(LotEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.set("timestamp", temporal(event.timestamp()));
        node.put("symbol", event.symbol());
        node.put("type", event.type().name());
        node.put("tradeId", event.tradeId());
        node.put("lotTradeId", event.lotTradeId());
        node.put("change", event.change());
        node.put("lotPrice", event.lotPrice());
        if (event.salePrice() != null) {
            node.put("salePrice", event.salePrice());
            node.put("gain", money(event.gain()));
        }
        node.put("balance", event.balance());
        return node;
    }

    private static ObjectNode trade(Trade trade) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("tradeId", trade.tradeId());
        node.set("timestamp", temporal(trade.timestamp()));
        node.put("side", trade.side().name());
        node.put("symbol", trade.symbol());
        node.put("quantity", trade.quantity());
        node.put("unitPrice", trade.unitPrice());
        return node;
    }

    private static ObjectNode dividend(DividendIncome income) {
        DividendReconciliation reconciliation = income.reconciliation();
        ObjectNode node = cashEvent(reconciliation.dividend());
        node.put("rate", income.rate());
        node.put("gross", money(reconciliation.gross()));
        node.put("withheld", money(reconciliation.withheld()));
        node.put("net", money(reconciliation.net()));
        node.put("reportingGross", money(income.reportingGross()));
        node.put("reportingWithheld", money(income.reportingWithheld()));
        node.put("reportingNet", money(income.reportingNet()));

        ArrayNode withholdings = node.putArray("withholdings");
        for (CashEvent withholding : reconciliation.withholdings()) {
            withholdings.add(cashEvent(withholding));
        }
        return node;
    }

    private static ObjectNode cashEvent(CashEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.set("date", temporal(event.date()));
        node.put("symbol", event.symbol());
        node.put("type", event.type().name());
        node.put("amount", event.amount());
        node.put("description", event.description());
        return node;
    }

    private static JsonNode temporal(Object value) {
        return MAPPER.valueToTree(value);
    }

    private static BigDecimal money(BigDecimal amount) {
        return MoneyMath.toReportScale(amount);
    }
}
