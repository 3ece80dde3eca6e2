package io.taxlots.infrastructure.ib;

import io.taxlots.application.port.output.ActivityReportSource;
import io.taxlots.domain.cash.CashEvent;
import io.taxlots.domain.cash.CashEventType;
import io.taxlots.domain.report.TaxInput;
import io.taxlots.domain.trade.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Loads every IB activity statement ({@code *.csv}) in a directory.
 *
 * Files are read in name order. Trades are sorted by (timestamp, symbol) and cash
 * events by (date, symbol); the sorts are stable so same-key rows keep file order.
 */
public final class IbReportDirectorySource implements ActivityReportSource {
    private static final Logger log = LoggerFactory.getLogger(IbReportDirectorySource.class);

    private static final Comparator<Trade> TRADE_ORDER =
            Comparator.comparing(Trade::timestamp).thenComparing(Trade::symbol);
    private static final Comparator<CashEvent> CASH_ORDER =
            Comparator.comparing(CashEvent::date).thenComparing(CashEvent::symbol);

    private final Path directory;
    private final IbActivityReportParser parser;
    private final IbRecordMapper mapper;

    public IbReportDirectorySource(Path directory, IbActivityReportParser parser, IbRecordMapper mapper) {
        this.directory = directory;
        this.parser = parser;
        this.mapper = mapper;
    }

    @Override
    public TaxInput load() {
        List<Path> files = listReports();
        log.info("[IbReportDirectorySource] Loading {} statements from {}", files.size(), directory);

        List<Trade> trades = new ArrayList<>();
        List<CashEvent> dividends = new ArrayList<>();
        List<CashEvent> withholdings = new ArrayList<>();

        for (Path file : files) {
            IbActivityReport report = parser.parse(file);

            int before = trades.size();
            for (IbRecord record : report.table(IbActivityReport.TRADES)) {
                mapper.toTrade(record).ifPresent(trades::add);
            }
            for (IbRecord record : report.table(IbActivityReport.DIVIDENDS)) {
                dividends.add(mapper.toCashEvent(record, CashEventType.DIVIDEND));
            }
            for (IbRecord record : report.table(IbActivityReport.WITHHOLDING_TAX)) {
                withholdings.add(mapper.toCashEvent(record, CashEventType.WITHHOLDING));
            }

            log.info("[IbReportDirectorySource] {}: {} trades", file.getFileName(), trades.size() - before);
        }

        trades.sort(TRADE_ORDER);
        dividends.sort(CASH_ORDER);
        withholdings.sort(CASH_ORDER);

        log.info("[IbReportDirectorySource] Loaded {} trades, {} dividends, {} withholdings",
                trades.size(), dividends.size(), withholdings.size());

        return new TaxInput(trades, dividends, withholdings);
    }

    private List<Path> listReports() {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list statements in " + directory, e);
        }
    }
}
