package io.taxlots.infrastructure.ib;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.taxlots.domain.common.InvalidRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for Interactive Brokers activity statement CSV exports.
 *
 * The export is many tables in one file. Every row starts with the section name and
 * a row kind:
 * <pre>
 * Trades,Header,DataDiscriminator,Asset Category,Currency,Symbol,Date/Time,Quantity,T. Price,...
 * Trades,Data,Order,Stocks,USD,VOO,"2018-11-08, 09:33:38",5,257.72,...
 * Trades,SubTotal,,Stocks,USD,VOO,,5,,...
 * </pre>
 * A {@code Header} row sets the column names for the following {@code Data} rows of
 * its section (sections may repeat their header, rows are appended). Other row kinds
 * ({@code Total}, {@code SubTotal}, {@code Notes}) are ignored, as are the
 * {@code Total} lines of the dividend and withholding sections.
 *
 * Rows are tokenized by Jackson's CSV reader, so quoted values may hold commas,
 * doubled quotes and line breaks. Records are numbered by CSV row; empty lines are
 * not counted.
 */
public final class IbActivityReportParser {
    private static final Logger log = LoggerFactory.getLogger(IbActivityReportParser.class);

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
    private static final ObjectReader ROW_READER = CSV_MAPPER.readerForListOf(String.class)
            .with(CsvSchema.emptySchema());

    private static final String HEADER = "Header";
    private static final String DATA = "Data";
    private static final String TOTAL_CURRENCY = "Total";
    private static final int BOM = '\uFEFF';

    public IbActivityReport parse(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader, file.getFileName().toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read activity statement " + file, e);
        }
    }

    public IbActivityReport parse(Reader input, String source) {
        Map<String, List<IbRecord>> tables = new LinkedHashMap<>();
        Map<String, List<String>> headers = new HashMap<>();

        int rowNumber = 0;
        try (MappingIterator<List<String>> rows = ROW_READER.readValues(skipByteOrderMark(input))) {
            while (rows.hasNextValue()) {
                List<String> row = rows.nextValue();
                rowNumber++;
                if (row.size() < 2) {
                    continue;
                }

                String table = row.get(0);
                String kind = row.get(1);

                if (HEADER.equals(kind)) {
                    headers.put(table, row);
                    tables.computeIfAbsent(table, t -> new ArrayList<>());
                } else if (DATA.equals(kind)) {
                    List<String> keys = headers.get(table);
                    if (keys == null) {
                        throw new InvalidRecordException(source, "row " + rowNumber,
                                "Data row for section '" + table + "' before its header");
                    }
                    IbRecord record = new IbRecord(source, rowNumber, zip(keys, row));
                    if (isTotalLine(table, record)) {
                        continue;
                    }
                    tables.get(table).add(record);
                }
            }
        } catch (JsonProcessingException e) {
            throw new InvalidRecordException(source, "row " + (rowNumber + 1),
                    "Malformed CSV: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source + " after row " + rowNumber, e);
        }

        log.debug("[IbActivityReportParser] {}: {} rows, sections {}", source, rowNumber, tables.keySet());
        return new IbActivityReport(source, tables);
    }

    private static Reader skipByteOrderMark(Reader input) throws IOException {
        PushbackReader reader = new PushbackReader(input, 1);
        int first = reader.read();
        if (first != -1 && first != BOM) {
            reader.unread(first);
        }
        return reader;
    }

    private static boolean isTotalLine(String table, IbRecord record) {
        boolean cashSection = IbActivityReport.DIVIDENDS.equals(table) || IbActivityReport.WITHHOLDING_TAX.equals(table);
        return cashSection && TOTAL_CURRENCY.equals(record.get("Currency"));
    }

    private static Map<String, String> zip(List<String> keys, List<String> values) {
        Map<String, String> fields = new HashMap<>();
        int n = Math.min(keys.size(), values.size());
        for (int i = 0; i < n; i++) {
            fields.putIfAbsent(keys.get(i), values.get(i));
        }
        return fields;
    }
}
