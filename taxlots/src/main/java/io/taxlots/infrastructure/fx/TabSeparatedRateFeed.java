package io.taxlots.infrastructure.fx;

import io.taxlots.application.port.output.RateSampleSource;
import io.taxlots.domain.common.InvalidRecordException;
import io.taxlots.domain.fx.RateSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily rate feed as exported from the central bank's rate dynamics page.
 *
 * Format: one sample per line, {@code dd.MM.yyyy<TAB>rate}, oldest first.
 * Rates use a decimal comma and may contain (non-breaking) spaces as digit
 * group separators:
 * <pre>
 * 27.07.2018{TAB}62,9471
 * 28.07.2018{TAB}63,0756
 * </pre>
 */
public final class TabSeparatedRateFeed implements RateSampleSource {
    private static final Logger log = LoggerFactory.getLogger(TabSeparatedRateFeed.class);

    static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private final Path file;

    public TabSeparatedRateFeed(Path file) {
        this.file = file;
    }

    @Override
    public List<RateSample> load() {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<RateSample> samples = parse(reader, file.getFileName().toString());
            log.info("[TabSeparatedRateFeed] Read {} samples from {}", samples.size(), file);
            return samples;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rate feed " + file, e);
        }
    }

    public static List<RateSample> parse(Reader input, String source) throws IOException {
        BufferedReader reader = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);
        List<RateSample> samples = new ArrayList<>();

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            samples.add(parseLine(line, source, lineNumber));
        }
        return samples;
    }

    static RateSample parseLine(String line, String source, int lineNumber) {
        String[] parts = line.split("\t");
        if (parts.length != 2) {
            throw new InvalidRecordException(source, "line " + lineNumber,
                    "Expected <date><TAB><rate>, got '" + line + "'");
        }

        LocalDate date;
        try {
            date = LocalDate.parse(parts[0].trim(), DATE);
        } catch (DateTimeParseException e) {
            throw new InvalidRecordException(source, "line " + lineNumber, "Unparseable date '" + parts[0] + "'");
        }

        String normalized = parts[1].replace(',', '.').replace(" ", "").replace("\u00A0", "").trim();
        BigDecimal rate;
        try {
            rate = new BigDecimal(normalized);
        } catch (NumberFormatException e) {
            throw new InvalidRecordException(source, "line " + lineNumber, "Unparseable rate '" + parts[1] + "'");
        }

        try {
            return new RateSample(date, rate);
        } catch (InvalidRecordException e) {
            throw new InvalidRecordException(source, "line " + lineNumber, e.getMessage());
        }
    }
}
