package io.taxlots.service.fx;

import io.taxlots.domain.common.InvalidRecordException;
import io.taxlots.domain.fx.RateSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily exchange-rate table built from a sparse feed.
 *
 * Rates are published on business days only. A published rate holds until the next
 * publication, so every day inside a gap carries the rate of the sample before it
 * (forward fill, no interpolation). Days before the first sample or after the last
 * sample have no rate.
 *
 * Built once per run and shared read-only; safe for concurrent lookups.
 */
public final class ExchangeRateTable {
    private static final Logger log = LoggerFactory.getLogger(ExchangeRateTable.class);

    private static final ExchangeRateTable EMPTY = new ExchangeRateTable(Map.of(), null, null);

    private final Map<LocalDate, BigDecimal> rates;
    private final LocalDate firstDate;
    private final LocalDate lastDate;

    private ExchangeRateTable(Map<LocalDate, BigDecimal> rates, LocalDate firstDate, LocalDate lastDate) {
        this.rates = rates;
        this.firstDate = firstDate;
        this.lastDate = lastDate;
    }

    public static ExchangeRateTable empty() {
        return EMPTY;
    }

    /**
     * Build the daily table.
     *
     * @param samples samples in strictly increasing date order
     * @return complete daily table between the first and last sample
     * @throws InvalidRecordException if samples are out of order or repeat a date
     */
    public static ExchangeRateTable build(List<RateSample> samples) {
        if (samples.isEmpty()) {
            log.warn("[ExchangeRateTable] Built from zero samples, every lookup will fail");
            return EMPTY;
        }

        Map<LocalDate, BigDecimal> daily = new LinkedHashMap<>();
        RateSample previous = null;
        int filled = 0;

        for (RateSample sample : samples) {
            if (previous != null) {
                if (!sample.date().isAfter(previous.date())) {
                    throw new InvalidRecordException(String.format(
                            "Rate samples must be in increasing date order: %s follows %s",
                            sample.date(), previous.date()));
                }
                LocalDate day = previous.date().plusDays(1);
                while (day.isBefore(sample.date())) {
                    daily.put(day, previous.rate());
                    day = day.plusDays(1);
                    filled++;
                }
            }
            daily.put(sample.date(), sample.rate());
            previous = sample;
        }

        LocalDate first = samples.get(0).date();
        LocalDate last = previous.date();
        log.info("[ExchangeRateTable] Built {} daily rates from {} samples ({} gap days filled), {} to {}",
                daily.size(), samples.size(), filled, first, last);

        return new ExchangeRateTable(Collections.unmodifiableMap(daily), first, last);
    }

    /**
     * Rate effective on the given day.
     *
     * @throws RateNotFoundException if the day is outside the table
     */
    public BigDecimal rateFor(LocalDate date) {
        BigDecimal rate = rates.get(date);
        if (rate == null) {
            throw new RateNotFoundException(date, firstDate, lastDate);
        }
        return rate;
    }

    /**
     * Rate effective on the calendar day of the given timestamp.
     */
    public BigDecimal rateFor(LocalDateTime timestamp) {
        return rateFor(timestamp.toLocalDate());
    }

    public boolean covers(LocalDate date) {
        return rates.containsKey(date);
    }

    public boolean isEmpty() {
        return rates.isEmpty();
    }

    public int size() {
        return rates.size();
    }

    public LocalDate firstDate() {
        return firstDate;
    }

    public LocalDate lastDate() {
        return lastDate;
    }

    /**
     * Read-only view of every daily rate, in date order.
     */
    public Map<LocalDate, BigDecimal> asMap() {
        return rates;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return rates.equals(((ExchangeRateTable) o).rates);
    }

    @Override
    public int hashCode() {
        return rates.hashCode();
    }

    @Override
    public String toString() {
        return isEmpty()
                ? "ExchangeRateTable[empty]"
                : "ExchangeRateTable[" + firstDate + ".." + lastDate + ", " + rates.size() + " days]";
    }
}
