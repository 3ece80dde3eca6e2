package io.taxlots.service.fx;

import io.taxlots.domain.common.InvalidRecordException;
import io.taxlots.domain.fx.RateSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the daily exchange-rate table.
 */
@DisplayName("Exchange Rate Table Tests")
class ExchangeRateTableTest {

    private static RateSample sample(String date, String rate) {
        return new RateSample(LocalDate.parse(date), new BigDecimal(rate));
    }

    @Test
    void testSingleSampleLookup() {
        ExchangeRateTable table = ExchangeRateTable.build(List.of(sample("2018-07-27", "62.9471")));

        assertEquals(new BigDecimal("62.9471"), table.rateFor(LocalDate.of(2018, 7, 27)));
        assertEquals(new BigDecimal("62.9471"), table.rateFor(LocalDateTime.of(2018, 7, 27, 9, 33, 38)));
        assertEquals(1, table.size());
    }

    @Test
    void testGapFilledWithEarlierRate() {
        ExchangeRateTable table = ExchangeRateTable.build(List.of(
            sample("2019-01-04", "67.5000"),
            sample("2019-01-07", "66.9000")));

        assertEquals(new BigDecimal("67.5000"), table.rateFor(LocalDate.of(2019, 1, 4)));
        assertEquals(new BigDecimal("67.5000"), table.rateFor(LocalDate.of(2019, 1, 5)), "Saturday carries Friday's rate");
        assertEquals(new BigDecimal("67.5000"), table.rateFor(LocalDate.of(2019, 1, 6)), "Sunday carries Friday's rate");
        assertEquals(new BigDecimal("66.9000"), table.rateFor(LocalDate.of(2019, 1, 7)));
        assertEquals(4, table.size());
    }

    @Test
    void testLongHolidayGap() {
        ExchangeRateTable table = ExchangeRateTable.build(List.of(
            sample("2019-12-31", "61.9057"),
            sample("2020-01-10", "61.2340")));

        for (int day = 1; day <= 9; day++) {
            assertEquals(new BigDecimal("61.9057"), table.rateFor(LocalDate.of(2020, 1, day)));
        }
        assertEquals(new BigDecimal("61.2340"), table.rateFor(LocalDate.of(2020, 1, 10)));
    }

    @Test
    void testConsecutiveDaysNeedNoFill() {
        ExchangeRateTable table = ExchangeRateTable.build(List.of(
            sample("2019-03-04", "65.8592"),
            sample("2019-03-05", "65.7500"),
            sample("2019-03-06", "65.8800")));

        assertEquals(3, table.size());
        assertEquals(new BigDecimal("65.7500"), table.rateFor(LocalDate.of(2019, 3, 5)));
    }

    @Test
    void testDateBeforeFirstSampleFails() {
        ExchangeRateTable table = ExchangeRateTable.build(List.of(
            sample("2019-01-04", "67.5000"),
            sample("2019-01-07", "66.9000")));

        RateNotFoundException e = assertThrows(RateNotFoundException.class,
            () -> table.rateFor(LocalDate.of(2019, 1, 3)));
        assertEquals(LocalDate.of(2019, 1, 3), e.getDate());
        assertEquals(LocalDate.of(2019, 1, 4), e.getFirstDate());
        assertEquals(LocalDate.of(2019, 1, 7), e.getLastDate());
    }

    @Test
    void testDateAfterLastSampleFails() {
        ExchangeRateTable table = ExchangeRateTable.build(List.of(
            sample("2019-01-04", "67.5000"),
            sample("2019-01-07", "66.9000")));

        assertThrows(RateNotFoundException.class, () -> table.rateFor(LocalDate.of(2019, 1, 8)));
        assertFalse(table.covers(LocalDate.of(2019, 1, 8)));
        assertTrue(table.covers(LocalDate.of(2019, 1, 6)));
    }

    @Test
    void testEmptyTableFailsEveryLookup() {
        ExchangeRateTable table = ExchangeRateTable.build(List.of());

        assertTrue(table.isEmpty());
        RateNotFoundException e = assertThrows(RateNotFoundException.class,
            () -> table.rateFor(LocalDate.of(2019, 1, 4)));
        assertNull(e.getFirstDate());
        assertTrue(e.getMessage().contains("empty"));
    }

    @Test
    void testBuildIsIdempotent() {
        List<RateSample> samples = List.of(
            sample("2019-01-04", "67.5000"),
            sample("2019-01-09", "66.9000"),
            sample("2019-01-10", "66.4000"),
            sample("2019-01-14", "66.8000"));

        ExchangeRateTable first = ExchangeRateTable.build(samples);
        ExchangeRateTable second = ExchangeRateTable.build(samples);

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        for (LocalDate day = first.firstDate(); !day.isAfter(first.lastDate()); day = day.plusDays(1)) {
            assertEquals(first.rateFor(day), second.rateFor(day), "Rate on " + day);
        }
    }

    @Test
    void testOutOfOrderSamplesRejected() {
        List<RateSample> samples = List.of(
            sample("2019-01-09", "66.9000"),
            sample("2019-01-04", "67.5000"));

        assertThrows(InvalidRecordException.class, () -> ExchangeRateTable.build(samples));
    }

    @Test
    void testDuplicateDateRejected() {
        List<RateSample> samples = List.of(
            sample("2019-01-04", "67.5000"),
            sample("2019-01-04", "67.6000"));

        assertThrows(InvalidRecordException.class, () -> ExchangeRateTable.build(samples));
    }

    @Test
    void testTableIsReadOnly() {
        ExchangeRateTable table = ExchangeRateTable.build(List.of(sample("2019-01-04", "67.5000")));

        assertThrows(UnsupportedOperationException.class,
            () -> table.asMap().put(LocalDate.of(2019, 1, 5), BigDecimal.ONE));
    }
}
