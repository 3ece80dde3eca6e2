package io.taxlots.domain.fx;

import io.taxlots.domain.common.InvalidRecordException;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Published exchange rate for one day: units of reporting currency per unit of trade currency.
 */
public record RateSample(LocalDate date, BigDecimal rate) {

    public RateSample {
        if (date == null) {
            throw new InvalidRecordException("Rate sample has no date");
        }
        if (rate == null || rate.signum() <= 0) {
            throw new InvalidRecordException("Rate for " + date + " must be positive: " + rate);
        }
    }
}
