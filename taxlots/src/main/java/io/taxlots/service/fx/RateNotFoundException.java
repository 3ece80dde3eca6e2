package io.taxlots.service.fx;

import io.taxlots.domain.common.TaxDataException;

import java.time.LocalDate;

/**
 * Exception thrown when an exchange rate is requested for a date the table does not cover.
 */
public class RateNotFoundException extends TaxDataException {

    private final LocalDate date;
    private final LocalDate firstDate;
    private final LocalDate lastDate;

    public RateNotFoundException(LocalDate date, LocalDate firstDate, LocalDate lastDate) {
        super(firstDate == null
                ? String.format("No exchange rate for %s: rate table is empty", date)
                : String.format("No exchange rate for %s: table covers %s to %s", date, firstDate, lastDate));
        this.date = date;
        this.firstDate = firstDate;
        this.lastDate = lastDate;
    }

    public LocalDate getDate() {
        return date;
    }

    public LocalDate getFirstDate() {
        return firstDate;
    }

    public LocalDate getLastDate() {
        return lastDate;
    }
}
