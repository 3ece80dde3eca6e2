package io.taxlots.domain.cash;

import io.taxlots.domain.common.InvalidRecordException;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Dividend payment or withholding-tax entry.
 *
 * Amount is signed as reported by the broker: dividends are normally positive,
 * withholdings negative (reversals of withholding come in positive).
 */
public record CashEvent(
        LocalDate date,
        String symbol,
        BigDecimal amount,
        CashEventType type,
        String description) {

    public CashEvent {
        if (date == null) {
            throw new InvalidRecordException("Cash event has no date: " + description);
        }
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidRecordException("Cash event has no symbol: " + description);
        }
        if (amount == null) {
            throw new InvalidRecordException("Cash event has no amount: " + description);
        }
        if (type == null) {
            throw new InvalidRecordException("Cash event has no type: " + description);
        }
    }

    public static CashEvent dividend(LocalDate date, String symbol, BigDecimal amount) {
        return new CashEvent(date, symbol, amount, CashEventType.DIVIDEND, symbol + " dividend");
    }

    public static CashEvent withholding(LocalDate date, String symbol, BigDecimal amount) {
        return new CashEvent(date, symbol, amount, CashEventType.WITHHOLDING, symbol + " withholding");
    }

    /**
     * Join key used to pair dividends with their withholdings.
     */
    public Key key() {
        return new Key(symbol, date);
    }

    public record Key(String symbol, LocalDate date) {
    }
}
