package io.taxlots.infrastructure.ib;

import io.taxlots.domain.cash.CashEvent;
import io.taxlots.domain.cash.CashEventType;
import io.taxlots.domain.common.InvalidRecordException;
import io.taxlots.domain.trade.SplitAdjustment;
import io.taxlots.domain.trade.Trade;
import io.taxlots.domain.trade.TradeSide;
import io.taxlots.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Maps IB activity statement rows to domain records.
 *
 * Trades:
 * - side comes from the sign of {@code Quantity}: negative = SELL, positive = BUY
 * - {@code Date/Time} is {@code yyyy-MM-dd, HH:mm:ss}
 * - rows of other asset categories (Forex, Options, ...) are skipped
 * - split adjustments are applied after parsing
 *
 * Dividends / withholdings:
 * - symbol is the part of {@code Description} before the first '('
 *
 * Every row must be in the configured trade currency.
 */
public final class IbRecordMapper {
    private static final Logger log = LoggerFactory.getLogger(IbRecordMapper.class);

    static final DateTimeFormatter TRADE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd, HH:mm:ss");
    static final DateTimeFormatter CASH_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final String STOCKS = "Stocks";

    private final String tradeCurrency;
    private final List<SplitAdjustment> splits;
    private final InputValidator validator;

    public IbRecordMapper(String tradeCurrency, List<SplitAdjustment> splits, InputValidator validator) {
        if (!validator.isValidCurrency(tradeCurrency)) {
            throw new IllegalArgumentException("Invalid trade currency: " + tradeCurrency);
        }
        this.tradeCurrency = tradeCurrency;
        this.splits = List.copyOf(splits);
        this.validator = validator;
    }

    /**
     * Map a {@code Trades} row.
     *
     * @return empty for rows that are not stock trades
     * @throws InvalidRecordException if the row is malformed
     */
    public Optional<Trade> toTrade(IbRecord record) {
        String assetCategory = record.get("Asset Category");
        if (assetCategory != null && !assetCategory.isBlank() && !STOCKS.equals(assetCategory.trim())) {
            log.debug("[IbRecordMapper] Skipping {} row at {}:{}", assetCategory, record.source(), record.location());
            return Optional.empty();
        }

        checkCurrency(record);

        String symbol = record.require("Symbol");
        if (!validator.isValidSymbol(symbol)) {
            throw invalid(record, "Invalid symbol '" + symbol + "'");
        }

        LocalDateTime timestamp = parseTimestamp(record, record.require("Date/Time"));
        int signedQuantity = parseQuantity(record, record.require("Quantity"));
        if (signedQuantity == 0) {
            throw invalid(record, "Zero quantity, cannot classify side");
        }
        TradeSide side = signedQuantity < 0 ? TradeSide.SELL : TradeSide.BUY;
        int quantity = Math.abs(signedQuantity);

        BigDecimal price = parseDecimal(record, "T. Price");
        try {
            validator.validateQuantity(quantity);
            validator.validatePrice(price);
        } catch (IllegalArgumentException e) {
            throw invalid(record, e.getMessage());
        }

        Trade trade = new Trade(record.source() + "#" + record.rowNumber(), timestamp, side, symbol, quantity, price);
        for (SplitAdjustment split : splits) {
            if (split.appliesTo(trade)) {
                Trade adjusted = split.apply(trade);
                log.debug("[IbRecordMapper] Split-adjusted {} -> {}", trade, adjusted);
                trade = adjusted;
            }
        }
        return Optional.of(trade);
    }

    /**
     * Map a {@code Dividends} or {@code Withholding Tax} row.
     *
     * @throws InvalidRecordException if the row is malformed
     */
    public CashEvent toCashEvent(IbRecord record, CashEventType type) {
        checkCurrency(record);

        LocalDate date;
        String rawDate = record.require("Date");
        try {
            date = LocalDate.parse(rawDate, CASH_DATE);
        } catch (DateTimeParseException e) {
            throw invalid(record, "Unparseable date '" + rawDate + "'");
        }

        String description = validator.sanitize(record.require("Description"));
        String symbol = symbolFromDescription(description);
        if (!validator.isValidSymbol(symbol)) {
            throw invalid(record, "Cannot take a symbol from description '" + description + "'");
        }

        return new CashEvent(date, symbol, parseDecimal(record, "Amount"), type, description);
    }

    /**
     * "VOO(US9229083632) Cash Dividend USD 1.38 per Share" -> "VOO".
     */
    static String symbolFromDescription(String description) {
        int paren = description.indexOf('(');
        return (paren < 0 ? description : description.substring(0, paren)).trim();
    }

    private void checkCurrency(IbRecord record) {
        String currency = record.get("Currency");
        if (currency != null && !currency.isBlank() && !tradeCurrency.equals(currency.trim())) {
            throw invalid(record, "Currency " + currency.trim() + " is not the trade currency " + tradeCurrency);
        }
    }

    private static LocalDateTime parseTimestamp(IbRecord record, String value) {
        try {
            return LocalDateTime.parse(value, TRADE_TIMESTAMP);
        } catch (DateTimeParseException e) {
            throw invalid(record, "Unparseable timestamp '" + value + "'");
        }
    }

    private static int parseQuantity(IbRecord record, String value) {
        try {
            return Integer.parseInt(value.replace(",", ""));
        } catch (NumberFormatException e) {
            throw invalid(record, "Quantity is not a whole number: '" + value + "'");
        }
    }

    private static BigDecimal parseDecimal(IbRecord record, String key) {
        String value = record.require(key);
        try {
            return new BigDecimal(value.replace(",", ""));
        } catch (NumberFormatException e) {
            throw invalid(record, "Field '" + key + "' is not a number: '" + value + "'");
        }
    }

    private static InvalidRecordException invalid(IbRecord record, String message) {
        return new InvalidRecordException(record.source(), record.location(), message);
    }
}
