package io.taxlots.security;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Input validator for broker-export fields.
 *
 * Features:
 * - Validates symbols, quantities, prices and currency codes
 * - Strips control characters from free-text descriptions
 * - Type-safe validation methods
 *
 * Usage:
 * <pre>
 * InputValidator validator = new InputValidator();
 *
 * if (!validator.isValidSymbol("BRK B")) {
 *     throw new IllegalArgumentException("Invalid symbol");
 * }
 *
 * validator.validateQuantity(100);  // Throws if invalid
 * </pre>
 *
 * Validation Rules:
 * - Symbols: upper-case letters, digits and . _ - space, max 32 chars
 * - Quantities: positive integers, max 100,000,000
 * - Prices: non-negative decimals, max 10,000,000
 * - Currencies: three upper-case letters
 */
public class InputValidator {

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("^[A-Z0-9][A-Z0-9._ -]*$");
    private static final Pattern CURRENCY_PATTERN = Pattern.compile("^[A-Z]{3}$");

    private static final int MAX_SYMBOL_LENGTH = 32;
    private static final int MAX_QUANTITY = 100_000_000;
    private static final int MAX_STRING_LENGTH = 1000;
    private static final BigDecimal MAX_PRICE = new BigDecimal("10000000");

    /**
     * Validate trading symbol.
     *
     * Valid formats:
     * - VOO
     * - BRK B
     * - RDS.A
     *
     * @param symbol Trading symbol
     * @return true if valid
     */
    public boolean isValidSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return false;
        }

        if (symbol.length() > MAX_SYMBOL_LENGTH) {
            return false;
        }

        return SYMBOL_PATTERN.matcher(symbol).matches();
    }

    /**
     * Validate quantity.
     *
     * Rules:
     * - Must be positive
     * - Must be <= MAX_QUANTITY
     *
     * @param quantity Share count
     * @throws IllegalArgumentException if invalid
     */
    public void validateQuantity(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }

        if (quantity > MAX_QUANTITY) {
            throw new IllegalArgumentException("Quantity exceeds maximum (" + MAX_QUANTITY + "): " + quantity);
        }
    }

    /**
     * Validate price.
     *
     * Rules:
     * - Must be non-negative
     * - Must be <= MAX_PRICE
     *
     * Scale is not limited: broker prices carry four or more decimals.
     *
     * @param price Unit price
     * @throws IllegalArgumentException if invalid
     */
    public void validatePrice(BigDecimal price) {
        if (price == null) {
            throw new IllegalArgumentException("Price cannot be null");
        }

        if (price.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Price must be non-negative: " + price);
        }

        if (price.compareTo(MAX_PRICE) > 0) {
            throw new IllegalArgumentException("Price exceeds maximum (" + MAX_PRICE + "): " + price);
        }
    }

    /**
     * Validate ISO 4217 style currency code.
     *
     * @param currency Currency code, e.g. USD
     * @return true if valid
     */
    public boolean isValidCurrency(String currency) {
        return currency != null && CURRENCY_PATTERN.matcher(currency).matches();
    }

    /**
     * Sanitize string by removing dangerous characters.
     *
     * - Trims whitespace
     * - Removes control characters
     * - Limits length to MAX_STRING_LENGTH
     *
     * @param input Input string
     * @return Sanitized string
     */
    public String sanitize(String input) {
        if (input == null) {
            return null;
        }

        String result = input.trim();

        result = result.replaceAll("\\p{Cntrl}", "");

        if (result.length() > MAX_STRING_LENGTH) {
            result = result.substring(0, MAX_STRING_LENGTH);
        }

        return result;
    }

    /**
     * Validate numeric range.
     *
     * @param value Value to check
     * @param min Minimum (inclusive)
     * @param max Maximum (inclusive)
     * @param fieldName Field name for error messages
     * @throws IllegalArgumentException if out of range
     */
    public void validateRange(int value, int min, int max, String fieldName) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                fieldName + " must be between " + min + " and " + max + ": " + value);
        }
    }
}
