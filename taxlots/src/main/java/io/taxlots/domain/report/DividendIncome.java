package io.taxlots.domain.report;

import io.taxlots.domain.cash.DividendReconciliation;

import java.math.BigDecimal;

/**
 * Dividend valued in reporting currency at the rate of the payment date.
 */
public record DividendIncome(
        DividendReconciliation reconciliation,
        BigDecimal rate,
        BigDecimal reportingGross,
        BigDecimal reportingWithheld,
        BigDecimal reportingNet) {
}
