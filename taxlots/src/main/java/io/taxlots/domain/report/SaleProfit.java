package io.taxlots.domain.report;

import io.taxlots.domain.trade.SaleMatch;

import java.math.BigDecimal;

/**
 * Realized result of one sale, unrounded.
 *
 * Trade-currency figures come straight from prices; reporting-currency figures
 * convert each leg at the rate of the day that leg's cash moved.
 */
public record SaleProfit(
        SaleMatch match,
        BigDecimal saleRate,
        BigDecimal proceeds,
        BigDecimal costBasis,
        BigDecimal profit,
        BigDecimal reportingProceeds,
        BigDecimal reportingCostBasis,
        BigDecimal reportingProfit) {

    public boolean isGain() {
        return profit.signum() > 0;
    }

    public boolean isReportingGain() {
        return reportingProfit.signum() > 0;
    }
}
