package io.taxlots.service.report;

import io.taxlots.domain.cash.DividendReconciliation;
import io.taxlots.domain.report.DividendIncome;
import io.taxlots.domain.report.SaleProfit;
import io.taxlots.domain.trade.LotFragment;
import io.taxlots.domain.trade.SaleMatch;
import io.taxlots.domain.trade.Trade;
import io.taxlots.service.fx.ExchangeRateTable;
import io.taxlots.service.money.MoneyMath;

import java.math.BigDecimal;

/**
 * Realized Gain Calculator - values matched sales and dividends.
 *
 * Trade currency:
 * - proceeds  = sale price * sale quantity
 * - costBasis = Σ(fragment price * fragment quantity)
 * - profit    = proceeds - costBasis
 *
 * Reporting currency, each leg at the rate of its own cash flow:
 * - proceeds  * rate(sale date)
 * - fragment cost * rate(that fragment's buy date)
 *
 * Nothing is rounded here.
 */
public final class RealizedGainCalculator {

    /**
     * @throws io.taxlots.service.fx.RateNotFoundException if the sale date or any buy date has no rate
     */
    public SaleProfit calculate(SaleMatch match, ExchangeRateTable rates) {
        Trade sale = match.sale();
        BigDecimal saleRate = rates.rateFor(sale.timestamp());

        BigDecimal proceeds = MoneyMath.value(sale.quantity(), sale.unitPrice());
        BigDecimal reportingProceeds = MoneyMath.convert(proceeds, saleRate);

        BigDecimal costBasis = BigDecimal.ZERO;
        BigDecimal reportingCostBasis = BigDecimal.ZERO;
        for (LotFragment fragment : match.fragments()) {
            BigDecimal cost = fragment.cost();
            costBasis = costBasis.add(cost);
            reportingCostBasis = reportingCostBasis.add(
                    MoneyMath.convert(cost, rates.rateFor(fragment.timestamp())));
        }

        return new SaleProfit(
                match,
                saleRate,
                proceeds,
                costBasis,
                proceeds.subtract(costBasis),
                reportingProceeds,
                reportingCostBasis,
                reportingProceeds.subtract(reportingCostBasis));
    }

    /**
     * Value a dividend and its withholdings at the rate of the payment date.
     */
    public DividendIncome calculate(DividendReconciliation reconciliation, ExchangeRateTable rates) {
        BigDecimal rate = rates.rateFor(reconciliation.dividend().date());
        return new DividendIncome(
                reconciliation,
                rate,
                MoneyMath.convert(reconciliation.gross(), rate),
                MoneyMath.convert(reconciliation.withheld(), rate),
                MoneyMath.convert(reconciliation.net(), rate));
    }
}
