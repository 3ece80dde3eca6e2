package io.taxlots.domain.cash;

import java.math.BigDecimal;
import java.util.List;

/**
 * A dividend and the withholding entries booked against it.
 */
public record DividendReconciliation(
        CashEvent dividend,
        List<CashEvent> withholdings) {

    public DividendReconciliation {
        withholdings = List.copyOf(withholdings);
    }

    public BigDecimal gross() {
        return dividend.amount();
    }

    /**
     * Total withheld as a positive figure; zero when nothing was withheld.
     */
    public BigDecimal withheld() {
        return withholdings.stream()
                .map(CashEvent::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .abs();
    }

    public BigDecimal net() {
        return gross().subtract(withheld());
    }
}
