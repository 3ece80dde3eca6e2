package io.taxlots.domain.cash;

import java.util.List;

/**
 * Output of dividend reconciliation.
 *
 * @param records            one per dividend, in input order
 * @param orphanWithholdings withholdings with no dividend on the same symbol and date
 */
public record ReconciliationResult(
        List<DividendReconciliation> records,
        List<CashEvent> orphanWithholdings) {

    public ReconciliationResult {
        records = List.copyOf(records);
        orphanWithholdings = List.copyOf(orphanWithholdings);
    }

    public boolean hasOrphans() {
        return !orphanWithholdings.isEmpty();
    }
}
