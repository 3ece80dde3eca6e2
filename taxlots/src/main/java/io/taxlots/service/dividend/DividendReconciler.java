package io.taxlots.service.dividend;

import io.taxlots.domain.cash.CashEvent;
import io.taxlots.domain.cash.DividendReconciliation;
import io.taxlots.domain.cash.ReconciliationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pairs each dividend with the withholding-tax entries booked on the same symbol and date.
 *
 * The join is exact on (symbol, date). A dividend without withholdings is valid and
 * reports zero withheld. Each withholding is attached to one dividend only: if the same
 * symbol paid twice on one day, the first dividend in input order takes them.
 * Withholdings with no dividend are returned as orphans for the operator to review.
 */
public final class DividendReconciler {
    private static final Logger log = LoggerFactory.getLogger(DividendReconciler.class);

    public ReconciliationResult reconcile(List<CashEvent> dividends, List<CashEvent> withholdings) {
        Map<CashEvent.Key, List<CashEvent>> byKey = new LinkedHashMap<>();
        for (CashEvent withholding : withholdings) {
            byKey.computeIfAbsent(withholding.key(), k -> new ArrayList<>()).add(withholding);
        }

        Set<CashEvent.Key> claimed = new HashSet<>();
        List<DividendReconciliation> records = new ArrayList<>(dividends.size());

        for (CashEvent dividend : dividends) {
            CashEvent.Key key = dividend.key();
            List<CashEvent> matched = byKey.getOrDefault(key, List.of());

            if (!claimed.add(key)) {
                if (!matched.isEmpty()) {
                    log.warn("[DividendReconciler] Second dividend for {} on {}, withholdings already attached to the first",
                            key.symbol(), key.date());
                }
                matched = List.of();
            }

            records.add(new DividendReconciliation(dividend, matched));
        }

        List<CashEvent> orphans = new ArrayList<>();
        byKey.forEach((key, entries) -> {
            if (!claimed.contains(key)) {
                orphans.addAll(entries);
            }
        });

        for (CashEvent orphan : orphans) {
            log.warn("[DividendReconciler] Withholding without dividend: {} {} {}",
                    orphan.symbol(), orphan.date(), orphan.amount().toPlainString());
        }

        log.debug("[DividendReconciler] Reconciled {} dividends with {} withholdings, {} orphaned",
                records.size(), withholdings.size(), orphans.size());

        return new ReconciliationResult(records, orphans);
    }
}
