package io.taxlots.domain.trade;

import java.util.List;

/**
 * A forfeit together with the lot fragments it gave up, oldest first.
 *
 * Forfeited shares leave the FIFO queue like a sale but realize nothing.
 */
public record Forfeiture(
        Trade forfeit,
        List<LotFragment> fragments) {

    public Forfeiture {
        if (!forfeit.isForfeit()) {
            throw new IllegalArgumentException("Not a forfeit: " + forfeit);
        }
        fragments = List.copyOf(fragments);
        int covered = fragments.stream().mapToInt(LotFragment::quantity).sum();
        if (covered != forfeit.quantity()) {
            throw new IllegalArgumentException(String.format(
                    "Fragments of forfeit %s cover %d of %d", forfeit.tradeId(), covered, forfeit.quantity()));
        }
    }

    public String symbol() {
        return forfeit.symbol();
    }
}
