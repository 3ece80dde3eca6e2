package io.taxlots.domain.trade;

import java.util.List;

/**
 * A sale together with the buy-lot fragments that funded it, oldest first.
 */
public record SaleMatch(
        Trade sale,
        List<LotFragment> fragments) {

    public SaleMatch {
        if (!sale.isSell()) {
            throw new IllegalArgumentException("Not a sale: " + sale);
        }
        fragments = List.copyOf(fragments);
        int funded = fragments.stream().mapToInt(LotFragment::quantity).sum();
        if (funded != sale.quantity()) {
            throw new IllegalArgumentException(String.format(
                    "Fragments of sale %s cover %d of %d", sale.tradeId(), funded, sale.quantity()));
        }
    }

    /**
     * Original quantity of the sale.
     */
    public int amount() {
        return sale.quantity();
    }

    public String symbol() {
        return sale.symbol();
    }
}
