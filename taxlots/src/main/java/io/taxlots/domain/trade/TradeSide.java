package io.taxlots.domain.trade;

/**
 * Trade direction.
 */
public enum TradeSide {
    BUY,
    SELL,
    /** Lots given up without proceeds, e.g. unvested grants. */
    FORFEIT
}
