package io.taxlots.domain.trade;

/**
 * Kind of movement in a symbol's lot history.
 */
public enum LotEventType {
    BUY,
    SALE,
    FORFEITURE
}
