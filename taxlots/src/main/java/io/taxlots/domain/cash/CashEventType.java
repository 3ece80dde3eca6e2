package io.taxlots.domain.cash;

/**
 * Kind of cash movement attached to a holding.
 */
public enum CashEventType {
    DIVIDEND,
    WITHHOLDING
}
