package com.patterntrader.common.trade;

/**
 * Trade lifecycle status. {@link #OPEN} is the only non-terminal state; transitions only
 * ever leave it.
 */
public enum TradeStatus {
    OPEN,
    CLOSED_SL,
    CLOSED_TARGET,
    CLOSED_EXPIRY,
    CANCELLED;

    public boolean isTerminal() {
        return this != OPEN;
    }

    /** A closed trade that realized pnl; cancelled trades never filled. */
    public boolean isClosed() {
        return this == CLOSED_SL || this == CLOSED_TARGET || this == CLOSED_EXPIRY;
    }

    public boolean canTransitionTo(TradeStatus next) {
        return this == OPEN && next != OPEN;
    }
}
