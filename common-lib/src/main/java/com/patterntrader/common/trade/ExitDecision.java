package com.patterntrader.common.trade;

/**
 * Result of checking one candle against an open trade.
 *
 * @param status     {@link TradeStatus#OPEN} when the trade stays open
 * @param exitPrice  fill price of the exit; 0 while open
 * @param mfePct     max favorable excursion so far, in percent of entry
 * @param maePct     max adverse excursion so far, in percent of entry (≤ 0)
 */
public record ExitDecision(TradeStatus status, double exitPrice, double mfePct, double maePct) {

    public boolean closes() {
        return status.isTerminal();
    }
}
