package com.patterntrader.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.patterntrader.common.risk.RiskCheckResult;

/**
 * Answer to one submitted signal.
 *
 * <ul>
 *   <li>{@code ACCEPTED}: an OPEN trade was created</li>
 *   <li>{@code DUPLICATE}: the dedup key is taken; nothing changed</li>
 *   <li>{@code REJECTED}: a circuit breaker or cooldown blocks entries; nothing was stored</li>
 *   <li>{@code CANCELLED}: a pre-entry gate failed; the trade is stored as CANCELLED with the reason</li>
 * </ul>
 */
public record SignalDecision(
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("tradeId") Long tradeId,
    @JsonProperty("check")   RiskCheckResult check
) {

    public enum Outcome { ACCEPTED, DUPLICATE, REJECTED, CANCELLED }

    public static SignalDecision accepted(Long tradeId) {
        return new SignalDecision(Outcome.ACCEPTED, tradeId, RiskCheckResult.allow());
    }

    public static SignalDecision duplicate() {
        return new SignalDecision(Outcome.DUPLICATE, null, null);
    }

    public static SignalDecision rejected(RiskCheckResult check) {
        return new SignalDecision(Outcome.REJECTED, null, check);
    }

    public static SignalDecision cancelled(Long tradeId, RiskCheckResult check) {
        return new SignalDecision(Outcome.CANCELLED, tradeId, check);
    }
}
