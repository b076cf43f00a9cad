package com.patterntrader.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.patterntrader.common.risk.RiskCheckResult;

/** trade-service's answer to one submitted signal. */
public record SignalDecisionResponse(
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("tradeId") Long tradeId,
    @JsonProperty("check")   RiskCheckResult check
) {

    public enum Outcome { ACCEPTED, DUPLICATE, REJECTED, CANCELLED }
}
