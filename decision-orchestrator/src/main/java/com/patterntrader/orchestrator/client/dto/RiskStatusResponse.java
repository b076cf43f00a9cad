package com.patterntrader.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.patterntrader.common.risk.RiskCheckResult;
import com.patterntrader.common.risk.RiskState;

public record RiskStatusResponse(
    @JsonProperty("state")    RiskState state,
    @JsonProperty("canTrade") RiskCheckResult canTrade
) {}
