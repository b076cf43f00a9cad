package com.patterntrader.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.patterntrader.common.risk.RiskCheckResult;
import com.patterntrader.common.risk.RiskState;

public record RiskStatus(
    @JsonProperty("state")    RiskState state,
    @JsonProperty("canTrade") RiskCheckResult canTrade
) {}
