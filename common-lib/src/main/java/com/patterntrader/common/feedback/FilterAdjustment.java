package com.patterntrader.common.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FilterAdjustment(
    @JsonProperty("key")         AdjustmentKey key,
    @JsonProperty("action")      FilterAction action,
    @JsonProperty("winRate")     double winRate,
    @JsonProperty("totalTrades") int totalTrades
) {}
