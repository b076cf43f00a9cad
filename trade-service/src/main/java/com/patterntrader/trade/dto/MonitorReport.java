package com.patterntrader.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MonitorReport(
    @JsonProperty("checked")           int checked,
    @JsonProperty("closed")            int closed,
    @JsonProperty("stillOpen")         int stillOpen,
    @JsonProperty("outcomesPublished") int outcomesPublished
) {}
