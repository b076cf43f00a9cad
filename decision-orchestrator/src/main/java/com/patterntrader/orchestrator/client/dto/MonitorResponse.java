package com.patterntrader.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MonitorResponse(
    @JsonProperty("checked")           int checked,
    @JsonProperty("closed")            int closed,
    @JsonProperty("stillOpen")         int stillOpen,
    @JsonProperty("outcomesPublished") int outcomesPublished
) {

    public static MonitorResponse none() {
        return new MonitorResponse(0, 0, 0, 0);
    }
}
