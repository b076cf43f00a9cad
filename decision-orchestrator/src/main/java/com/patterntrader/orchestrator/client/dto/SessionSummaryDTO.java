package com.patterntrader.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/** One row of trade-service's session log. */
public record SessionSummaryDTO(
    @JsonProperty("sessionDate")     LocalDate sessionDate,
    @JsonProperty("signalsReceived") int signalsReceived,
    @JsonProperty("signalsAccepted") int signalsAccepted,
    @JsonProperty("tradesClosed")    int tradesClosed
) {}
