package com.patterntrader.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.LocalDate;

public record SessionSummary(
    @JsonProperty("sessionDate")     LocalDate sessionDate,
    @JsonProperty("signalsReceived") @PositiveOrZero int signalsReceived,
    @JsonProperty("signalsAccepted") @PositiveOrZero int signalsAccepted,
    @JsonProperty("tradesClosed")    @PositiveOrZero int tradesClosed
) {}
