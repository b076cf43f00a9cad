package com.patterntrader.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.patterntrader.common.trade.Candle;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/** Daily candles for the instruments with open trades; any order, any number of days. */
public record MonitorRequest(
    @JsonProperty("candles") @NotNull List<Candle> candles
) {}
