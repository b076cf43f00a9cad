package com.patterntrader.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.patterntrader.common.trade.Candle;

import java.util.List;

public record MonitorRequest(
    @JsonProperty("candles") List<Candle> candles
) {}
