package com.patterntrader.common.trade;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/** Daily price bar used to monitor open trades. */
public record Candle(
    @JsonProperty("instrument") String instrument,
    @JsonProperty("date")       LocalDate date,
    @JsonProperty("open")       double open,
    @JsonProperty("high")       double high,
    @JsonProperty("low")        double low,
    @JsonProperty("close")      double close
) {}
