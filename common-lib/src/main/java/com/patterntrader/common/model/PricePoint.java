package com.patterntrader.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record PricePoint(
    @JsonProperty("date")  LocalDate date,
    @JsonProperty("close") double close
) {}
