package com.patterntrader.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome distribution of the retrieved candidates at one horizon.
 *
 * <p>Percentages are in 0–100; edges are percentage points above the dataset base rate.
 */
public record HorizonForecast(
    @JsonProperty("horizon")       int horizon,
    @JsonProperty("direction")     Direction direction,
    @JsonProperty("bullishPct")    double bullishPct,
    @JsonProperty("bearishPct")    double bearishPct,
    @JsonProperty("neutralPct")    double neutralPct,
    @JsonProperty("bullishEdge")   double bullishEdge,
    @JsonProperty("bearishEdge")   double bearishEdge,
    @JsonProperty("avgReturn")     double avgReturn,
    @JsonProperty("medianReturn")  double medianReturn,
    @JsonProperty("stdReturn")     double stdReturn,
    @JsonProperty("minReturn")     double minReturn,
    @JsonProperty("maxReturn")     double maxReturn,
    @JsonProperty("sampleSize")    int sampleSize
) {}
