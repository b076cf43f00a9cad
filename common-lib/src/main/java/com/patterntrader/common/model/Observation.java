package com.patterntrader.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Immutable pattern observation produced by the external feature pipeline.
 *
 * <p>{@code pattern} may carry several comma-separated labels when more than one
 * candlestick shape was detected on the same bar. {@code outcomes} is keyed by horizon
 * (in periods) and is empty for live observations.
 */
public record Observation(
    @JsonProperty("id")             String id,
    @JsonProperty("pattern")        String pattern,
    @JsonProperty("instrument")     String instrument,
    @JsonProperty("sector")         String sector,
    @JsonProperty("timeframe")      String timeframe,
    @JsonProperty("trend")          String trend,
    @JsonProperty("volatilityZone") String volatilityZone,
    @JsonProperty("pricePosition")  String pricePosition,
    @JsonProperty("regime")         String regime,
    @JsonProperty("timestamp")      Instant timestamp,
    @JsonProperty("closePrice")     double closePrice,
    @JsonProperty("atr")            double atr,
    @JsonProperty("volumeRatio")    Double volumeRatio,
    @JsonProperty("outcomes")       Map<Integer, HorizonOutcome> outcomes
) {

    public Observation {
        outcomes = outcomes == null ? Map.of() : Map.copyOf(outcomes);
    }

    /** Individual pattern labels, trimmed and lower-cased. */
    @JsonIgnore
    public List<String> patterns() {
        if (pattern == null || pattern.isBlank()) return List.of();
        return Arrays.stream(pattern.split(","))
            .map(p -> p.trim().toLowerCase())
            .filter(p -> !p.isEmpty())
            .toList();
    }

    @JsonIgnore
    public HorizonOutcome outcome(int horizon) {
        return outcomes.get(horizon);
    }

    /** Query context derived from this observation's own tags. */
    @JsonIgnore
    public PredictionContext context() {
        return new PredictionContext(timeframe, trend, volatilityZone, pricePosition,
                                     instrument, sector, closePrice, atr);
    }
}
