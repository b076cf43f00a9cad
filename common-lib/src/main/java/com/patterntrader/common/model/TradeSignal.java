package com.patterntrader.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Sized, filtered signal handed from the decision pipeline to the trade lifecycle.
 *
 * <p>{@code (instrument, horizonDays, signalDate)} is the dedup key: submitting the same
 * signal twice never opens a second trade.
 *
 * @param positionPct    percent of capital, already regime-scaled
 * @param rawWinRate     win rate before feedback blending
 * @param rawConfidence  confidence before feedback blending
 */
public record TradeSignal(
    @JsonProperty("instrument")     String instrument,
    @JsonProperty("sector")         String sector,
    @JsonProperty("pattern")        String pattern,
    @JsonProperty("trend")          String trend,
    @JsonProperty("signalDate")     LocalDate signalDate,
    @JsonProperty("horizonDays")    int horizonDays,
    @JsonProperty("direction")      Direction direction,
    @JsonProperty("entryPrice")     double entryPrice,
    @JsonProperty("stopLoss")       double stopLoss,
    @JsonProperty("target")         double target,
    @JsonProperty("stopLossPct")    double stopLossPct,
    @JsonProperty("targetPct")      double targetPct,
    @JsonProperty("positionPct")    double positionPct,
    @JsonProperty("winRate")        double winRate,
    @JsonProperty("rawWinRate")     double rawWinRate,
    @JsonProperty("confidence")     double confidence,
    @JsonProperty("rawConfidence")  double rawConfidence,
    @JsonProperty("level")          ConfidenceLevel level,
    @JsonProperty("tier")           RetrievalTier tier,
    @JsonProperty("volumeRatio")    Double volumeRatio,
    @JsonProperty("regime")         MarketRegime regime,
    @JsonProperty("reasoning")      String reasoning
) {}
