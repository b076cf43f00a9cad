package com.patterntrader.common.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Realized performance of one feedback segment.
 *
 * @param winRate                   raw win rate, 0–100
 * @param decayWeightedWinRate      win rate with recent trades weighted higher; null if not computed
 * @param volumeConfirmedWinRate    win rate of trades entered on above-average volume; null if too few
 * @param volumeUnconfirmedWinRate  win rate of the remaining trades; null if too few
 */
public record AdjustmentRecord(
    @JsonProperty("key")                      AdjustmentKey key,
    @JsonProperty("totalTrades")              int totalTrades,
    @JsonProperty("wins")                     int wins,
    @JsonProperty("winRate")                  double winRate,
    @JsonProperty("decayWeightedWinRate")     Double decayWeightedWinRate,
    @JsonProperty("volumeConfirmedWinRate")   Double volumeConfirmedWinRate,
    @JsonProperty("volumeUnconfirmedWinRate") Double volumeUnconfirmedWinRate
) {

    /** Decay-weighted win rate when available, raw win rate otherwise. */
    public double paperWinRate() {
        return decayWeightedWinRate != null ? decayWeightedWinRate : winRate;
    }
}
