package com.patterntrader.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Closed-trade performance overall and grouped by horizon label and by pattern. */
public record TradeStats(
    @JsonProperty("overall")   Bucket overall,
    @JsonProperty("byHorizon") Map<String, Bucket> byHorizon,
    @JsonProperty("byPattern") Map<String, Bucket> byPattern
) {

    public record Bucket(
        @JsonProperty("trades")    int trades,
        @JsonProperty("wins")      int wins,
        @JsonProperty("winRate")   double winRate,
        @JsonProperty("avgReturn") double avgReturn,
        @JsonProperty("totalPnl")  double totalPnl
    ) {}
}
