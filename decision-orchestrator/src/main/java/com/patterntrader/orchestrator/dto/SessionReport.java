package com.patterntrader.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.patterntrader.common.model.MarketRegime;

import java.time.LocalDate;
import java.util.Map;

/**
 * What one session run did.
 *
 * @param signals  signals that passed every gate and were submitted to trade-service
 * @param skipped  per-horizon evaluations dropped before submission, by gate name
 */
public record SessionReport(
    @JsonProperty("sessionDate")     LocalDate sessionDate,
    @JsonProperty("sessionId")       String sessionId,
    @JsonProperty("status")          SessionStatus status,
    @JsonProperty("regime")          MarketRegime regime,
    @JsonProperty("feedbackVersion") long feedbackVersion,
    @JsonProperty("observations")    int observations,
    @JsonProperty("predictions")     int predictions,
    @JsonProperty("signals")         int signals,
    @JsonProperty("accepted")        int accepted,
    @JsonProperty("duplicates")      int duplicates,
    @JsonProperty("rejected")        int rejected,
    @JsonProperty("cancelled")       int cancelled,
    @JsonProperty("skipped")         Map<String, Long> skipped,
    @JsonProperty("tradesClosed")    int tradesClosed,
    @JsonProperty("note")            String note
) {

    public SessionReport {
        skipped = skipped == null ? Map.of() : Map.copyOf(skipped);
    }

    public static SessionReport blocked(LocalDate date, String sessionId, String note) {
        return new SessionReport(date, sessionId, SessionStatus.RISK_BLOCKED, null, 0L,
                                 0, 0, 0, 0, 0, 0, 0, Map.of(), 0, note);
    }

    public static SessionReport halted(LocalDate date, String sessionId, MarketRegime regime, long feedbackVersion) {
        return new SessionReport(date, sessionId, SessionStatus.REGIME_HALTED, regime, feedbackVersion,
                                 0, 0, 0, 0, 0, 0, 0, Map.of(), 0, "regime " + regime.label() + " halts trading");
    }

    public SessionReport withTradesClosed(int closed) {
        return new SessionReport(sessionDate, sessionId, status, regime, feedbackVersion, observations, predictions,
                                 signals, accepted, duplicates, rejected, cancelled, skipped, closed, note);
    }
}
