package com.patterntrader.scheduler.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/** The part of the orchestrator's catch-up report the scheduler logs. */
public record CatchUpResult(
    @JsonProperty("lastRecorded") LocalDate lastRecorded,
    @JsonProperty("today")        LocalDate today,
    @JsonProperty("sessions")     List<SessionResult> sessions
) {

    public CatchUpResult {
        sessions = sessions == null ? List.of() : List.copyOf(sessions);
    }

    public record SessionResult(
        @JsonProperty("sessionDate") LocalDate sessionDate,
        @JsonProperty("sessionId")   String sessionId,
        @JsonProperty("status")      String status,
        @JsonProperty("accepted")    int accepted,
        @JsonProperty("tradesClosed") int tradesClosed
    ) {}
}
