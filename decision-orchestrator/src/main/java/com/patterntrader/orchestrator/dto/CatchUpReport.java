package com.patterntrader.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * @param lastRecorded  last session in the log before this run; null on a fresh install
 * @param sessions      one report per replayed trading day, oldest first
 */
public record CatchUpReport(
    @JsonProperty("lastRecorded") LocalDate lastRecorded,
    @JsonProperty("today")        LocalDate today,
    @JsonProperty("sessions")     List<SessionReport> sessions
) {}
