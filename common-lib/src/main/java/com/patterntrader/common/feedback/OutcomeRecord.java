package com.patterntrader.common.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.patterntrader.common.model.Direction;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Realized result of one closed trade, handed to the feedback store for ingestion.
 *
 * @param tradeId             idempotency key; a record is ingested at most once
 * @param returnPct           realized return net of costs, signed for the trade direction
 * @param stopLossTriggered   whether the configured stop-loss was hit while the trade was open
 * @param exitStatus          terminal trade status name ({@code CLOSED_SL}, {@code CLOSED_TARGET}, ...)
 * @param volumeRatio         entry-bar volume relative to its average; null when unknown
 */
public record OutcomeRecord(
    @JsonProperty("tradeId")           String tradeId,
    @JsonProperty("instrument")        String instrument,
    @JsonProperty("pattern")           String pattern,
    @JsonProperty("trend")             String trend,
    @JsonProperty("sector")            String sector,
    @JsonProperty("horizon")           Integer horizon,
    @JsonProperty("direction")         Direction direction,
    @JsonProperty("returnPct")         double returnPct,
    @JsonProperty("win")               boolean win,
    @JsonProperty("stopLossTriggered") boolean stopLossTriggered,
    @JsonProperty("exitStatus")        String exitStatus,
    @JsonProperty("volumeRatio")       Double volumeRatio,
    @JsonProperty("entryDate")         LocalDate entryDate,
    @JsonProperty("closedAt")          Instant closedAt,
    @JsonProperty("mfePct")            double mfePct,
    @JsonProperty("maePct")            double maePct
) {

    /** Names of the segmentation fields that are null or blank. */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (isBlank(tradeId))                 missing.add("tradeId");
        if (isBlank(pattern))                 missing.add("pattern");
        if (isBlank(trend))                   missing.add("trend");
        if (isBlank(sector))                  missing.add("sector");
        if (horizon == null || horizon <= 0)  missing.add("horizon");
        if (direction == null)                missing.add("direction");
        return missing;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
