package com.patterntrader.feedback.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param duplicate  true when the trade id had already been ingested; nothing changed
 * @param version    snapshot version after the call
 */
public record IngestResult(
    @JsonProperty("tradeId")       String tradeId,
    @JsonProperty("duplicate")     boolean duplicate,
    @JsonProperty("version")       long version,
    @JsonProperty("totalOutcomes") int totalOutcomes
) {

    public static IngestResult accepted(String tradeId, long version, int totalOutcomes) {
        return new IngestResult(tradeId, false, version, totalOutcomes);
    }

    public static IngestResult duplicate(String tradeId, long version, int totalOutcomes) {
        return new IngestResult(tradeId, true, version, totalOutcomes);
    }
}
