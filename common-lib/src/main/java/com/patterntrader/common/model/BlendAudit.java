package com.patterntrader.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.patterntrader.common.feedback.AdjustmentKey;

import java.util.List;

/**
 * Pre-blend values and blend provenance kept next to a blended prediction so raw and
 * feedback-adjusted outputs can be compared offline.
 *
 * @param source        adjustment record the win rate was blended with; null if only rules applied
 * @param sourceTrades  sample count of {@code source}
 * @param weight        blend weight given to the paper win rate
 * @param appliedRules  qualitative rule contexts that moved the confidence
 */
public record BlendAudit(
    @JsonProperty("rawWinRate")    double rawWinRate,
    @JsonProperty("rawConfidence") double rawConfidence,
    @JsonProperty("rawLevel")      ConfidenceLevel rawLevel,
    @JsonProperty("source")        AdjustmentKey source,
    @JsonProperty("sourceTrades")  int sourceTrades,
    @JsonProperty("paperWinRate")  double paperWinRate,
    @JsonProperty("weight")        double weight,
    @JsonProperty("appliedRules")  List<String> appliedRules
) {}
