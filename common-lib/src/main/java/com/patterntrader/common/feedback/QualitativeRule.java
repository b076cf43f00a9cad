package com.patterntrader.common.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Learned rule that nudges prediction confidence.
 *
 * <p>Known contexts: {@value #TREND_ALIGNMENT}, {@value #VOLUME_CONFIRMATION},
 * {@value #STOP_LOSS_TUNING} and {@code volume_per_pattern_<pattern>}.
 *
 * @param confidence  strength of the evidence behind the rule, 0–1
 */
public record QualitativeRule(
    @JsonProperty("context")     String context,
    @JsonProperty("confidence")  double confidence,
    @JsonProperty("description") String description
) {
    public static final String TREND_ALIGNMENT        = "trend_alignment";
    public static final String VOLUME_CONFIRMATION    = "volume_confirmation";
    public static final String STOP_LOSS_TUNING       = "stop_loss_tuning";
    public static final String VOLUME_PER_PATTERN     = "volume_per_pattern_";
}
