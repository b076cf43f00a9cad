package com.patterntrader.feedback.config;

import com.patterntrader.common.feedback.AggregationSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "feedback.aggregation")
public class FeedbackProperties {

    /** Age in days at which an outcome counts half. */
    private double halfLifeDays = 60.0;

    private double unknownAgeWeight = 0.5;

    private int minSegmentTrades = 2;

    /** Fewer stored outcomes than this publish an empty snapshot. */
    private int minOutcomes = 3;

    private double volumeRatioThreshold = 1.2;

    public AggregationSettings toSettings() {
        return new AggregationSettings(halfLifeDays, unknownAgeWeight, minSegmentTrades, minOutcomes,
                                       volumeRatioThreshold).validate();
    }
}
