package com.patterntrader.common.feedback;

import com.patterntrader.common.exception.InvalidConfigurationException;

/**
 * Constants used when turning stored outcomes into a feedback snapshot.
 *
 * @param halfLifeDays          age at which an outcome counts half in decay-weighted rates
 * @param unknownAgeWeight      weight of an outcome without a close timestamp
 * @param minSegmentTrades      smallest segment kept in the snapshot
 * @param minOutcomes           fewer stored outcomes than this leaves the snapshot empty
 * @param volumeRatioThreshold  entry volume ratio above which a trade counts as volume-confirmed
 */
public record AggregationSettings(
    double halfLifeDays,
    double unknownAgeWeight,
    int minSegmentTrades,
    int minOutcomes,
    double volumeRatioThreshold
) {

    public static AggregationSettings defaults() {
        return new AggregationSettings(60.0, 0.5, 2, 3, 1.2);
    }

    public AggregationSettings validate() {
        if (halfLifeDays <= 0)
            throw new InvalidConfigurationException("AggregationSettings", "halfLifeDays must be positive");
        if (unknownAgeWeight < 0 || unknownAgeWeight > 1)
            throw new InvalidConfigurationException("AggregationSettings", "unknownAgeWeight must be in [0,1]");
        if (minSegmentTrades < 1 || minOutcomes < 1)
            throw new InvalidConfigurationException("AggregationSettings", "minimum counts must be >= 1");
        return this;
    }
}
