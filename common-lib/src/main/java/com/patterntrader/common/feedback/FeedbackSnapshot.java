package com.patterntrader.common.feedback;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, versioned view of the feedback store as read by the predictor.
 *
 * <p>A snapshot is produced by one ingestion transaction and read whole; the predictor
 * never sees a mixture of two versions.
 *
 * @param version      monotonically increasing store version; 0 for the empty snapshot
 * @param generatedAt  when the aggregates were recomputed; null for the empty snapshot
 */
public record FeedbackSnapshot(
    @JsonProperty("version")       long version,
    @JsonProperty("generatedAt")   Instant generatedAt,
    @JsonProperty("totalOutcomes") int totalOutcomes,
    @JsonProperty("adjustments")   List<AdjustmentRecord> adjustments,
    @JsonProperty("rules")         List<QualitativeRule> rules,
    @JsonProperty("filters")       List<FilterAdjustment> filters
) {

    public FeedbackSnapshot {
        adjustments = adjustments == null ? List.of() : List.copyOf(adjustments);
        rules       = rules == null ? List.of() : List.copyOf(rules);
        filters     = filters == null ? List.of() : List.copyOf(filters);
    }

    public static FeedbackSnapshot empty() {
        return new FeedbackSnapshot(0L, null, 0, List.of(), List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return adjustments.isEmpty() && rules.isEmpty() && filters.isEmpty();
    }

    public Optional<AdjustmentRecord> find(AdjustmentKey key) {
        return adjustments.stream().filter(a -> a.key().equals(key)).findFirst();
    }

    public Optional<FilterAdjustment> filter(AdjustmentKey key) {
        return filters.stream().filter(f -> f.key().equals(key)).findFirst();
    }

    /** True when the snapshot was generated longer ago than {@code maxAge} before {@code now}. */
    public boolean isStale(Instant now, Duration maxAge) {
        return generatedAt == null || generatedAt.plus(maxAge).isBefore(now);
    }
}
