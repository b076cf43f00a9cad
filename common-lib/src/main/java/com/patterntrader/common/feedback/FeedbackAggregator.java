package com.patterntrader.common.feedback;

import com.patterntrader.common.model.Direction;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes the whole feedback snapshot from stored outcome records.
 *
 * <p>Every outcome contributes to five segments (pattern, pattern+trend, pattern+horizon,
 * pattern+trend+horizon, pattern+sector). Segments below the minimum trade count are dropped.
 * Decay weight is {@code 2^(-ageDays / halfLife)}, so a 60-day-old trade counts half.
 *
 * <p>Rules and filters follow fixed evidence thresholds:
 * <ul>
 *   <li>trend_alignment: aligned and against groups ≥ 3, aligned WR beats against WR by 10+</li>
 *   <li>volume_confirmation: ≥ 3 volume-confirmed trades with WR above 60</li>
 *   <li>volume_per_pattern_&lt;p&gt;: both volume groups ≥ 3, confirmed WR beats unconfirmed by 15+</li>
 *   <li>stop_loss_tuning: ≥ 3 stop-loss exits making up more than 40% of outcomes</li>
 *   <li>penalty: pattern n ≥ 5 and WR &lt; 45; horizon/sector n ≥ 3 and WR &lt; 40</li>
 *   <li>boost: pattern n ≥ 10 and WR &gt; 70; horizon/sector n ≥ 5 and WR &gt; 70</li>
 * </ul>
 */
public class FeedbackAggregator {

    private final AggregationSettings settings;

    public FeedbackAggregator(AggregationSettings settings) {
        this.settings = settings.validate();
    }

    public FeedbackSnapshot aggregate(List<OutcomeRecord> outcomes, Instant now, long version) {
        if (outcomes.size() < settings.minOutcomes()) {
            return new FeedbackSnapshot(version, now, outcomes.size(), List.of(), List.of(), List.of());
        }

        Map<AdjustmentKey, SegmentStats> segments = new LinkedHashMap<>();
        for (OutcomeRecord o : outcomes) {
            double w = decayWeight(o, now);
            boolean volumeConfirmed = o.volumeRatio() != null && o.volumeRatio() > settings.volumeRatioThreshold();
            String pattern = o.pattern().trim().toLowerCase();

            segments.computeIfAbsent(AdjustmentKey.pattern(pattern), k -> new SegmentStats())
                .add(o.win(), w, volumeConfirmed);
            segments.computeIfAbsent(AdjustmentKey.patternTrend(pattern, o.trend()), k -> new SegmentStats())
                .add(o.win(), w, volumeConfirmed);
            segments.computeIfAbsent(AdjustmentKey.patternHorizon(pattern, o.horizon()), k -> new SegmentStats())
                .add(o.win(), w, volumeConfirmed);
            segments.computeIfAbsent(AdjustmentKey.triple(pattern, o.trend(), o.horizon()), k -> new SegmentStats())
                .add(o.win(), w, volumeConfirmed);
            if (!"unknown".equalsIgnoreCase(o.sector())) {
                segments.computeIfAbsent(AdjustmentKey.patternSector(pattern, o.sector()), k -> new SegmentStats())
                    .add(o.win(), w, volumeConfirmed);
            }
        }

        List<AdjustmentRecord> adjustments = new ArrayList<>();
        for (Map.Entry<AdjustmentKey, SegmentStats> e : segments.entrySet()) {
            SegmentStats s = e.getValue();
            if (s.total() < settings.minSegmentTrades()) continue;
            boolean isPattern = e.getKey().category() == AdjustmentCategory.PATTERN;
            adjustments.add(new AdjustmentRecord(e.getKey(), s.total(), s.wins,
                round2(s.winRate()),
                round2(s.weightedTotal > 0 ? s.weightedWins / s.weightedTotal * 100.0 : s.winRate()),
                isPattern && s.volumeTotal >= 2 ? round2(s.volumeWins * 100.0 / s.volumeTotal) : null,
                isPattern && s.plainTotal >= 2 ? round2(s.plainWins * 100.0 / s.plainTotal) : null));
        }

        List<QualitativeRule> rules = deriveRules(outcomes, segments);
        List<FilterAdjustment> filters = deriveFilters(adjustments);
        return new FeedbackSnapshot(version, now, outcomes.size(), adjustments, rules, filters);
    }

    double decayWeight(OutcomeRecord o, Instant now) {
        if (o.closedAt() == null) return settings.unknownAgeWeight();
        long ageDays = Math.max(0, Duration.between(o.closedAt(), now).toDays());
        return Math.pow(2.0, -ageDays / settings.halfLifeDays());
    }

    // ── rules ─────────────────────────────────────────────────────────────────

    private List<QualitativeRule> deriveRules(List<OutcomeRecord> outcomes, Map<AdjustmentKey, SegmentStats> segments) {
        List<QualitativeRule> rules = new ArrayList<>();

        int alignedWins = 0, alignedTotal = 0, againstWins = 0, againstTotal = 0;
        int volumeWins = 0, volumeTotal = 0, stopLossExits = 0;
        for (OutcomeRecord o : outcomes) {
            boolean aligned = o.direction() != Direction.NEUTRAL && o.direction() == Direction.ofTrend(o.trend());
            if (aligned) {
                alignedTotal++;
                if (o.win()) alignedWins++;
            } else {
                againstTotal++;
                if (o.win()) againstWins++;
            }
            if (o.volumeRatio() != null && o.volumeRatio() > settings.volumeRatioThreshold()) {
                volumeTotal++;
                if (o.win()) volumeWins++;
            }
            if (o.stopLossTriggered()) stopLossExits++;
        }

        if (alignedTotal >= 3 && againstTotal >= 3) {
            double alignedWr = alignedWins * 100.0 / alignedTotal;
            double againstWr = againstWins * 100.0 / againstTotal;
            if (alignedWr > againstWr + 10) {
                rules.add(new QualitativeRule(QualitativeRule.TREND_ALIGNMENT,
                    round2(Math.min(0.9, alignedTotal / 20.0)),
                    String.format("Trend-aligned trades win %.0f%% vs %.0f%% against trend", alignedWr, againstWr)));
            }
        }

        if (volumeTotal >= 3) {
            double volumeWr = volumeWins * 100.0 / volumeTotal;
            if (volumeWr > 60) {
                rules.add(new QualitativeRule(QualitativeRule.VOLUME_CONFIRMATION,
                    round2(Math.min(0.85, volumeTotal / 15.0)),
                    String.format("Volume-confirmed entries win %.0f%% (n=%d)", volumeWr, volumeTotal)));
            }
        }

        for (Map.Entry<AdjustmentKey, SegmentStats> e : segments.entrySet()) {
            if (e.getKey().category() != AdjustmentCategory.PATTERN) continue;
            SegmentStats s = e.getValue();
            if (s.volumeTotal >= 3 && s.plainTotal >= 3) {
                double vc = s.volumeWins * 100.0 / s.volumeTotal;
                double vn = s.plainWins * 100.0 / s.plainTotal;
                if (vc > vn + 15) {
                    rules.add(new QualitativeRule(QualitativeRule.VOLUME_PER_PATTERN + e.getKey().pattern(),
                        round2(Math.min(0.85, s.total() / 10.0)),
                        String.format("%s wins %.0f%% with volume vs %.0f%% without", e.getKey().pattern(), vc, vn)));
                }
            }
        }

        if (stopLossExits >= 3) {
            double slRate = stopLossExits * 100.0 / outcomes.size();
            if (slRate > 40) {
                rules.add(new QualitativeRule(QualitativeRule.STOP_LOSS_TUNING,
                    round2(Math.min(0.8, stopLossExits / 10.0)),
                    String.format("%.0f%% of trades exit at stop-loss", slRate)));
            }
        }
        return rules;
    }

    private static List<FilterAdjustment> deriveFilters(List<AdjustmentRecord> adjustments) {
        List<FilterAdjustment> filters = new ArrayList<>();
        for (AdjustmentRecord r : adjustments) {
            AdjustmentCategory c = r.key().category();
            int n = r.totalTrades();
            double wr = r.winRate();
            if (c == AdjustmentCategory.PATTERN) {
                if (n >= 5 && wr < 45)       filters.add(new FilterAdjustment(r.key(), FilterAction.PENALTY, wr, n));
                else if (n >= 10 && wr > 70) filters.add(new FilterAdjustment(r.key(), FilterAction.BOOST, wr, n));
            } else if (c == AdjustmentCategory.HORIZON || c == AdjustmentCategory.SECTOR) {
                if (n >= 3 && wr < 40)       filters.add(new FilterAdjustment(r.key(), FilterAction.PENALTY, wr, n));
                else if (n >= 5 && wr > 70)  filters.add(new FilterAdjustment(r.key(), FilterAction.BOOST, wr, n));
            }
        }
        return filters;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static final class SegmentStats {
        int wins;
        int losses;
        double weightedWins;
        double weightedTotal;
        int volumeWins;
        int volumeTotal;
        int plainWins;
        int plainTotal;

        void add(boolean win, double weight, boolean volumeConfirmed) {
            if (win) wins++; else losses++;
            if (win) weightedWins += weight;
            weightedTotal += weight;
            if (volumeConfirmed) {
                volumeTotal++;
                if (win) volumeWins++;
            } else {
                plainTotal++;
                if (win) plainWins++;
            }
        }

        int total() {
            return wins + losses;
        }

        double winRate() {
            return total() == 0 ? 0.0 : wins * 100.0 / total();
        }
    }
}
