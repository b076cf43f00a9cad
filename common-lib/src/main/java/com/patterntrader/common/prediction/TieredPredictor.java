package com.patterntrader.common.prediction;

import com.patterntrader.common.index.BaseRates;
import com.patterntrader.common.index.CandidateCapper;
import com.patterntrader.common.index.IndexField;
import com.patterntrader.common.index.ObservationIndex;
import com.patterntrader.common.index.RetrievalResult;
import com.patterntrader.common.model.ConfidenceLevel;
import com.patterntrader.common.model.ContextField;
import com.patterntrader.common.model.Direction;
import com.patterntrader.common.model.HorizonForecast;
import com.patterntrader.common.model.HorizonOutcome;
import com.patterntrader.common.model.Observation;
import com.patterntrader.common.model.Prediction;
import com.patterntrader.common.model.PredictionContext;
import com.patterntrader.common.model.RetrievalTier;
import com.patterntrader.common.model.StopLossMetrics;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tiered statistical retrieval over an {@link ObservationIndex}.
 *
 * <p>Starting from every observation carrying the pattern, the context constraints are
 * applied from most to least specific ({@link RetrievalTier}). The first tier whose capped
 * candidate pool reaches {@code minMatches} wins; if that tier is outside the allowed set
 * the query yields no prediction. Absent is the normal outcome for most queries.
 *
 * <p>Stateless after construction apart from precomputed base rates. No reactive types.
 * No logging.
 */
public class TieredPredictor {

    private final ObservationIndex index;
    private final PredictorSettings settings;
    private final Map<Integer, BaseRates> baseRates = new LinkedHashMap<>();
    private final BitSet eligible = new BitSet();

    public TieredPredictor(ObservationIndex index, PredictorSettings settings) {
        this.index    = index;
        this.settings = settings.validate();
        for (int h : settings.horizons()) {
            baseRates.put(h, index.baseRates(h));
        }
        for (int id = 0; id < index.size(); id++) {
            if (index.get(id).outcome(settings.primaryHorizon()) != null) eligible.set(id);
        }
    }

    public PredictorSettings settings() {
        return settings;
    }

    public BaseRates baseRates(int horizon) {
        return baseRates.get(horizon);
    }

    // ── retrieval ─────────────────────────────────────────────────────────────

    /**
     * Runs the tier cascade for {@code pattern} and returns the first qualifying pool,
     * including tiers outside the allowed set so callers can see why a query was rejected.
     */
    public Optional<RetrievalResult> retrieve(String pattern, PredictionContext context) {
        BitSet base = index.ids(IndexField.PATTERN, pattern);
        base.and(eligible);
        if (base.isEmpty()) return Optional.empty();

        for (RetrievalTier tier : RetrievalTier.values()) {
            BitSet candidates = base;
            for (ContextField field : tier.activeFields()) {
                candidates = index.intersect(candidates, IndexField.of(field), context.valueOf(field));
            }
            List<Integer> capped = CandidateCapper.cap(index, candidates,
                context.instrument(), context.sector(), settings);
            if (capped.size() >= settings.minMatches()) {
                return Optional.of(new RetrievalResult(capped, tier, tier.droppedFields()));
            }
        }
        return Optional.empty();
    }

    // ── prediction ────────────────────────────────────────────────────────────

    public Optional<Prediction> predict(String pattern, PredictionContext context) {
        if (pattern == null) return Optional.empty();
        String p = pattern.trim().toLowerCase();
        if (!settings.patternFilter().allows(p)) return Optional.empty();

        Optional<RetrievalResult> retrieved = retrieve(p, context);
        if (retrieved.isEmpty()) return Optional.empty();
        RetrievalResult result = retrieved.get();
        if (!settings.allowedTiers().contains(result.tier())) return Optional.empty();
        if (result.size() < settings.minIndices()) return Optional.empty();

        List<Observation> matches = result.candidates().stream().map(index::get).toList();

        Map<Integer, HorizonForecast> horizons = new LinkedHashMap<>();
        for (int h : settings.horizons()) {
            HorizonForecast forecast = forecast(matches, h);
            if (forecast != null) horizons.put(h, forecast);
        }
        HorizonForecast primary = horizons.get(settings.primaryHorizon());
        if (primary == null) return Optional.empty();

        Direction direction = primary.direction();
        int horizon = settings.primaryHorizon();

        List<Double> trades   = new ArrayList<>();
        List<Double> slTrades = new ArrayList<>();
        int slTriggered = 0;
        for (Observation m : matches) {
            HorizonOutcome out = m.outcome(horizon);
            if (out == null || direction == Direction.NEUTRAL) continue;
            double ret = out.forwardReturn();
            double mfe = out.maxFavorable() == null ? 0.0 : out.maxFavorable();
            double mae = out.maxAdverse() == null ? 0.0 : out.maxAdverse();
            double sl  = StopLossCalculator.stopLossPct(p, m.atr(), m.closePrice(), settings.stopLoss());

            boolean stopped = direction == Direction.BULLISH ? mae < -sl : mfe > sl;
            trades.add(ret * direction.sign());
            if (stopped) {
                slTrades.add(-sl);
                slTriggered++;
            } else {
                slTrades.add(ret * direction.sign());
            }
        }

        double winRate      = winRate(trades);
        double profitFactor = profitFactor(trades);

        List<Double> mfes = new ArrayList<>();
        List<Double> maes = new ArrayList<>();
        for (Observation m : matches) {
            HorizonOutcome out = m.outcome(horizon);
            if (out == null) continue;
            if (out.maxFavorable() != null) mfes.add(out.maxFavorable());
            if (out.maxAdverse() != null)   maes.add(out.maxAdverse());
        }
        double avgMfe = mean(mfes);
        double avgMae = mean(maes);
        StopLossMetrics stopLoss = new StopLossMetrics(
            StopLossCalculator.stopLossPct(p, context.atr(), context.closePrice(), settings.stopLoss()),
            winRate(slTrades),
            profitFactor(slTrades),
            slTrades.isEmpty() ? 0.0 : slTriggered * 100.0 / slTrades.size(),
            avgMfe,
            avgMae,
            avgMae != 0 ? Math.abs(avgMfe / avgMae) : 0.0);

        double confidence = ConfidenceScorer.score(primary.bullishEdge(), primary.bearishEdge(),
            matches.size(), result.tier(), profitFactor, settings);
        ConfidenceLevel level = ConfidenceScorer.level(confidence, settings);

        return Optional.of(new Prediction(p, result.tier(), result.droppedFields(), matches.size(),
            horizon, Collections.unmodifiableMap(horizons), direction,
            primary.bullishEdge(), primary.bearishEdge(), winRate, profitFactor, stopLoss,
            confidence, level, null));
    }

    /**
     * Predicts every allowed pattern of a multi-pattern observation and keeps the one with
     * the strongest bullish edge in absolute terms.
     */
    public Optional<Prediction> predictBest(Observation live) {
        PredictionContext context = live.context();
        return live.patterns().stream()
            .map(pattern -> predict(pattern, context))
            .flatMap(Optional::stream)
            .max(Comparator.comparingDouble((Prediction pr) -> Math.abs(pr.bullishEdge())));
    }

    // ── aggregation helpers ───────────────────────────────────────────────────

    private HorizonForecast forecast(List<Observation> matches, int horizon) {
        List<Double> returns = new ArrayList<>();
        int bullish = 0;
        int bearish = 0;
        int neutral = 0;
        for (Observation m : matches) {
            HorizonOutcome out = m.outcome(horizon);
            if (out == null) continue;
            returns.add(out.forwardReturn());
            Direction d = out.direction() == null ? Direction.NEUTRAL : out.direction();
            switch (d) {
                case BULLISH -> bullish++;
                case BEARISH -> bearish++;
                case NEUTRAL -> neutral++;
            }
        }
        int total = returns.size();
        if (total == 0) return null;

        BaseRates base = baseRates.get(horizon);
        double bullPct = bullish * 100.0 / total;
        double bearPct = bearish * 100.0 / total;
        double neutPct = neutral * 100.0 / total;
        double bullEdge = bullPct - base.bullish() * 100.0;
        double bearEdge = bearPct - base.bearish() * 100.0;

        Direction direction;
        if (Math.abs(bullEdge) < settings.edgeThreshold() && Math.abs(bearEdge) < settings.edgeThreshold()) {
            direction = Direction.NEUTRAL;
        } else {
            direction = bullEdge > bearEdge ? Direction.BULLISH : Direction.BEARISH;
        }

        List<Double> sorted = new ArrayList<>(returns);
        Collections.sort(sorted);
        return new HorizonForecast(horizon, direction, bullPct, bearPct, neutPct, bullEdge, bearEdge,
            mean(returns), median(sorted), std(returns), sorted.get(0), sorted.get(sorted.size() - 1), total);
    }

    static double winRate(List<Double> trades) {
        if (trades.isEmpty()) return 0.0;
        long wins = trades.stream().filter(t -> t > 0).count();
        return wins * 100.0 / trades.size();
    }

    /** Gross wins over gross losses; a loss-free sample divides by 0.001. */
    static double profitFactor(List<Double> trades) {
        if (trades.isEmpty()) return 0.0;
        double grossWins   = trades.stream().filter(t -> t > 0).mapToDouble(Double::doubleValue).sum();
        double grossLosses = Math.abs(trades.stream().filter(t -> t <= 0).mapToDouble(Double::doubleValue).sum());
        boolean anyLoss = trades.stream().anyMatch(t -> t <= 0);
        if (!anyLoss) grossLosses = 0.001;
        return grossLosses > 0 ? grossWins / grossLosses : 0.0;
    }

    private static double mean(List<Double> values) {
        return values.isEmpty() ? 0.0 : values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static double median(List<Double> sorted) {
        int n = sorted.size();
        if (n == 0) return 0.0;
        return n % 2 == 1 ? sorted.get(n / 2) : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    private static double std(List<Double> values) {
        if (values.isEmpty()) return 0.0;
        double m = mean(values);
        double var = values.stream().mapToDouble(v -> (v - m) * (v - m)).sum() / values.size();
        return Math.sqrt(var);
    }
}
