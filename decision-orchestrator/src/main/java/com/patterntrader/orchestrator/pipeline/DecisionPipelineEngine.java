package com.patterntrader.orchestrator.pipeline;

import com.patterntrader.common.classifier.RegimeDetector;
import com.patterntrader.common.feedback.AdjustmentKey;
import com.patterntrader.common.feedback.FeedbackBlender;
import com.patterntrader.common.feedback.FeedbackSnapshot;
import com.patterntrader.common.feedback.FilterAction;
import com.patterntrader.common.feedback.FilterAdjustment;
import com.patterntrader.common.model.ConfidenceLevel;
import com.patterntrader.common.model.Direction;
import com.patterntrader.common.model.HorizonForecast;
import com.patterntrader.common.model.HorizonLabels;
import com.patterntrader.common.model.Observation;
import com.patterntrader.common.model.Prediction;
import com.patterntrader.common.model.RegimeAssessment;
import com.patterntrader.common.model.TradeSignal;
import com.patterntrader.common.prediction.StopLossSettings;
import com.patterntrader.common.risk.PositionSizingDecision;
import com.patterntrader.common.risk.PositionSizingEngine;
import com.patterntrader.common.risk.SizingSettings;
import com.patterntrader.common.trade.HorizonPlan;
import com.patterntrader.common.trade.TradeLevelCalculator;
import com.patterntrader.common.trade.TradeLevels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns one raw prediction into per-horizon trade signals.
 *
 * <h3>Gate order, per trade horizon</h3>
 * <ol>
 *   <li>Direction: the horizon forecast's direction, else the primary one; neutral is dropped</li>
 *   <li>Feedback filters: a penalty on pattern, pattern+horizon or pattern+sector drops the signal;
 *       a boost relaxes the win-rate floor and admits LOW confidence</li>
 *   <li>Feedback blending of win rate and confidence</li>
 *   <li>Win-rate floor, confidence floor</li>
 *   <li>Trade levels and the reward/risk floor</li>
 *   <li>Regime scale at the horizon; zero halts</li>
 *   <li>Fractional-Kelly sizing; below the minimum size is dropped</li>
 * </ol>
 *
 * <p>Holds no mutable state; a single instance serves every session.
 */
public class DecisionPipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionPipelineEngine.class);

    private final FeedbackBlender blender;
    private final RegimeDetector regimeDetector;
    private final Map<Integer, HorizonPlan> plans;
    private final StopLossSettings stopLoss;
    private final SizingSettings sizing;
    private final SignalFilter filter;

    public DecisionPipelineEngine(FeedbackBlender blender, RegimeDetector regimeDetector,
                                  Map<Integer, HorizonPlan> plans, StopLossSettings stopLoss,
                                  SizingSettings sizing, SignalFilter filter) {
        this.blender        = blender;
        this.regimeDetector = regimeDetector;
        this.plans          = plans;
        this.stopLoss       = stopLoss;
        this.sizing         = sizing;
        this.filter         = filter;
    }

    public List<SignalEvaluation> evaluate(Observation live, Prediction prediction, FeedbackSnapshot snapshot,
                                           RegimeAssessment regime, double capital, LocalDate sessionDate) {
        List<SignalEvaluation> out = new ArrayList<>(plans.size());
        for (HorizonPlan plan : plans.values()) {
            SignalEvaluation evaluation = evaluate(live, prediction, snapshot, regime, capital, sessionDate, plan);
            if (!evaluation.hasSignal()) {
                log.debug("[Pipeline] skipped instrument={} pattern={} horizon={} reason={}",
                          live.instrument(), prediction.pattern(), plan.horizonDays(), evaluation.skipReason());
            }
            out.add(evaluation);
        }
        return out;
    }

    SignalEvaluation evaluate(Observation live, Prediction prediction, FeedbackSnapshot snapshot,
                              RegimeAssessment regime, double capital, LocalDate sessionDate, HorizonPlan plan) {
        int h = plan.horizonDays();
        String instrument = live.instrument();
        String pattern    = prediction.pattern();
        String sector     = live.sector();

        if (live.closePrice() <= 0) return SignalEvaluation.skipped(instrument, pattern, h, SignalEvaluation.NO_PRICE);

        HorizonForecast forecast = prediction.horizon(h);
        Direction direction = forecast != null ? forecast.direction() : prediction.direction();
        if (direction == null || direction == Direction.NEUTRAL)
            return SignalEvaluation.skipped(instrument, pattern, h, SignalEvaluation.NEUTRAL_DIRECTION);

        // ── feedback filters ──
        boolean boosted = false;
        for (AdjustmentKey key : filterKeys(pattern, h, sector)) {
            Optional<FilterAdjustment> adjustment = snapshot.filter(key);
            if (adjustment.isEmpty()) continue;
            if (adjustment.get().action() == FilterAction.PENALTY)
                return SignalEvaluation.skipped(instrument, pattern, h, SignalEvaluation.FEEDBACK_PENALTY);
            boosted = true;
        }

        Prediction blended = blender.blend(prediction, live.trend(), h, sector, snapshot);

        double minWinRate = filter.minWinRate() - (boosted ? filter.boostWinRateRelief() : 0.0);
        if (blended.winRate() < minWinRate)
            return SignalEvaluation.skipped(instrument, pattern, h, SignalEvaluation.LOW_WIN_RATE);
        if (filter.rejectLowConfidence() && !boosted && blended.level() == ConfidenceLevel.LOW)
            return SignalEvaluation.skipped(instrument, pattern, h, SignalEvaluation.LOW_CONFIDENCE);

        // ── levels ──
        double expectedReturn = forecast != null ? forecast.avgReturn() : 0.0;
        TradeLevels levels = TradeLevelCalculator.levels(direction, pattern, live.closePrice(), live.atr(),
                                                         expectedReturn, plan, stopLoss);
        if (levels.rewardRisk() < filter.minRewardRisk())
            return SignalEvaluation.skipped(instrument, pattern, h, SignalEvaluation.LOW_REWARD_RISK);

        // ── sizing ──
        double scale = regimeDetector.scaleFor(regime.regime(), h);
        if (scale <= 0.0) return SignalEvaluation.skipped(instrument, pattern, h, SignalEvaluation.REGIME_HALT);

        String label = HorizonLabels.of(h);
        PositionSizingDecision size = PositionSizingEngine.size(blended.winRate(), blended.profitFactor(),
            levels.stopLossPct(), blended.level(), label, sector, scale, capital, sizing);
        if (!size.isTradable())
            return SignalEvaluation.skipped(instrument, pattern, h, SignalEvaluation.BELOW_MIN_SIZE);

        String reasoning = String.format("%s %s %s tier=%s wr=%.1f (raw %.1f)%s conf=%s rr=%.2f regime=%s | %s",
            pattern, direction.label(), label, prediction.tier(), blended.winRate(), prediction.winRate(),
            boosted ? " boosted" : "", blended.level(), levels.rewardRisk(), regime.regime().label(),
            size.reasoning());

        return SignalEvaluation.signal(new TradeSignal(
            instrument, sector, pattern, live.trend(), sessionDate, h, direction,
            levels.entryPrice(), levels.stopLoss(), levels.target(), levels.stopLossPct(), levels.targetPct(),
            size.positionPct(), round2(blended.winRate()), round2(prediction.winRate()),
            blended.confidence(), prediction.confidence(), blended.level(), prediction.tier(),
            live.volumeRatio(), regime.regime(), reasoning));
    }

    private static List<AdjustmentKey> filterKeys(String pattern, int horizon, String sector) {
        List<AdjustmentKey> keys = new ArrayList<>(3);
        keys.add(AdjustmentKey.pattern(pattern));
        keys.add(AdjustmentKey.patternHorizon(pattern, horizon));
        if (sector != null && !sector.isBlank()) keys.add(AdjustmentKey.patternSector(pattern, sector));
        return keys;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
