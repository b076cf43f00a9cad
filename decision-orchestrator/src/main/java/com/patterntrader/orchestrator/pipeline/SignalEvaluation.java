package com.patterntrader.orchestrator.pipeline;

import com.patterntrader.common.model.TradeSignal;

/**
 * Result of running one prediction through one trade horizon: either a sized
 * {@link TradeSignal} or the name of the gate that dropped it.
 */
public record SignalEvaluation(String instrument, String pattern, int horizonDays,
                               TradeSignal signal, String skipReason) {

    public static final String NO_PRICE          = "no_price";
    public static final String NEUTRAL_DIRECTION = "neutral_direction";
    public static final String FEEDBACK_PENALTY  = "feedback_penalty";
    public static final String LOW_WIN_RATE      = "low_win_rate";
    public static final String LOW_CONFIDENCE    = "low_confidence";
    public static final String LOW_REWARD_RISK   = "low_reward_risk";
    public static final String REGIME_HALT       = "regime_halt";
    public static final String BELOW_MIN_SIZE    = "below_min_size";

    public static SignalEvaluation signal(TradeSignal signal) {
        return new SignalEvaluation(signal.instrument(), signal.pattern(), signal.horizonDays(), signal, null);
    }

    public static SignalEvaluation skipped(String instrument, String pattern, int horizonDays, String reason) {
        return new SignalEvaluation(instrument, pattern, horizonDays, null, reason);
    }

    public boolean hasSignal() {
        return signal != null;
    }
}
