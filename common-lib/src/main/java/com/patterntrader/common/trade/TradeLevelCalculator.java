package com.patterntrader.common.trade;

import com.patterntrader.common.model.Direction;
import com.patterntrader.common.prediction.StopLossCalculator;
import com.patterntrader.common.prediction.StopLossSettings;

/**
 * Stop-loss and target prices for a signal at a given horizon.
 *
 * <pre>
 *   sl%     = clamp(scale × atrMult × ATR / price × 100, floor, min(cap, horizonCap))
 *   target% = max(sl% × minRewardRisk, |expected return at horizon|)
 * </pre>
 * Bullish trades put the stop below the entry and the target above; bearish trades mirror it.
 */
public final class TradeLevelCalculator {

    private TradeLevelCalculator() {}

    public static TradeLevels levels(Direction direction, String pattern, double price, double atr,
                                     double expectedReturnPct, HorizonPlan plan, StopLossSettings stopLoss) {
        if (direction == Direction.NEUTRAL) {
            throw new IllegalArgumentException("neutral signals have no trade levels");
        }
        double slPct = StopLossCalculator.stopLossPct(pattern, atr, price, plan.stopLossScale(),
                                                      plan.stopLossCap(), stopLoss);
        double targetPct = Math.max(slPct * plan.minRewardRisk(), Math.abs(expectedReturnPct));

        double sl;
        double target;
        if (direction == Direction.BULLISH) {
            sl     = price * (1 - slPct / 100.0);
            target = price * (1 + targetPct / 100.0);
        } else {
            sl     = price * (1 + slPct / 100.0);
            target = price * (1 - targetPct / 100.0);
        }
        return new TradeLevels(price, round4(sl), round4(target), round4(slPct), round4(targetPct),
                               round4(targetPct / slPct));
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
