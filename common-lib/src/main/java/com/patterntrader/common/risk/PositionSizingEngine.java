package com.patterntrader.common.risk;

import com.patterntrader.common.model.ConfidenceLevel;

/**
 * Fractional-Kelly position sizing.
 *
 * <pre>
 *   w        = winRate / 100
 *   avgLoss  = stopLossPct
 *   avgWin   = profitFactor × (1 − w) × avgLoss / w        (from PF = w·avgWin / ((1−w)·avgLoss))
 *   kelly    = w − (1 − w) / (avgWin / avgLoss)
 *   base     = clamp(kelly × kellyFraction, 0, maxPct / 100)
 *   size     = base × confidence × horizon × sector × regimeScale
 *   size     = size &lt; minPct ? 0 : min(size, maxPct)
 * </pre>
 *
 * Deterministic and side-effect free; outputs are rounded to 2 decimals.
 */
public final class PositionSizingEngine {

    private PositionSizingEngine() {}

    /**
     * @param winRate       0–100
     * @param stopLossPct   stop distance in percent, used as the average loss
     * @param horizonLabel  e.g. {@code Swing_5d}
     * @param regimeScale   from the regime detector, in [0, 1]
     * @param capital       current capital; non-positive values use the configured default
     * @return never null; {@code positionPct == 0} means no trade
     */
    public static PositionSizingDecision size(double winRate, double profitFactor, double stopLossPct,
                                              ConfidenceLevel level, String horizonLabel, String sector,
                                              double regimeScale, double capital, SizingSettings settings) {
        double equity = capital > 0 ? capital : settings.defaultCapital();
        double w = winRate / 100.0;
        double avgLoss = stopLossPct;

        double confidenceMult = settings.confidenceMultiplier(level);
        double horizonMult    = settings.horizonMultiplier(horizonLabel);
        double sectorMult     = settings.sectorMultiplier(sector);
        double scale          = Math.max(0.0, Math.min(1.0, regimeScale));

        if (w <= 0 || avgLoss <= 0 || profitFactor <= 0) {
            return none(avgLoss, confidenceMult, horizonMult, sectorMult, scale,
                        String.format("degenerate inputs wr=%.2f pf=%.3f sl=%.2f", winRate, profitFactor, stopLossPct));
        }

        double kelly;
        double avgWin;
        if (w >= 1) {
            // no losers in the sample
            avgWin = profitFactor * avgLoss;
            kelly  = 1.0;
        } else {
            avgWin = profitFactor * (1 - w) * avgLoss / w;
            kelly  = w - (1 - w) / (avgWin / avgLoss);
        }

        double base = Math.max(0.0, Math.min(kelly * settings.kellyFraction(), settings.maxPositionPct() / 100.0));
        double pct  = base * 100.0 * confidenceMult * horizonMult * sectorMult * scale;

        if (pct < settings.minPositionPct()) pct = 0.0;
        pct = Math.min(pct, settings.maxPositionPct());
        pct = round2(pct);

        double value = round2(equity * pct / 100.0);
        double risk  = round2(value * stopLossPct / 100.0);

        String reasoning = String.format(
            "wr=%.2f pf=%.3f sl=%.2f kelly=%.4f×%.2f conf=%s(%.2f) hz=%s(%.2f) sector=%s(%.2f) regime=%.2f → %.2f%%",
            winRate, profitFactor, stopLossPct, kelly, settings.kellyFraction(), level, confidenceMult,
            horizonLabel, horizonMult, sector, sectorMult, scale, pct);

        return new PositionSizingDecision(round2(base * 100.0), pct, value,
            confidenceMult, horizonMult, sectorMult, scale,
            risk, round2(risk / equity * 100.0), round2(avgWin), round2(avgLoss), reasoning);
    }

    private static PositionSizingDecision none(double avgLoss, double confidenceMult,
                                               double horizonMult, double sectorMult, double scale, String reason) {
        return new PositionSizingDecision(0.0, 0.0, 0.0, confidenceMult, horizonMult, sectorMult, scale,
            0.0, 0.0, 0.0, round2(Math.max(avgLoss, 0.0)), reason);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
