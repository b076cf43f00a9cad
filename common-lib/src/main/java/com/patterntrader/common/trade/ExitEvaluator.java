package com.patterntrader.common.trade;

import com.patterntrader.common.model.Direction;

import java.time.LocalDate;

/**
 * Checks a daily candle against an open trade.
 *
 * <p>Order of checks: stop-loss, then target, then horizon expiry at the close. When one bar
 * spans both stop and target the stop wins, since intrabar order is unknown. A bar that opens
 * beyond the stop fills at the open, not at the stop.
 */
public final class ExitEvaluator {

    private ExitEvaluator() {}

    /**
     * @param priorMfePct  excursion tracked before this candle
     * @param priorMaePct  excursion tracked before this candle
     */
    public static ExitDecision evaluate(Direction direction, double entryPrice, double stopLoss, double target,
                                        LocalDate expiryDate, Candle candle,
                                        double priorMfePct, double priorMaePct) {
        double favorableMove;
        double adverseMove;
        if (direction == Direction.BULLISH) {
            favorableMove = (candle.high() - entryPrice) / entryPrice * 100.0;
            adverseMove   = (candle.low() - entryPrice) / entryPrice * 100.0;
        } else {
            favorableMove = (entryPrice - candle.low()) / entryPrice * 100.0;
            adverseMove   = (entryPrice - candle.high()) / entryPrice * 100.0;
        }
        double mfe = Math.max(priorMfePct, favorableMove);
        double mae = Math.min(priorMaePct, adverseMove);

        if (direction == Direction.BULLISH) {
            if (candle.low() <= stopLoss) {
                return new ExitDecision(TradeStatus.CLOSED_SL, Math.min(candle.open(), stopLoss), mfe, mae);
            }
            if (candle.high() >= target)   return new ExitDecision(TradeStatus.CLOSED_TARGET, target, mfe, mae);
        } else {
            if (candle.high() >= stopLoss) {
                return new ExitDecision(TradeStatus.CLOSED_SL, Math.max(candle.open(), stopLoss), mfe, mae);
            }
            if (candle.low() <= target)    return new ExitDecision(TradeStatus.CLOSED_TARGET, target, mfe, mae);
        }
        if (expiryDate != null && !candle.date().isBefore(expiryDate)) {
            return new ExitDecision(TradeStatus.CLOSED_EXPIRY, candle.close(), mfe, mae);
        }
        return new ExitDecision(TradeStatus.OPEN, 0.0, mfe, mae);
    }

    /** Percent return of a fill, signed for the trade direction, before costs. */
    public static double returnPct(Direction direction, double entryPrice, double exitPrice) {
        double raw = (exitPrice - entryPrice) / entryPrice * 100.0;
        return direction == Direction.BEARISH ? -raw : raw;
    }
}
