package com.patterntrader.common.model;

/**
 * Context constraints of a live query. Null or blank tags are not constrained on.
 *
 * @param instrument  querying instrument; gets a tighter per-instrument cap
 * @param sector      querying sector; same-sector candidates are preferred
 * @param closePrice  last close, for the ATR stop-loss
 * @param atr         average true range at the last close
 */
public record PredictionContext(
    String timeframe,
    String trend,
    String volatilityZone,
    String pricePosition,
    String instrument,
    String sector,
    double closePrice,
    double atr
) {

    public String valueOf(ContextField field) {
        return switch (field) {
            case TIMEFRAME       -> timeframe;
            case TREND           -> trend;
            case VOLATILITY_ZONE -> volatilityZone;
            case PRICE_POSITION  -> pricePosition;
        };
    }
}
