package com.patterntrader.common.index;

import com.patterntrader.common.model.ContextField;

/** Observation attributes the index keeps a posting set for. */
public enum IndexField {
    PATTERN,
    INSTRUMENT,
    SECTOR,
    TIMEFRAME,
    TREND,
    VOLATILITY_ZONE,
    PRICE_POSITION,
    REGIME;

    public static IndexField of(ContextField field) {
        return switch (field) {
            case TIMEFRAME       -> TIMEFRAME;
            case TREND           -> TREND;
            case VOLATILITY_ZONE -> VOLATILITY_ZONE;
            case PRICE_POSITION  -> PRICE_POSITION;
        };
    }
}
