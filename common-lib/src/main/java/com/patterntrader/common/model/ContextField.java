package com.patterntrader.common.model;

/** Context constraints applied on top of the pattern during tiered retrieval. */
public enum ContextField {
    TIMEFRAME,
    TREND,
    VOLATILITY_ZONE,
    PRICE_POSITION
}
