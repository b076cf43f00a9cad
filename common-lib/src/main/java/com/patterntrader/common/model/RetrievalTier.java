package com.patterntrader.common.model;

import java.util.List;

/**
 * Specificity level used when retrieving historical matches, most specific first.
 *
 * <p>Each tier lists the context fields it drops relative to {@link #TIER_1}, so a
 * retrieval result can report exactly which constraints were relaxed.
 */
public enum RetrievalTier {

    /** pattern ∧ timeframe ∧ trend ∧ volatility zone ∧ price position */
    TIER_1(List.of()),

    /** pattern ∧ timeframe ∧ trend */
    TIER_2(List.of(ContextField.VOLATILITY_ZONE, ContextField.PRICE_POSITION)),

    /** pattern ∧ timeframe */
    TIER_3(List.of(ContextField.VOLATILITY_ZONE, ContextField.PRICE_POSITION, ContextField.TREND)),

    /** pattern only */
    TIER_4(List.of(ContextField.VOLATILITY_ZONE, ContextField.PRICE_POSITION, ContextField.TREND,
                   ContextField.TIMEFRAME));

    private final List<ContextField> droppedFields;

    RetrievalTier(List<ContextField> droppedFields) {
        this.droppedFields = droppedFields;
    }

    public List<ContextField> droppedFields() {
        return droppedFields;
    }

    /** Context fields this tier still constrains on. */
    public List<ContextField> activeFields() {
        return List.of(ContextField.values()).stream()
            .filter(f -> !droppedFields.contains(f))
            .toList();
    }
}
