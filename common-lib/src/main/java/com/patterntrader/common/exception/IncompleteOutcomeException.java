package com.patterntrader.common.exception;

import java.util.List;

/**
 * Outcome record is missing segmentation fields. Ingesting it would make the
 * feedback cascade fall back to less specific keys without anyone noticing.
 */
public class IncompleteOutcomeException extends TradingCoreException {
    private final List<String> missingFields;

    public IncompleteOutcomeException(String tradeId, List<String> missingFields) {
        super("FeedbackStore", "outcome " + tradeId + " missing fields " + missingFields);
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
