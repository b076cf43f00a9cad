package com.patterntrader.common.index;

import com.patterntrader.common.model.ContextField;
import com.patterntrader.common.model.RetrievalTier;

import java.util.List;

/**
 * Outcome of tiered retrieval: the capped, recency-ordered candidate ids, the tier that
 * produced them, and the context constraints that had to be dropped to get there.
 */
public record RetrievalResult(List<Integer> candidates, RetrievalTier tier, List<ContextField> droppedFields) {

    public RetrievalResult {
        candidates    = List.copyOf(candidates);
        droppedFields = List.copyOf(droppedFields);
    }

    public int size() {
        return candidates.size();
    }
}
