package com.patterntrader.common.feedback;

/** Effect of a learned filter on signal selection. */
public enum FilterAction {
    /** Segment loses money in paper trading; skip its signals. */
    PENALTY,
    /** Segment wins reliably; relax the entry thresholds. */
    BOOST
}
