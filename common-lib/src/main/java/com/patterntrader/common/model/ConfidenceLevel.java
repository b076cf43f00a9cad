package com.patterntrader.common.model;

/**
 * Discrete confidence bucket derived from the continuous confidence score.
 *
 * <ul>
 *   <li>{@link #HIGH}:   score above the high threshold (default 0.55)</li>
 *   <li>{@link #MEDIUM}: score above the medium threshold (default 0.35)</li>
 *   <li>{@link #LOW}:    everything else</li>
 * </ul>
 */
public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW
}
