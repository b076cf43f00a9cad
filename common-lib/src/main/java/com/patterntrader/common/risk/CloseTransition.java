package com.patterntrader.common.risk;

import java.util.List;

/**
 * State after applying one trade close, plus the breakers whose condition held afterwards.
 *
 * @param newlyTripped  breakers that were not set before this close
 */
public record CloseTransition(RiskState state, List<RiskCheckResult> tripped, List<CircuitBreaker> newlyTripped) {}
