package com.patterntrader.common.risk;

import java.util.List;

/**
 * Limits evaluated before a trade is accepted, independent of the circuit breakers.
 *
 * <ul>
 *   <li>sector concentration: at most {@code maxPositionsPerSector} open trades per sector</li>
 *   <li>horizon-weighted exposure: each open trade weighs {@code horizon / 5}; the total including
 *       the candidate must not exceed {@code maxConcurrentPositions}</li>
 * </ul>
 */
public final class PreEntryGate {

    private PreEntryGate() {}

    public static RiskCheckResult check(List<OpenPosition> open, String sector, int horizonDays, RiskLimits limits) {
        if (sector != null && !sector.isBlank()) {
            long sameSector = open.stream()
                .filter(p -> p.sector() != null && p.sector().equalsIgnoreCase(sector))
                .count();
            if (sameSector >= limits.maxPositionsPerSector()) {
                return RiskCheckResult.gate(RiskCheckResult.SECTOR_CONCENTRATION,
                                            sameSector + 1, limits.maxPositionsPerSector());
            }
        }

        double weighted = open.stream()
            .mapToDouble(p -> p.horizonDays() / limits.horizonWeightBase())
            .sum();
        double withCandidate = weighted + horizonDays / limits.horizonWeightBase();
        if (withCandidate > limits.maxConcurrentPositions()) {
            return RiskCheckResult.gate(RiskCheckResult.POSITION_LIMIT, withCandidate, limits.maxConcurrentPositions());
        }
        return RiskCheckResult.allow();
    }
}
