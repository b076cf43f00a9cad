package com.patterntrader.common.prediction;

import java.util.Set;

/**
 * Pattern allow/deny lists. Excluded patterns never predict; when the whitelist is
 * non-empty only whitelisted patterns do.
 */
public record PatternFilter(Set<String> excluded, Set<String> whitelist) {

    public PatternFilter {
        excluded  = excluded == null ? Set.of() : Set.copyOf(excluded);
        whitelist = whitelist == null ? Set.of() : Set.copyOf(whitelist);
    }

    public static PatternFilter defaults() {
        return new PatternFilter(
            Set.of("hanging_man", "doji", "three_outside_up", "three_inside_up",
                   "three_outside_down", "bearish_harami"),
            Set.of("homing_pigeon", "hammer", "three_black_crows", "belt_hold_bullish",
                   "three_inside_down", "harami_cross", "bullish_kicker", "rising_three_methods"));
    }

    public static PatternFilter allowAll() {
        return new PatternFilter(Set.of(), Set.of());
    }

    public boolean allows(String pattern) {
        if (pattern == null) return false;
        String p = pattern.trim().toLowerCase();
        if (excluded.contains(p)) return false;
        return whitelist.isEmpty() || whitelist.contains(p);
    }
}
