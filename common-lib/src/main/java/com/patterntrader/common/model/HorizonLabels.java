package com.patterntrader.common.model;

/**
 * Maps a holding horizon in trading days to the label used by the sizing,
 * regime and feedback tables ({@code BTST_1d}, {@code Swing_5d}, ...).
 */
public final class HorizonLabels {

    private HorizonLabels() {}

    public static String of(int horizonDays) {
        return horizonDays == 1 ? "BTST_1d" : "Swing_" + horizonDays + "d";
    }
}
