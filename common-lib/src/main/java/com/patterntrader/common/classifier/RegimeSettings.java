package com.patterntrader.common.classifier;

import com.patterntrader.common.exception.InvalidConfigurationException;
import com.patterntrader.common.model.MarketRegime;

import java.util.EnumMap;
import java.util.Map;

/**
 * Regime thresholds and the regime → position-scale tables.
 *
 * @param horizonScales  per horizon label ({@code Swing_10d}, ...) override of {@code scales};
 *                       horizons not listed use the default table
 */
public record RegimeSettings(
    int movingAverageLength,
    double highVolatility,
    double extremeVolatility,
    Map<MarketRegime, Double> scales,
    Map<String, Map<MarketRegime, Double>> horizonScales
) {

    public RegimeSettings {
        scales        = Map.copyOf(scales);
        horizonScales = horizonScales == null ? Map.of() : Map.copyOf(horizonScales);
    }

    public static RegimeSettings defaults() {
        return new RegimeSettings(200, 20.0, 30.0,
            table(1.0, 0.7, 0.5, 0.3),
            Map.of("BTST_1d",   table(1.0, 0.85, 0.7, 0.5),
                   "Swing_3d",  table(1.0, 0.75, 0.6, 0.4),
                   "Swing_10d", table(1.0, 0.6, 0.4, 0.2),
                   "Swing_25d", table(1.0, 0.5, 0.3, 0.1)));
    }

    private static Map<MarketRegime, Double> table(double bullLow, double bullHigh, double bearLow, double bearHigh) {
        Map<MarketRegime, Double> m = new EnumMap<>(MarketRegime.class);
        m.put(MarketRegime.BULL_LOW_VOL,  bullLow);
        m.put(MarketRegime.BULL_HIGH_VOL, bullHigh);
        m.put(MarketRegime.BEAR_LOW_VOL,  bearLow);
        m.put(MarketRegime.BEAR_HIGH_VOL, bearHigh);
        m.put(MarketRegime.EXTREME,       0.0);
        return m;
    }

    public RegimeSettings validate() {
        if (movingAverageLength < 2)
            throw new InvalidConfigurationException("RegimeSettings", "movingAverageLength must be >= 2");
        if (highVolatility <= 0 || extremeVolatility <= highVolatility)
            throw new InvalidConfigurationException("RegimeSettings",
                "volatility thresholds must satisfy 0 < high < extreme");
        checkTable("default", scales);
        horizonScales.forEach(RegimeSettings::checkTable);
        return this;
    }

    private static void checkTable(String name, Map<MarketRegime, Double> table) {
        for (MarketRegime regime : MarketRegime.values()) {
            Double v = table.get(regime);
            if (v == null || v < 0 || v > 1)
                throw new InvalidConfigurationException("RegimeSettings",
                    "scale table " + name + " needs a value in [0,1] for " + regime.label());
        }
        if (table.get(MarketRegime.EXTREME) != 0.0)
            throw new InvalidConfigurationException("RegimeSettings",
                "scale table " + name + " must halt trading in the extreme regime");
    }
}
