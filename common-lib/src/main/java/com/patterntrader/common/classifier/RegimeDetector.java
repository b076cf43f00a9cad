package com.patterntrader.common.classifier;

import com.patterntrader.common.model.HorizonLabels;
import com.patterntrader.common.model.MarketRegime;
import com.patterntrader.common.model.PricePoint;
import com.patterntrader.common.model.RegimeAssessment;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Classifies broad-market trend and volatility into a {@link MarketRegime}.
 *
 * <p>Rules:
 * <ol>
 *   <li>volatility index ≥ extreme threshold → {@link MarketRegime#EXTREME}</li>
 *   <li>trend: last index close vs. its N-day simple moving average (bull when ≥).
 *       Fewer than N closes defaults to bull</li>
 *   <li>volatility: index ≥ high threshold → high_vol, otherwise low_vol.
 *       A missing reading counts as low_vol</li>
 * </ol>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public class RegimeDetector {

    private final RegimeSettings settings;

    public RegimeDetector(RegimeSettings settings) {
        this.settings = settings.validate();
    }

    /**
     * @param indexCloses       broad-market index closes, any order
     * @param volatilityCloses  volatility index closes, any order
     * @param asOf              ignore data after this date; null means use everything
     */
    public RegimeAssessment detect(List<PricePoint> indexCloses, List<PricePoint> volatilityCloses, LocalDate asOf) {
        List<PricePoint> index = upTo(indexCloses, asOf);
        List<PricePoint> vol   = upTo(volatilityCloses, asOf);

        Double lastClose = index.isEmpty() ? null : index.get(index.size() - 1).close();
        Double average   = null;
        String trend     = "bull";
        int n = settings.movingAverageLength();
        if (index.size() >= n) {
            average = index.subList(index.size() - n, index.size()).stream()
                .mapToDouble(PricePoint::close).average().orElse(0.0);
            trend = lastClose >= average ? "bull" : "bear";
        }

        Double vix = vol.isEmpty() ? null : vol.get(vol.size() - 1).close();
        String volatility;
        if (vix != null && vix >= settings.extremeVolatility()) volatility = "extreme";
        else if (vix != null && vix >= settings.highVolatility()) volatility = "high_vol";
        else volatility = "low_vol";

        MarketRegime regime;
        if ("extreme".equals(volatility)) {
            regime = MarketRegime.EXTREME;
        } else if ("bull".equals(trend)) {
            regime = "high_vol".equals(volatility) ? MarketRegime.BULL_HIGH_VOL : MarketRegime.BULL_LOW_VOL;
        } else {
            regime = "high_vol".equals(volatility) ? MarketRegime.BEAR_HIGH_VOL : MarketRegime.BEAR_LOW_VOL;
        }

        LocalDate effective = asOf != null ? asOf : (index.isEmpty() ? null : index.get(index.size() - 1).date());
        return new RegimeAssessment(effective, regime, settings.scales().get(regime), trend, volatility,
                                    lastClose, average, vix);
    }

    /** Scale for {@code regime} at a holding horizon, using the per-horizon table when one exists. */
    public double scaleFor(MarketRegime regime, int horizonDays) {
        Map<MarketRegime, Double> table = settings.horizonScales()
            .getOrDefault(HorizonLabels.of(horizonDays), settings.scales());
        return table.getOrDefault(regime, 0.0);
    }

    private static List<PricePoint> upTo(List<PricePoint> series, LocalDate asOf) {
        if (series == null) return List.of();
        return series.stream()
            .filter(p -> p.date() != null && (asOf == null || !p.date().isAfter(asOf)))
            .sorted((a, b) -> a.date().compareTo(b.date()))
            .toList();
    }
}
