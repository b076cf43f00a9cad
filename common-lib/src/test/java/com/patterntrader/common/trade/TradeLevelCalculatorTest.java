package com.patterntrader.common.trade;

import com.patterntrader.common.model.Direction;
import com.patterntrader.common.prediction.StopLossSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TradeLevelCalculatorTest {

    private static final Map<Integer, HorizonPlan> PLANS = HorizonPlan.defaults();
    private static final StopLossSettings SL = StopLossSettings.defaults();

    @Test
    @DisplayName("bullish swing: ATR stop below entry, target at the minimum reward/risk")
    void bullishSwing() {
        TradeLevels l = TradeLevelCalculator.levels(Direction.BULLISH, "hammer", 100.0, 2.0, 2.0, PLANS.get(5), SL);
        assertEquals(3.0, l.stopLossPct(), 1e-9);
        assertEquals(6.0, l.targetPct(), 1e-9);
        assertEquals(97.0, l.stopLoss(), 1e-9);
        assertEquals(106.0, l.target(), 1e-9);
        assertEquals(2.0, l.rewardRisk(), 1e-9);
    }

    @Test
    @DisplayName("bearish BTST: tighter stop above entry, target follows a larger expected move")
    void bearishBtst() {
        TradeLevels l = TradeLevelCalculator.levels(Direction.BEARISH, "shooting_star", 100.0, 2.0, -4.0, PLANS.get(1), SL);
        assertEquals(2.1, l.stopLossPct(), 1e-9);
        assertEquals(4.0, l.targetPct(), 1e-9);
        assertEquals(102.1, l.stopLoss(), 1e-9);
        assertEquals(96.0, l.target(), 1e-9);
        assertEquals(1.9048, l.rewardRisk(), 1e-9);
    }

    @Test
    @DisplayName("horizon cap bounds the stop distance")
    void horizonCap() {
        TradeLevels l = TradeLevelCalculator.levels(Direction.BULLISH, "hammer", 100.0, 10.0, 0.0, PLANS.get(1), SL);
        assertEquals(2.5, l.stopLossPct(), 1e-9);
    }

    @Test
    @DisplayName("structural patterns use the wider ATR multiple")
    void structuralPattern() {
        TradeLevels l = TradeLevelCalculator.levels(Direction.BULLISH, "bullish_harami", 100.0, 1.0, 0.0, PLANS.get(5), SL);
        assertEquals(2.0, l.stopLossPct(), 1e-9);
    }

    @Test
    @DisplayName("neutral direction has no levels")
    void neutralRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> TradeLevelCalculator.levels(Direction.NEUTRAL, "doji", 100.0, 1.0, 0.0, PLANS.get(5), SL));
    }
}
