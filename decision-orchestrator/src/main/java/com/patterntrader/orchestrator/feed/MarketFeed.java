package com.patterntrader.orchestrator.feed;

import com.patterntrader.common.model.Observation;
import com.patterntrader.common.model.PricePoint;
import com.patterntrader.common.trade.Candle;

import java.time.LocalDate;
import java.util.List;

/**
 * Read side of the external feature pipeline. Implementations return empty lists for
 * dates the pipeline has not produced; they throw only when existing data is unreadable.
 */
public interface MarketFeed {

    /** Labelled observations with forward outcomes; the retrieval corpus. */
    List<Observation> history();

    /** Observations detected on {@code date}, without outcomes. */
    List<Observation> live(LocalDate date);

    /** Daily candles of {@code date} for monitoring open trades. */
    List<Candle> candles(LocalDate date);

    /** Broad-market index closes. */
    List<PricePoint> indexSeries();

    /** Volatility index closes. */
    List<PricePoint> volatilitySeries();
}
