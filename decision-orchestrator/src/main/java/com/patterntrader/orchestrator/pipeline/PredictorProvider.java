package com.patterntrader.orchestrator.pipeline;

import com.patterntrader.common.index.ObservationIndex;
import com.patterntrader.common.model.Observation;
import com.patterntrader.common.prediction.PredictorSettings;
import com.patterntrader.common.prediction.TieredPredictor;
import com.patterntrader.orchestrator.feed.MarketFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the observation index from the feed history on first use and keeps it.
 * The index is read-only once built, so one predictor is shared by all parallel lookups.
 */
@Component
public class PredictorProvider {

    private static final Logger log = LoggerFactory.getLogger(PredictorProvider.class);

    private final MarketFeed feed;
    private final PredictorSettings settings;

    private volatile TieredPredictor predictor;

    public PredictorProvider(MarketFeed feed, PredictorSettings settings) {
        this.feed     = feed;
        this.settings = settings;
    }

    public TieredPredictor get() {
        TieredPredictor current = predictor;
        if (current != null) return current;
        synchronized (this) {
            if (predictor == null) predictor = build();
            return predictor;
        }
    }

    /** Rebuilds from the current history, e.g. after the feature pipeline appended new outcomes. */
    public synchronized TieredPredictor reload() {
        predictor = build();
        return predictor;
    }

    private TieredPredictor build() {
        long start = System.currentTimeMillis();
        List<Observation> history = feed.history();
        TieredPredictor built = new TieredPredictor(new ObservationIndex(history), settings);
        log.info("[Predictor] Index built. observations={} horizons={} elapsedMs={}",
                 history.size(), settings.horizons(), System.currentTimeMillis() - start);
        return built;
    }
}
