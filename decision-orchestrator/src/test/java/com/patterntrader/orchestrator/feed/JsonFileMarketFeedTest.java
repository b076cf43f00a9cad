package com.patterntrader.orchestrator.feed;

import com.patterntrader.common.exception.TradingCoreException;
import com.patterntrader.common.model.Direction;
import com.patterntrader.common.model.Observation;
import com.patterntrader.common.trade.Candle;
import com.patterntrader.orchestrator.config.OrchestratorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileMarketFeedTest {

    @TempDir
    Path dir;

    private JsonFileMarketFeed feed;

    @BeforeEach
    void setUp() {
        feed = new JsonFileMarketFeed(new OrchestratorConfig().objectMapper(), dir.toString());
    }

    @Test
    void readsHistoryWithOutcomes() throws IOException {
        Files.writeString(dir.resolve("history.json"), """
            [{"id":"h1","pattern":"hammer,doji","instrument":"INFY","sector":"it","timeframe":"daily",
              "trend":"uptrend","volatilityZone":"normal","pricePosition":"near_support","regime":"bull",
              "timestamp":"2025-11-03T10:00:00Z","closePrice":1500.0,"atr":30.0,"volumeRatio":1.3,
              "outcomes":{"5":{"forwardReturn":2.4,"direction":"bullish","maxFavorable":3.1,"maxAdverse":-0.8}},
              "extraField":"ignored"}]
            """);

        List<Observation> history = feed.history();

        assertThat(history).hasSize(1);
        Observation o = history.get(0);
        assertThat(o.patterns()).containsExactly("hammer", "doji");
        assertThat(o.outcome(5).forwardReturn()).isEqualTo(2.4);
        assertThat(o.outcome(5).direction()).isEqualTo(Direction.BULLISH);
    }

    @Test
    void readsCandlesForDate() throws IOException {
        Files.createDirectories(dir.resolve("candles"));
        Files.writeString(dir.resolve("candles").resolve("2026-03-02.json"), """
            [{"instrument":"INFY","date":"2026-03-02","open":100,"high":104,"low":99,"close":103}]
            """);

        List<Candle> candles = feed.candles(LocalDate.of(2026, 3, 2));

        assertThat(candles).containsExactly(new Candle("INFY", LocalDate.of(2026, 3, 2), 100, 104, 99, 103));
    }

    @Test
    void missingFilesAreEmpty() {
        assertThat(feed.history()).isEmpty();
        assertThat(feed.live(LocalDate.of(2026, 3, 2))).isEmpty();
        assertThat(feed.indexSeries()).isEmpty();
        assertThat(feed.volatilitySeries()).isEmpty();
    }

    @Test
    void malformedFileFailsLoudly() throws IOException {
        Files.writeString(dir.resolve("index.json"), "{not json");

        assertThatThrownBy(feed::indexSeries)
            .isInstanceOf(TradingCoreException.class)
            .hasMessageContaining("[MarketFeed]")
            .hasMessageContaining("index.json");
    }
}
