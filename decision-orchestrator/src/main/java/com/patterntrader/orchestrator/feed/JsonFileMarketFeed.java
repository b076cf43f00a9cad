package com.patterntrader.orchestrator.feed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patterntrader.common.exception.TradingCoreException;
import com.patterntrader.common.model.Observation;
import com.patterntrader.common.model.PricePoint;
import com.patterntrader.common.trade.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * {@link MarketFeed} over JSON files written by the feature pipeline.
 *
 * <pre>
 *   {data-dir}/history.json
 *   {data-dir}/live/2026-03-02.json
 *   {data-dir}/candles/2026-03-02.json
 *   {data-dir}/index.json
 *   {data-dir}/volatility.json
 * </pre>
 */
@Component
public class JsonFileMarketFeed implements MarketFeed {

    private static final Logger log = LoggerFactory.getLogger(JsonFileMarketFeed.class);

    private static final TypeReference<List<Observation>> OBSERVATIONS = new TypeReference<>() {};
    private static final TypeReference<List<Candle>> CANDLES = new TypeReference<>() {};
    private static final TypeReference<List<PricePoint>> PRICES = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path dataDir;

    public JsonFileMarketFeed(ObjectMapper objectMapper, @Value("${feed.data-dir}") String dataDir) {
        this.objectMapper = objectMapper;
        this.dataDir      = Path.of(dataDir);
    }

    @Override
    public List<Observation> history() {
        List<Observation> history = read(dataDir.resolve("history.json"), OBSERVATIONS);
        if (history.isEmpty()) {
            log.warn("[MarketFeed] No history under {}; every prediction will be absent", dataDir);
        }
        return history;
    }

    @Override
    public List<Observation> live(LocalDate date) {
        return read(dataDir.resolve("live").resolve(date + ".json"), OBSERVATIONS);
    }

    @Override
    public List<Candle> candles(LocalDate date) {
        return read(dataDir.resolve("candles").resolve(date + ".json"), CANDLES);
    }

    @Override
    public List<PricePoint> indexSeries() {
        return read(dataDir.resolve("index.json"), PRICES);
    }

    @Override
    public List<PricePoint> volatilitySeries() {
        return read(dataDir.resolve("volatility.json"), PRICES);
    }

    private <T> List<T> read(Path file, TypeReference<List<T>> type) {
        if (!Files.isRegularFile(file)) {
            log.debug("[MarketFeed] missing file={}", file);
            return List.of();
        }
        try {
            List<T> values = objectMapper.readValue(file.toFile(), type);
            return values == null ? List.of() : values;
        } catch (IOException e) {
            throw new TradingCoreException("MarketFeed", "cannot read " + file, e);
        }
    }
}
