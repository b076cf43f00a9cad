package com.patterntrader.trade.service;

import com.patterntrader.common.model.HorizonLabels;
import com.patterntrader.trade.dto.TradeStats;
import com.patterntrader.trade.model.TradeRecord;
import com.patterntrader.trade.repository.TradeRepository;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class TradeStatsService {

    private final TradeRepository tradeRepository;

    public TradeStatsService(TradeRepository tradeRepository) {
        this.tradeRepository = tradeRepository;
    }

    public Mono<TradeStats> stats() {
        return tradeRepository.findClosed().collectList().map(TradeStatsService::summarize);
    }

    static TradeStats summarize(List<TradeRecord> closed) {
        return new TradeStats(bucket(closed),
            group(closed, t -> HorizonLabels.of(t.getHorizonDays())),
            group(closed, TradeRecord::getPattern));
    }

    private static Map<String, TradeStats.Bucket> group(List<TradeRecord> closed, Function<TradeRecord, String> key) {
        Map<String, List<TradeRecord>> groups = closed.stream()
            .filter(t -> key.apply(t) != null)
            .collect(Collectors.groupingBy(key, TreeMap::new, Collectors.toList()));
        Map<String, TradeStats.Bucket> out = new TreeMap<>();
        groups.forEach((k, trades) -> out.put(k, bucket(trades)));
        return out;
    }

    private static TradeStats.Bucket bucket(List<TradeRecord> trades) {
        int n = trades.size();
        if (n == 0) return new TradeStats.Bucket(0, 0, 0.0, 0.0, 0.0);
        int wins = (int) trades.stream().filter(t -> t.getReturnPct() != null && t.getReturnPct() > 0).count();
        double avgReturn = trades.stream().mapToDouble(t -> t.getReturnPct() == null ? 0.0 : t.getReturnPct()).average().orElse(0.0);
        double totalPnl  = trades.stream().mapToDouble(t -> t.getPnl() == null ? 0.0 : t.getPnl()).sum();
        return new TradeStats.Bucket(n, wins, round2(wins * 100.0 / n), round2(avgReturn), round2(totalPnl));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
