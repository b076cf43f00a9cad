package com.patterntrader.trade.controller;

import com.patterntrader.common.model.TradeSignal;
import com.patterntrader.trade.dto.MonitorReport;
import com.patterntrader.trade.dto.MonitorRequest;
import com.patterntrader.trade.dto.RiskStatus;
import com.patterntrader.trade.dto.SessionSummary;
import com.patterntrader.trade.dto.SignalDecision;
import com.patterntrader.trade.dto.TradeStats;
import com.patterntrader.trade.model.TradeRecord;
import com.patterntrader.trade.service.RiskManager;
import com.patterntrader.trade.service.SessionLogService;
import com.patterntrader.trade.service.TradeLifecycleService;
import com.patterntrader.trade.service.TradeStatsService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/trade")
public class TradeController {

    private static final Logger log = LoggerFactory.getLogger(TradeController.class);

    private final TradeLifecycleService lifecycleService;
    private final TradeStatsService statsService;
    private final RiskManager riskManager;
    private final SessionLogService sessionLogService;

    public TradeController(TradeLifecycleService lifecycleService, TradeStatsService statsService,
                           RiskManager riskManager, SessionLogService sessionLogService) {
        this.lifecycleService  = lifecycleService;
        this.statsService      = statsService;
        this.riskManager       = riskManager;
        this.sessionLogService = sessionLogService;
    }

    @PostMapping("/signals")
    public Mono<ResponseEntity<SignalDecision>> submit(@RequestBody TradeSignal signal) {
        log.info("Signal received. instrument={} pattern={} horizon={} date={} size={}%",
                 signal.instrument(), signal.pattern(), signal.horizonDays(), signal.signalDate(), signal.positionPct());
        return lifecycleService.accept(signal).map(ResponseEntity::ok);
    }

    @PostMapping("/monitor")
    public Mono<ResponseEntity<MonitorReport>> monitor(@Valid @RequestBody MonitorRequest request) {
        log.info("Monitor run requested. candles={}", request.candles().size());
        return lifecycleService.monitor(request.candles()).map(ResponseEntity::ok);
    }

    @GetMapping("/open")
    public Flux<TradeRecord> open() {
        return lifecycleService.openTrades();
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<TradeStats>> stats() {
        return statsService.stats().map(ResponseEntity::ok);
    }

    @GetMapping("/risk")
    public Mono<ResponseEntity<RiskStatus>> risk() {
        return riskManager.currentState()
            .zipWith(riskManager.canTrade(), RiskStatus::new)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/risk/reset")
    public Mono<ResponseEntity<RiskStatus>> reset(@RequestParam(defaultValue = "false") boolean confirm) {
        log.warn("Manual breaker reset requested. confirm={}", confirm);
        return riskManager.manualReset(confirm)
            .flatMap(state -> riskManager.canTrade().map(check -> new RiskStatus(state, check)))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/sessions/last")
    public Mono<ResponseEntity<SessionSummary>> lastSession() {
        return sessionLogService.lastSession()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.noContent().build());
    }

    @PostMapping("/sessions/{date}")
    public Mono<ResponseEntity<SessionSummary>> recordSession(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @Valid @RequestBody SessionSummary summary) {
        return sessionLogService.record(date, summary).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
