package com.patterntrader.orchestrator.controller;

import com.patterntrader.orchestrator.dto.CatchUpReport;
import com.patterntrader.orchestrator.dto.SessionReport;
import com.patterntrader.orchestrator.pipeline.PredictorProvider;
import com.patterntrader.orchestrator.service.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/orchestrate")
public class OrchestratorController {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorController.class);

    private final SessionService sessionService;
    private final PredictorProvider predictorProvider;

    public OrchestratorController(SessionService sessionService, PredictorProvider predictorProvider) {
        this.sessionService    = sessionService;
        this.predictorProvider = predictorProvider;
    }

    @PostMapping("/session/{date}")
    public Mono<ResponseEntity<SessionReport>> session(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.info("Session run requested. date={}", date);
        return sessionService.runSession(date).map(ResponseEntity::ok);
    }

    /** {@code today} defaults to the current date in the trading zone. */
    @PostMapping("/catch-up")
    public Mono<ResponseEntity<CatchUpReport>> catchUp(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate today) {
        LocalDate asOf = today != null ? today : sessionService.today();
        log.info("Catch-up requested. today={}", asOf);
        return sessionService.catchUp(asOf).map(ResponseEntity::ok);
    }

    @PostMapping("/index/reload")
    public Mono<ResponseEntity<Map<String, Object>>> reloadIndex() {
        log.info("Index reload requested");
        return Mono.fromCallable(predictorProvider::reload)
            .subscribeOn(Schedulers.boundedElastic())
            .map(p -> ResponseEntity.ok(Map.<String, Object>of("horizons", p.settings().horizons())));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
