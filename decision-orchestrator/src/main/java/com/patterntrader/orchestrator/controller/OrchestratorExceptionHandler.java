package com.patterntrader.orchestrator.controller;

import com.patterntrader.common.exception.TradingCoreException;
import com.patterntrader.orchestrator.service.SessionInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.reactive.function.client.WebClientException;

import java.util.Map;

@RestControllerAdvice
public class OrchestratorExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Rejected request. reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "bad_request", "message", e.getMessage()));
    }

    @ExceptionHandler(SessionInProgressException.class)
    public ResponseEntity<Map<String, String>> busy(SessionInProgressException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "session_in_progress", "message", e.getMessage()));
    }

    @ExceptionHandler(WebClientException.class)
    public ResponseEntity<Map<String, String>> upstream(WebClientException e) {
        log.error("Upstream call failed; session not recorded. reason={}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(Map.of("error", "upstream_unavailable", "message", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(TradingCoreException.class)
    public ResponseEntity<Map<String, String>> tradingCore(TradingCoreException e) {
        log.error("Session failed. component={}", e.getComponent(), e);
        return ResponseEntity.internalServerError()
            .body(Map.of("error", "trading_core", "message", e.getMessage()));
    }
}
