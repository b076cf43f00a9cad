package com.patterntrader.trade.controller;

import com.patterntrader.common.exception.RiskStatePersistenceException;
import com.patterntrader.common.exception.TradingCoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class TradeExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(TradeExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "bad_request", "message", ex.getMessage()));
    }

    /** Risk state unreadable or unwritable: nothing may trade until it is fixed. */
    @ExceptionHandler(RiskStatePersistenceException.class)
    public ResponseEntity<Map<String, Object>> riskState(RiskStatePersistenceException ex) {
        log.error("Risk state persistence failure", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("error", "risk_state_unavailable", "message", ex.getMessage()));
    }

    @ExceptionHandler(TradingCoreException.class)
    public ResponseEntity<Map<String, Object>> core(TradingCoreException ex) {
        log.error("Trading core error. component={}", ex.getComponent(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", "trading_core", "message", ex.getMessage()));
    }
}
