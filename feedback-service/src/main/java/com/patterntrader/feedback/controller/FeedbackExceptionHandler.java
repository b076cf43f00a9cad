package com.patterntrader.feedback.controller;

import com.patterntrader.common.exception.IncompleteOutcomeException;
import com.patterntrader.common.exception.TradingCoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class FeedbackExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(FeedbackExceptionHandler.class);

    @ExceptionHandler(IncompleteOutcomeException.class)
    public ResponseEntity<Map<String, Object>> incomplete(IncompleteOutcomeException ex) {
        return ResponseEntity.badRequest().body(Map.of(
            "error", "incomplete_outcome",
            "message", ex.getMessage(),
            "missingFields", ex.getMissingFields()));
    }

    @ExceptionHandler(TradingCoreException.class)
    public ResponseEntity<Map<String, Object>> core(TradingCoreException ex) {
        log.error("Feedback store error. component={}", ex.getComponent(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
            "error", "feedback_store",
            "message", ex.getMessage()));
    }
}
