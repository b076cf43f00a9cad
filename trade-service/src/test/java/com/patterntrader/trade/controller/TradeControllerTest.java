package com.patterntrader.trade.controller;

import com.patterntrader.common.exception.RiskStatePersistenceException;
import com.patterntrader.common.model.TradeSignal;
import com.patterntrader.common.risk.CircuitBreaker;
import com.patterntrader.common.risk.RiskCheckResult;
import com.patterntrader.trade.dto.SessionSummary;
import com.patterntrader.trade.dto.SignalDecision;
import com.patterntrader.trade.service.RiskManager;
import com.patterntrader.trade.service.SessionLogService;
import com.patterntrader.trade.service.TradeLifecycleService;
import com.patterntrader.trade.service.TradeStatsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TradeControllerTest {

    private static final String SIGNAL = """
        {"instrument":"INFY","sector":"it","pattern":"hammer","trend":"uptrend","signalDate":"2026-03-02",
         "horizonDays":5,"direction":"bullish","entryPrice":100.0,"stopLoss":97.0,"target":106.0,
         "stopLossPct":3.0,"targetPct":6.0,"positionPct":3.0,"winRate":62.0,"rawWinRate":60.0,
         "confidence":0.58,"rawConfidence":0.55,"level":"HIGH","tier":"TIER_1","volumeRatio":1.4,
         "regime":"bull_low_vol","reasoning":"test"}
        """;

    @Mock TradeLifecycleService lifecycleService;
    @Mock TradeStatsService statsService;
    @Mock RiskManager riskManager;
    @Mock SessionLogService sessionLogService;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(
                new TradeController(lifecycleService, statsService, riskManager, sessionLogService))
            .controllerAdvice(new TradeExceptionHandler())
            .build();
    }

    @Test
    void rejectedSignalReportsBreaker() {
        when(lifecycleService.accept(any(TradeSignal.class))).thenReturn(Mono.just(
            SignalDecision.rejected(RiskCheckResult.breaker(CircuitBreaker.DAILY_LOSS, 4.5, 3.0))));

        client.post().uri("/api/v1/trade/signals")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(SIGNAL)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.outcome").isEqualTo("REJECTED")
            .jsonPath("$.check.reason").isEqualTo("daily_loss")
            .jsonPath("$.check.currentValue").isEqualTo(4.5);
    }

    @Test
    void invalidSignalIsBadRequest() {
        when(lifecycleService.accept(any(TradeSignal.class)))
            .thenReturn(Mono.error(new IllegalArgumentException("signal is not tradable")));

        client.post().uri("/api/v1/trade/signals")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(SIGNAL)
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("bad_request");
    }

    @Test
    void unreadableRiskStateIsServiceUnavailable() {
        when(riskManager.currentState())
            .thenReturn(Mono.error(new RiskStatePersistenceException("failed to load risk state")));
        when(riskManager.canTrade())
            .thenReturn(Mono.error(new RiskStatePersistenceException("failed to load risk state")));

        client.get().uri("/api/v1/trade/risk")
            .exchange()
            .expectStatus().isEqualTo(503)
            .expectBody()
            .jsonPath("$.error").isEqualTo("risk_state_unavailable");
    }

    @Test
    void resetWithoutConfirmIsBadRequest() {
        when(riskManager.manualReset(false))
            .thenReturn(Mono.error(new IllegalArgumentException("manual breaker reset requires confirm=true")));

        client.post().uri("/api/v1/trade/risk/reset")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    void noProcessedSessionYieldsNoContent() {
        when(sessionLogService.lastSession()).thenReturn(Mono.empty());

        client.get().uri("/api/v1/trade/sessions/last")
            .exchange()
            .expectStatus().isNoContent();
    }

    @Test
    void recordsSession() {
        LocalDate date = LocalDate.of(2026, 3, 13);
        when(sessionLogService.record(eq(date), any(SessionSummary.class)))
            .thenReturn(Mono.just(new SessionSummary(date, 4, 2, 1)));

        client.post().uri("/api/v1/trade/sessions/2026-03-13")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"signalsReceived\":4,\"signalsAccepted\":2,\"tradesClosed\":1}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.sessionDate").isEqualTo("2026-03-13")
            .jsonPath("$.signalsAccepted").isEqualTo(2);
    }

    @Test
    void health() {
        client.get().uri("/api/v1/trade/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
