package com.patterntrader.orchestrator.controller;

import com.patterntrader.common.model.MarketRegime;
import com.patterntrader.orchestrator.dto.CatchUpReport;
import com.patterntrader.orchestrator.dto.SessionReport;
import com.patterntrader.orchestrator.dto.SessionStatus;
import com.patterntrader.orchestrator.pipeline.PredictorProvider;
import com.patterntrader.orchestrator.service.SessionInProgressException;
import com.patterntrader.orchestrator.service.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrchestratorControllerTest {

    private static final LocalDate DATE = LocalDate.of(2026, 3, 10);

    @Mock SessionService sessionService;
    @Mock PredictorProvider predictorProvider;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new OrchestratorController(sessionService, predictorProvider))
            .controllerAdvice(new OrchestratorExceptionHandler())
            .build();
    }

    private static SessionReport report(LocalDate date) {
        return new SessionReport(date, "session-" + date + "-1", SessionStatus.COMPLETED, MarketRegime.BULL_LOW_VOL,
            4L, 12, 5, 3, 2, 1, 0, 0, Map.of("low_win_rate", 6L), 1, null);
    }

    @Test
    void runsOneSession() {
        when(sessionService.runSession(DATE)).thenReturn(Mono.just(report(DATE)));

        client.post().uri("/api/v1/orchestrate/session/2026-03-10")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("COMPLETED")
            .jsonPath("$.regime").isEqualTo("bull_low_vol")
            .jsonPath("$.accepted").isEqualTo(2)
            .jsonPath("$.skipped.low_win_rate").isEqualTo(6);
    }

    @Test
    void weekendIsBadRequest() {
        LocalDate saturday = LocalDate.of(2026, 3, 14);
        when(sessionService.runSession(saturday))
            .thenReturn(Mono.error(new IllegalArgumentException("2026-03-14 is not a trading day")));

        client.post().uri("/api/v1/orchestrate/session/2026-03-14")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("bad_request");
    }

    @Test
    void overlappingRunIsConflict() {
        when(sessionService.runSession(DATE)).thenReturn(Mono.error(new SessionInProgressException()));

        client.post().uri("/api/v1/orchestrate/session/2026-03-10")
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.error").isEqualTo("session_in_progress");
    }

    @Test
    void upstreamFailureIsBadGateway() {
        when(sessionService.runSession(DATE)).thenReturn(Mono.error(
            WebClientResponseException.create(503, "Service Unavailable", null, null, null)));

        client.post().uri("/api/v1/orchestrate/session/2026-03-10")
            .exchange()
            .expectStatus().isEqualTo(502)
            .expectBody()
            .jsonPath("$.error").isEqualTo("upstream_unavailable");
    }

    @Test
    void catchUpDefaultsToToday() {
        when(sessionService.today()).thenReturn(DATE);
        when(sessionService.catchUp(DATE)).thenReturn(Mono.just(
            new CatchUpReport(LocalDate.of(2026, 3, 6), DATE, List.of(report(LocalDate.of(2026, 3, 9)), report(DATE)))));

        client.post().uri("/api/v1/orchestrate/catch-up")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.lastRecorded").isEqualTo("2026-03-06")
            .jsonPath("$.sessions.length()").isEqualTo(2)
            .jsonPath("$.sessions[0].sessionDate").isEqualTo("2026-03-09");
    }

    @Test
    void catchUpAcceptsExplicitDate() {
        when(sessionService.catchUp(DATE)).thenReturn(Mono.just(new CatchUpReport(DATE, DATE, List.of())));

        client.post().uri("/api/v1/orchestrate/catch-up?today=2026-03-10")
            .exchange()
            .expectStatus().isOk();

        verify(sessionService).catchUp(DATE);
    }

    @Test
    void health() {
        client.get().uri("/api/v1/orchestrate/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
