package com.patterntrader.feedback.controller;

import com.patterntrader.common.exception.IncompleteOutcomeException;
import com.patterntrader.common.feedback.FeedbackSnapshot;
import com.patterntrader.common.feedback.OutcomeRecord;
import com.patterntrader.feedback.dto.IngestResult;
import com.patterntrader.feedback.service.FeedbackIngestionService;
import com.patterntrader.feedback.service.FeedbackSnapshotService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedbackControllerTest {

    private static final String COMPLETE = """
        {"tradeId":"T-1","instrument":"INFY","pattern":"hammer","trend":"uptrend","sector":"it",
         "horizon":5,"direction":"bullish","returnPct":1.5,"win":true,"stopLossTriggered":false,
         "exitStatus":"CLOSED_TARGET","volumeRatio":1.4,"mfePct":2.0,"maePct":-0.4}
        """;

    @Mock FeedbackIngestionService ingestionService;
    @Mock FeedbackSnapshotService snapshotService;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new FeedbackController(ingestionService, snapshotService))
            .controllerAdvice(new FeedbackExceptionHandler())
            .build();
    }

    @Test
    void acceptsOutcome() {
        when(ingestionService.ingest(any(OutcomeRecord.class)))
            .thenReturn(Mono.just(IngestResult.accepted("T-1", 5, 20)));

        client.post().uri("/api/v1/feedback/outcomes")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(COMPLETE)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.version").isEqualTo(5)
            .jsonPath("$.duplicate").isEqualTo(false);
    }

    @Test
    void incompleteOutcomeIsBadRequest() {
        when(ingestionService.ingest(any(OutcomeRecord.class)))
            .thenReturn(Mono.error(new IncompleteOutcomeException("T-2", List.of("sector"))));

        client.post().uri("/api/v1/feedback/outcomes")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(COMPLETE)
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("incomplete_outcome")
            .jsonPath("$.missingFields[0]").isEqualTo("sector");
    }

    @Test
    void servesSnapshot() {
        when(snapshotService.current()).thenReturn(Mono.just(FeedbackSnapshot.empty()));

        client.get().uri("/api/v1/feedback/snapshot")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.version").isEqualTo(0)
            .jsonPath("$.adjustments").isEmpty();
    }
}
