package com.patterntrader.orchestrator.adapter;

import com.patterntrader.common.feedback.FeedbackSnapshot;
import com.patterntrader.orchestrator.config.OrchestratorConfig;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class FeedbackSnapshotAdapterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T04:00:00Z"), ZoneOffset.UTC);

    private static final String SNAPSHOT = """
        {"version":7,"generatedAt":"%s","totalOutcomes":14,
         "adjustments":[],
         "rules":[],
         "filters":[{"key":{"category":"pattern_adjustments","pattern":"hammer"},"action":"BOOST","winRate":72.0,"totalTrades":11}]}
        """;

    private static FeedbackSnapshotAdapter adapter(HttpStatus status, String body) {
        var mapper = new OrchestratorConfig().objectMapper();
        ExchangeStrategies strategies = ExchangeStrategies.builder()
            .codecs(c -> {
                c.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
                c.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
            })
            .build();
        WebClient client = WebClient.builder()
            .exchangeStrategies(strategies)
            .exchangeFunction(request -> Mono.just(ClientResponse.create(status, strategies)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build()))
            .build();
        return new FeedbackSnapshotAdapter(client, CLOCK);
    }

    @Test
    void freshSnapshotIsUsed() {
        FeedbackSnapshot snapshot = adapter(HttpStatus.OK, SNAPSHOT.formatted("2026-03-09T18:00:00Z"))
            .fetchSnapshot(Duration.ofDays(7)).block();

        assertThat(snapshot.version()).isEqualTo(7L);
        assertThat(snapshot.filters()).hasSize(1);
        assertThat(snapshot.filters().get(0).key().pattern()).isEqualTo("hammer");
    }

    @Test
    void staleSnapshotFallsBackToEmpty() {
        FeedbackSnapshot snapshot = adapter(HttpStatus.OK, SNAPSHOT.formatted("2026-02-20T18:00:00Z"))
            .fetchSnapshot(Duration.ofDays(7)).block();

        assertThat(snapshot.isEmpty()).isTrue();
    }

    @Test
    void serverErrorFallsBackToEmpty() {
        FeedbackSnapshot snapshot = adapter(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"down\"}")
            .fetchSnapshot(Duration.ofDays(7)).block();

        assertThat(snapshot).isEqualTo(FeedbackSnapshot.empty());
    }
}
