package com.patterntrader.scheduler.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Triggers catch-up on decision-orchestrator. Errors propagate; the caller decides when to retry.
 */
@Component
public class OrchestratorClient {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorClient.class);

    private final WebClient webClient;

    public OrchestratorClient(@Qualifier("orchestratorClient") WebClient webClient) {
        this.webClient = webClient;
    }

    public Mono<CatchUpResult> catchUp(LocalDate today) {
        log.info("Triggering catch-up. today={}", today);
        return webClient.post()
            .uri(uri -> uri.path("/api/v1/orchestrate/catch-up").queryParam("today", today).build())
            .retrieve()
            .bodyToMono(CatchUpResult.class);
    }
}
