package com.patterntrader.trade.client;

import com.patterntrader.common.feedback.OutcomeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Hands closed-trade outcomes to feedback-service. A failed post is not an error here:
 * the trade keeps {@code outcome_published = false} and the next monitor run retries it.
 */
@Component
public class FeedbackServiceClient {

    private static final Logger log = LoggerFactory.getLogger(FeedbackServiceClient.class);
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;

    public FeedbackServiceClient(@Qualifier("feedbackWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /** @return true once feedback-service accepted (or already had) the outcome */
    public Mono<Boolean> publish(OutcomeRecord outcome) {
        return webClient.post()
            .uri("/api/v1/feedback/outcomes")
            .bodyValue(outcome)
            .retrieve()
            .toBodilessEntity()
            .timeout(TIMEOUT)
            .map(response -> true)
            .doOnSuccess(ok -> log.info("[Outcome] Published. tradeId={} pattern={} return={}",
                                        outcome.tradeId(), outcome.pattern(), outcome.returnPct()))
            .onErrorResume(e -> {
                log.warn("[Outcome] Publish failed (will retry). tradeId={} reason={}", outcome.tradeId(), e.getMessage());
                return Mono.just(false);
            });
    }
}
