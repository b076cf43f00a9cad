package com.patterntrader.trade.client;

import com.patterntrader.common.model.AlertMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/** Fire-and-forget alerts. Never fails the caller. */
@Component
public class NotificationClient {

    private static final Logger log = LoggerFactory.getLogger(NotificationClient.class);

    private final WebClient webClient;

    public NotificationClient(@Qualifier("notificationWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    public Mono<Void> send(AlertMessage alert) {
        return webClient.post()
            .uri("/api/v1/notify/alert")
            .bodyValue(alert)
            .retrieve()
            .toBodilessEntity()
            .timeout(Duration.ofSeconds(5))
            .then()
            .onErrorResume(e -> {
                log.warn("[Notify] Alert not delivered (non-fatal). kind={} reason={}", alert.kind(), e.getMessage());
                return Mono.empty();
            });
    }
}
