package com.patterntrader.notification.sender;

import com.patterntrader.common.model.AlertMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

@Component
public class SlackWebhookSender {

    private static final Logger log = LoggerFactory.getLogger(SlackWebhookSender.class);

    private final WebClient webClient;
    private final String slackWebhookUrl;
    private final boolean slackEnabled;

    public SlackWebhookSender(WebClient.Builder builder,
                              @Value("${notification.slack.webhook-url:}") String slackWebhookUrl,
                              @Value("${notification.slack.enabled:false}") boolean slackEnabled) {
        this.webClient       = builder.build();
        this.slackWebhookUrl = slackWebhookUrl == null ? "" : slackWebhookUrl;
        this.slackEnabled    = slackEnabled;
    }

    public boolean isDelivering() {
        return slackEnabled && !slackWebhookUrl.isBlank();
    }

    /** Posts the alert to Slack, or logs it when Slack is off. Delivery failures are logged, never raised. */
    public Mono<Void> send(AlertMessage alert) {
        if (!isDelivering()) {
            logAlert(alert);
            return Mono.empty();
        }

        return webClient.post()
            .uri(slackWebhookUrl)
            .bodyValue(Map.of("text", buildSlackMessage(alert)))
            .retrieve()
            .toBodilessEntity()
            .timeout(Duration.ofSeconds(10))
            .doOnSuccess(r -> log.info("Slack alert sent. kind={} status={}", alert.kind(), r.getStatusCode()))
            .then()
            .onErrorResume(e -> {
                log.warn("Slack alert failed (non-fatal). kind={} reason={}", alert.kind(), e.getMessage());
                logAlert(alert);
                return Mono.empty();
            });
    }

    String buildSlackMessage(AlertMessage alert) {
        return severityEmoji(alert.severity()) + " " + alert.render();
    }

    private String severityEmoji(String severity) {
        return switch (severity == null ? "" : severity) {
            case "CRITICAL" -> "🔴";
            case "WARN"     -> "🟡";
            case "INFO"     -> "🟢";
            default         -> "⚪";
        };
    }

    private void logAlert(AlertMessage alert) {
        if ("CRITICAL".equals(alert.severity())) {
            log.warn("=== Alert: {} ===\n{}", alert.kind(), alert.render());
        } else {
            log.info("=== Alert: {} ===\n{}", alert.kind(), alert.render());
        }
    }
}
