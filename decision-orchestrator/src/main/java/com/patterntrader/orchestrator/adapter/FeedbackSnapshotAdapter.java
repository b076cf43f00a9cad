package com.patterntrader.orchestrator.adapter;

import com.patterntrader.common.feedback.FeedbackSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Fetches the versioned feedback snapshot once per session.
 *
 * <p>On any error, and when the snapshot is older than {@code maxAge}, the adapter returns
 * {@link FeedbackSnapshot#empty()}: the session then runs on raw predictions with no
 * blending and no feedback filters.
 */
@Component
public class FeedbackSnapshotAdapter {

    private static final Logger log = LoggerFactory.getLogger(FeedbackSnapshotAdapter.class);

    private final WebClient feedbackClient;
    private final Clock clock;

    public FeedbackSnapshotAdapter(@Qualifier("feedbackClient") WebClient feedbackClient, Clock clock) {
        this.feedbackClient = feedbackClient;
        this.clock          = clock;
    }

    public Mono<FeedbackSnapshot> fetchSnapshot(Duration maxAge) {
        return feedbackClient.get()
            .uri("/api/v1/feedback/snapshot")
            .retrieve()
            .bodyToMono(FeedbackSnapshot.class)
            .map(snapshot -> {
                if (!snapshot.isEmpty() && snapshot.isStale(clock.instant(), maxAge)) {
                    log.warn("Feedback snapshot is stale, running unblended. version={} generatedAt={} maxAge={}",
                             snapshot.version(), snapshot.generatedAt(), maxAge);
                    return FeedbackSnapshot.empty();
                }
                log.debug("Feedback snapshot fetched. version={} adjustments={} rules={} filters={}",
                          snapshot.version(), snapshot.adjustments().size(),
                          snapshot.rules().size(), snapshot.filters().size());
                return snapshot;
            })
            .defaultIfEmpty(FeedbackSnapshot.empty())
            .onErrorResume(e -> {
                log.warn("Feedback snapshot fetch failed, running unblended. reason={}", e.getMessage());
                return Mono.just(FeedbackSnapshot.empty());
            });
    }
}
