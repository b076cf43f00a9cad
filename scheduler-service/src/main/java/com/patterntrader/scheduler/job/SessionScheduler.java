package com.patterntrader.scheduler.job;

import com.patterntrader.scheduler.client.CatchUpResult;
import com.patterntrader.scheduler.client.OrchestratorClient;
import com.patterntrader.scheduler.config.SchedulerProperties;
import com.patterntrader.scheduler.strategy.SessionTimingStrategy;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Daily session trigger.
 *
 * <p>Each cycle is a fresh {@link Mono}:
 * <pre>
 *   delay(until next run) → POST catch-up → compute next delay → repeat
 * </pre>
 * Catch-up replays every trading day the orchestrator has not logged yet, so a missed or failed
 * run is made up by the next successful one. The loop never stops: a failed cycle is retried after
 * {@code scheduler.retry-interval}, capped at the next regular run.
 */
@Component
public class SessionScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionScheduler.class);

    private final OrchestratorClient orchestratorClient;
    private final SchedulerProperties properties;
    private final Clock clock;

    public SessionScheduler(OrchestratorClient orchestratorClient, SchedulerProperties properties, Clock clock) {
        this.orchestratorClient = orchestratorClient;
        this.properties         = properties.validated();
        this.clock              = clock;
    }

    @PostConstruct
    public void start() {
        if (!properties.isEnabled()) {
            log.info("[Scheduler] Disabled. No session runs will be triggered.");
            return;
        }
        Duration initial = initialDelay();
        log.info("[Scheduler] Started. zone={} sessionTime={} firstRunInSeconds={}",
                 properties.getZone(), properties.getSessionTime(), initial.toSeconds());
        scheduleNextCycle(initial);
    }

    Duration initialDelay() {
        return properties.isCatchUpOnStartup()
            ? properties.getStartupDelay()
            : SessionTimingStrategy.delayUntilNextRun(clock.instant(), properties.zoneId(), properties.getSessionTime());
    }

    // ── daily loop ────────────────────────────────────────────────────────────

    private void scheduleNextCycle(Duration delay) {
        Mono.delay(delay)
            .then(runCycle())
            .subscribe(
                next -> {
                    log.info("[Scheduler] Next run scheduled. inSeconds={}", next.toSeconds());
                    scheduleNextCycle(next);
                },
                err -> {
                    log.error("[Scheduler] Cycle failed unexpectedly; retrying after {}", properties.getRetryInterval(), err);
                    scheduleNextCycle(properties.getRetryInterval());
                }
            );
    }

    /** One catch-up call; emits the delay until the following cycle. */
    Mono<Duration> runCycle() {
        return Mono.defer(() -> {
            LocalDate today = clock.instant().atZone(properties.zoneId()).toLocalDate();
            return orchestratorClient.catchUp(today)
                .doOnNext(this::logResult)
                .map(r -> SessionTimingStrategy.delayUntilNextRun(clock.instant(), properties.zoneId(),
                                                                 properties.getSessionTime()))
                .switchIfEmpty(Mono.fromSupplier(() -> SessionTimingStrategy.delayUntilNextRun(
                    clock.instant(), properties.zoneId(), properties.getSessionTime())))
                .onErrorResume(e -> {
                    Instant now = clock.instant();
                    Duration retry = SessionTimingStrategy.retryDelay(now, properties.zoneId(),
                                                                      properties.getSessionTime(),
                                                                      properties.getRetryInterval());
                    if (e instanceof WebClientResponseException w && w.getStatusCode().value() == 409) {
                        log.info("[Scheduler] Orchestrator busy with another run. retryInSeconds={}", retry.toSeconds());
                    } else {
                        log.warn("[Scheduler] Catch-up failed. today={} reason={} retryInSeconds={}",
                                 today, e.getMessage(), retry.toSeconds());
                    }
                    return Mono.just(retry);
                });
        });
    }

    private void logResult(CatchUpResult result) {
        if (result.sessions().isEmpty()) {
            log.info("[Scheduler] Nothing to run. lastRecorded={} today={}", result.lastRecorded(), result.today());
            return;
        }
        for (CatchUpResult.SessionResult s : result.sessions()) {
            log.info("[Scheduler] Session done. date={} sessionId={} status={} accepted={} tradesClosed={}",
                     s.sessionDate(), s.sessionId(), s.status(), s.accepted(), s.tradesClosed());
        }
    }
}
