package com.patterntrader.orchestrator.service;

import com.patterntrader.common.classifier.RegimeDetector;
import com.patterntrader.common.feedback.FeedbackSnapshot;
import com.patterntrader.common.model.Observation;
import com.patterntrader.common.model.Prediction;
import com.patterntrader.common.model.RegimeAssessment;
import com.patterntrader.common.model.TradeSignal;
import com.patterntrader.common.prediction.TieredPredictor;
import com.patterntrader.common.risk.RiskCheckResult;
import com.patterntrader.common.trade.TradingCalendar;
import com.patterntrader.orchestrator.adapter.FeedbackSnapshotAdapter;
import com.patterntrader.orchestrator.client.TradeServiceClient;
import com.patterntrader.orchestrator.client.dto.RiskStatusResponse;
import com.patterntrader.orchestrator.client.dto.SessionSummaryDTO;
import com.patterntrader.orchestrator.client.dto.SignalDecisionResponse;
import com.patterntrader.orchestrator.config.TradingProperties;
import com.patterntrader.orchestrator.dto.CatchUpReport;
import com.patterntrader.orchestrator.dto.SessionReport;
import com.patterntrader.orchestrator.dto.SessionStatus;
import com.patterntrader.orchestrator.feed.MarketFeed;
import com.patterntrader.orchestrator.logger.DecisionFlowLogger;
import com.patterntrader.orchestrator.pipeline.DecisionPipelineEngine;
import com.patterntrader.orchestrator.pipeline.PredictorProvider;
import com.patterntrader.orchestrator.pipeline.SignalEvaluation;
import com.patterntrader.orchestrator.trace.SessionTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs trading sessions end to end.
 *
 * <h3>One session</h3>
 * <pre>
 *   monitor open trades on the day's candles
 *     → risk status (blocked: stop here)
 *     → feedback snapshot + regime (halted: stop here)
 *     → predict every live observation in parallel
 *     → filter and size per horizon
 *     → submit signals to trade-service one at a time, in feed order
 *     → record the session date
 * </pre>
 *
 * <p>Monitoring runs first so that trades closed today free their sector and position
 * slots, and so a loss that trips a breaker blocks today's entries.
 *
 * <p>Runs never overlap: a second request while one is writing fails with
 * {@link SessionInProgressException}.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final MarketFeed feed;
    private final PredictorProvider predictorProvider;
    private final DecisionPipelineEngine pipeline;
    private final RegimeDetector regimeDetector;
    private final FeedbackSnapshotAdapter feedbackAdapter;
    private final TradeServiceClient tradeClient;
    private final DecisionFlowLogger flowLogger;
    private final TradingProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public SessionService(MarketFeed feed, PredictorProvider predictorProvider, DecisionPipelineEngine pipeline,
                          RegimeDetector regimeDetector, FeedbackSnapshotAdapter feedbackAdapter,
                          TradeServiceClient tradeClient, DecisionFlowLogger flowLogger,
                          TradingProperties properties, Clock clock) {
        this.feed              = feed;
        this.predictorProvider = predictorProvider;
        this.pipeline          = pipeline;
        this.regimeDetector    = regimeDetector;
        this.feedbackAdapter   = feedbackAdapter;
        this.tradeClient       = tradeClient;
        this.flowLogger        = flowLogger;
        this.properties        = properties;
        this.clock             = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneId.of(properties.getZone())));
    }

    public Mono<SessionReport> runSession(LocalDate date) {
        if (!TradingCalendar.isTradingDay(date)) {
            return Mono.error(new IllegalArgumentException(date + " is not a trading day"));
        }
        return exclusive(() -> session(date));
    }

    /**
     * Replays every trading day after the last recorded session up to and including
     * {@code today}, oldest first. A fresh install runs {@code today} only. A failed day
     * stops the replay; it and the days after it are retried on the next call.
     */
    public Mono<CatchUpReport> catchUp(LocalDate today) {
        return exclusive(() -> tradeClient.lastSession()
            .map(last -> Optional.of(last.sessionDate()))
            .defaultIfEmpty(Optional.empty())
            .flatMap(last -> {
                List<LocalDate> days = pendingSessions(last.orElse(null), today);
                log.info("[CatchUp] lastRecorded={} today={} pending={}", last.orElse(null), today, days);
                return Flux.fromIterable(days)
                    .concatMap(this::session)
                    .collectList()
                    .map(reports -> new CatchUpReport(last.orElse(null), today, reports));
            }));
    }

    static List<LocalDate> pendingSessions(LocalDate lastRecorded, LocalDate today) {
        if (lastRecorded == null) {
            return TradingCalendar.isTradingDay(today) ? List.of(today) : List.of();
        }
        if (!lastRecorded.isBefore(today)) return List.of();
        return TradingCalendar.tradingDaysBetween(lastRecorded, today);
    }

    // ── one session ───────────────────────────────────────────────────────────

    private Mono<SessionReport> session(LocalDate date) {
        String sessionId = SessionTrace.idFor(date);
        Mono<SessionReport> run = Mono.fromCallable(() -> feed.candles(date))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.stage(DecisionFlowLogger.SESSION_STARTED))
            .flatMap(tradeClient::monitor)
            .doOnEach(flowLogger.stage(DecisionFlowLogger.TRADES_MONITORED))
            .flatMap(monitor -> tradeClient.riskStatus()
                .doOnEach(flowLogger.stage(DecisionFlowLogger.RISK_CHECKED))
                .flatMap(risk -> entries(date, sessionId, risk))
                .map(report -> report.withTradesClosed(monitor.closed())))
            .flatMap(report -> tradeClient.recordSession(new SessionSummaryDTO(
                    date, report.signals(), report.accepted(), report.tradesClosed()))
                .doOnEach(flowLogger.stage(DecisionFlowLogger.SESSION_RECORDED))
                .thenReturn(report))
            .doOnNext(report -> log.info(
                "[Session] Completed. date={} status={} regime={} observations={} predictions={} signals={} "
                    + "accepted={} duplicates={} rejected={} cancelled={} closed={} skipped={}",
                date, report.status(), report.regime(), report.observations(), report.predictions(),
                report.signals(), report.accepted(), report.duplicates(), report.rejected(),
                report.cancelled(), report.tradesClosed(), report.skipped()))
            .doOnError(e -> log.error("[Session] Failed. date={} sessionId={}", date, sessionId, e));
        return SessionTrace.withSessionId(run, sessionId);
    }

    private Mono<SessionReport> entries(LocalDate date, String sessionId, RiskStatusResponse risk) {
        RiskCheckResult check = risk.canTrade();
        if (check != null && !check.allowed()) {
            log.warn("[Session] Entries blocked. date={} reason={} value={} threshold={}",
                     date, check.reason(), check.currentValue(), check.threshold());
            return Mono.just(SessionReport.blocked(date, sessionId, check.message()));
        }
        double capital = risk.state() != null ? risk.state().capital() : 0.0;

        Mono<RegimeAssessment> regime = Mono.fromCallable(() ->
                regimeDetector.detect(feed.indexSeries(), feed.volatilitySeries(), date))
            .subscribeOn(Schedulers.boundedElastic());

        return Mono.zip(feedbackAdapter.fetchSnapshot(properties.getFeedbackMaxAge()), regime)
            .doOnEach(flowLogger.stage(DecisionFlowLogger.CONTEXT_LOADED))
            .flatMap(ctx -> {
                FeedbackSnapshot snapshot = ctx.getT1();
                RegimeAssessment assessment = ctx.getT2();
                log.info("[Session] Context. date={} regime={} vix={} feedbackVersion={} capital={}",
                         date, assessment.regime().label(), assessment.volatilityIndex(),
                         snapshot.version(), capital);
                if (assessment.tradingHalted()) {
                    log.warn("[Session] Regime halts entries. date={} regime={}", date, assessment.regime().label());
                    return Mono.just(SessionReport.halted(date, sessionId, assessment.regime(), snapshot.version()));
                }
                return predict(date)
                    .doOnEach(flowLogger.stage(DecisionFlowLogger.PREDICTIONS_COMPLETED))
                    .flatMap(batch -> submit(date, sessionId, batch, snapshot, assessment, capital));
            });
    }

    // ── prediction ────────────────────────────────────────────────────────────

    record Scored(int order, Observation observation, Prediction prediction) {}

    record PredictionBatch(int observations, List<Scored> predictions) {}

    /** Predictions run on the parallel scheduler; results come back in feed order. */
    Mono<PredictionBatch> predict(LocalDate date) {
        return Mono.fromCallable(() -> new LiveFeed(feed.live(date), predictorProvider.get()))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(live -> Flux.range(0, live.observations().size())
                .parallel()
                .runOn(Schedulers.parallel())
                .map(i -> {
                    Observation obs = live.observations().get(i);
                    return new Scored(i, obs, live.predictor().predictBest(obs).orElse(null));
                })
                .filter(s -> s.prediction() != null)
                .sequential()
                .collectSortedList(Comparator.comparingInt(Scored::order))
                .map(scored -> new PredictionBatch(live.observations().size(), scored)));
    }

    private record LiveFeed(List<Observation> observations, TieredPredictor predictor) {}

    // ── submission ────────────────────────────────────────────────────────────

    private Mono<SessionReport> submit(LocalDate date, String sessionId, PredictionBatch batch,
                                       FeedbackSnapshot snapshot, RegimeAssessment regime, double capital) {
        List<TradeSignal> signals = new ArrayList<>();
        Map<String, Long> skipped = new TreeMap<>();
        for (Scored s : batch.predictions()) {
            for (SignalEvaluation e : pipeline.evaluate(s.observation(), s.prediction(), snapshot, regime, capital, date)) {
                if (e.hasSignal()) signals.add(e.signal());
                else skipped.merge(e.skipReason(), 1L, Long::sum);
            }
        }

        return Flux.fromIterable(signals)
            .concatMap(tradeClient::submit)
            .collectList()
            .doOnEach(flowLogger.stage(DecisionFlowLogger.SIGNALS_SUBMITTED))
            .map(decisions -> {
                Map<SignalDecisionResponse.Outcome, Long> byOutcome = decisions.stream()
                    .collect(Collectors.groupingBy(SignalDecisionResponse::outcome, Collectors.counting()));
                return new SessionReport(date, sessionId, SessionStatus.COMPLETED, regime.regime(),
                    snapshot.version(), batch.observations(), batch.predictions().size(), signals.size(),
                    count(byOutcome, SignalDecisionResponse.Outcome.ACCEPTED),
                    count(byOutcome, SignalDecisionResponse.Outcome.DUPLICATE),
                    count(byOutcome, SignalDecisionResponse.Outcome.REJECTED),
                    count(byOutcome, SignalDecisionResponse.Outcome.CANCELLED),
                    skipped, 0, null);
            });
    }

    private static int count(Map<SignalDecisionResponse.Outcome, Long> byOutcome, SignalDecisionResponse.Outcome o) {
        return byOutcome.getOrDefault(o, 0L).intValue();
    }

    // ── single writer ─────────────────────────────────────────────────────────

    private <T> Mono<T> exclusive(Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                log.warn("[Session] Run rejected; another run is in progress");
                return Mono.error(new SessionInProgressException());
            }
            Mono<T> run;
            try {
                run = work.get();
            } catch (RuntimeException e) {
                running.set(false);
                return Mono.error(e);
            }
            return run.doFinally(signal -> running.set(false));
        });
    }
}
