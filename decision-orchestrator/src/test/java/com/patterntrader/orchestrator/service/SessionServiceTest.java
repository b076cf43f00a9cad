package com.patterntrader.orchestrator.service;

import com.patterntrader.common.classifier.RegimeDetector;
import com.patterntrader.common.feedback.FeedbackSnapshot;
import com.patterntrader.common.model.ConfidenceLevel;
import com.patterntrader.common.model.Direction;
import com.patterntrader.common.model.MarketRegime;
import com.patterntrader.common.model.Observation;
import com.patterntrader.common.model.Prediction;
import com.patterntrader.common.model.RegimeAssessment;
import com.patterntrader.common.model.RetrievalTier;
import com.patterntrader.common.model.TradeSignal;
import com.patterntrader.common.prediction.TieredPredictor;
import com.patterntrader.common.risk.CircuitBreaker;
import com.patterntrader.common.risk.RiskCheckResult;
import com.patterntrader.orchestrator.adapter.FeedbackSnapshotAdapter;
import com.patterntrader.orchestrator.client.TradeServiceClient;
import com.patterntrader.orchestrator.client.dto.MonitorResponse;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    private static final LocalDate DATE = LocalDate.of(2026, 3, 10);
    private static final RegimeAssessment BULL = new RegimeAssessment(DATE, MarketRegime.BULL_LOW_VOL, 1.0,
        "bull", "low_vol", 22_000.0, 21_000.0, 14.0);

    @Mock MarketFeed feed;
    @Mock PredictorProvider predictorProvider;
    @Mock TieredPredictor predictor;
    @Mock DecisionPipelineEngine pipeline;
    @Mock RegimeDetector regimeDetector;
    @Mock FeedbackSnapshotAdapter feedbackAdapter;
    @Mock TradeServiceClient tradeClient;

    private SessionService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T04:00:00Z"), ZoneOffset.UTC);
        service = new SessionService(feed, predictorProvider, pipeline, regimeDetector, feedbackAdapter,
            tradeClient, new DecisionFlowLogger(), new TradingProperties(), clock);
    }

    private static Observation observation(String instrument) {
        return new Observation(instrument + "-1", "hammer", instrument, "pharma", "daily", "uptrend", "normal",
            "near_support", "bull", Instant.parse("2026-03-10T10:00:00Z"), 100.0, 2.0, 1.2, null);
    }

    private static Prediction prediction() {
        return new Prediction("hammer", RetrievalTier.TIER_1, List.of(), 30, 5, Map.of(), Direction.BULLISH,
            10.0, -6.0, 61.0, 1.9, null, 0.58, ConfidenceLevel.HIGH, null);
    }

    private static TradeSignal signal(String instrument, int horizon) {
        return new TradeSignal(instrument, "pharma", "hammer", "uptrend", DATE, horizon, Direction.BULLISH,
            100.0, 97.0, 106.0, 3.0, 6.0, 2.7, 61.0, 61.0, 0.58, 0.58, ConfidenceLevel.HIGH,
            RetrievalTier.TIER_1, 1.2, MarketRegime.BULL_LOW_VOL, "test");
    }

    private static RiskStatusResponse allowed() {
        return new RiskStatusResponse(null, RiskCheckResult.allow());
    }

    private void recordsAnySession() {
        when(tradeClient.recordSession(any(SessionSummaryDTO.class)))
            .thenAnswer(inv -> Mono.just(inv.getArgument(0)));
    }

    // ── pending days ──────────────────────────────────────────────────────────

    @Test
    void freshInstallRunsTodayOnly() {
        assertThat(SessionService.pendingSessions(null, DATE)).containsExactly(DATE);
        assertThat(SessionService.pendingSessions(null, LocalDate.of(2026, 3, 14))).isEmpty();
    }

    @Test
    @DisplayName("missed weekdays after the last session are replayed oldest first; weekends are skipped")
    void missedWeekdaysAreReplayed() {
        LocalDate friday = LocalDate.of(2026, 3, 6);

        assertThat(SessionService.pendingSessions(friday, DATE))
            .containsExactly(LocalDate.of(2026, 3, 9), DATE);
        assertThat(SessionService.pendingSessions(DATE, DATE)).isEmpty();
    }

    @Test
    void todayUsesTradingZone() {
        assertThat(service.today()).isEqualTo(DATE);
    }

    // ── single session ────────────────────────────────────────────────────────

    @Test
    void weekendSessionIsRejected() {
        assertThatThrownBy(() -> service.runSession(LocalDate.of(2026, 3, 7)).block())
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(tradeClient);
    }

    @Test
    @DisplayName("monitor, risk, predict, submit in feed order, then record the session")
    void completedSessionSubmitsSignalsInOrder() {
        Observation sun = observation("SUNPHARMA");
        Observation cipla = observation("CIPLA");
        Prediction prediction = prediction();
        TradeSignal first = signal("SUNPHARMA", 3);
        TradeSignal second = signal("SUNPHARMA", 5);

        when(tradeClient.monitor(anyList())).thenReturn(Mono.just(new MonitorResponse(2, 1, 1, 1)));
        when(tradeClient.riskStatus()).thenReturn(Mono.just(allowed()));
        when(feedbackAdapter.fetchSnapshot(any(Duration.class))).thenReturn(Mono.just(FeedbackSnapshot.empty()));
        when(regimeDetector.detect(anyList(), anyList(), eq(DATE))).thenReturn(BULL);
        when(feed.live(DATE)).thenReturn(List.of(sun, cipla));
        when(predictorProvider.get()).thenReturn(predictor);
        when(predictor.predictBest(sun)).thenReturn(Optional.of(prediction));
        when(predictor.predictBest(cipla)).thenReturn(Optional.empty());
        when(pipeline.evaluate(sun, prediction, FeedbackSnapshot.empty(), BULL, 0.0, DATE)).thenReturn(List.of(
            SignalEvaluation.skipped("SUNPHARMA", "hammer", 1, SignalEvaluation.NEUTRAL_DIRECTION),
            SignalEvaluation.signal(first),
            SignalEvaluation.signal(second)));
        when(tradeClient.submit(first)).thenReturn(Mono.just(
            new SignalDecisionResponse(SignalDecisionResponse.Outcome.ACCEPTED, 11L, RiskCheckResult.allow())));
        when(tradeClient.submit(second)).thenReturn(Mono.just(
            new SignalDecisionResponse(SignalDecisionResponse.Outcome.DUPLICATE, null, null)));
        recordsAnySession();

        SessionReport report = service.runSession(DATE).block();

        assertThat(report.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(report.regime()).isEqualTo(MarketRegime.BULL_LOW_VOL);
        assertThat(report.observations()).isEqualTo(2);
        assertThat(report.predictions()).isEqualTo(1);
        assertThat(report.signals()).isEqualTo(2);
        assertThat(report.accepted()).isEqualTo(1);
        assertThat(report.duplicates()).isEqualTo(1);
        assertThat(report.skipped()).containsEntry(SignalEvaluation.NEUTRAL_DIRECTION, 1L);
        assertThat(report.tradesClosed()).isEqualTo(1);
        assertThat(report.sessionId()).startsWith("session-2026-03-10-");

        InOrder order = inOrder(tradeClient);
        order.verify(tradeClient).monitor(anyList());
        order.verify(tradeClient).riskStatus();
        order.verify(tradeClient).submit(first);
        order.verify(tradeClient).submit(second);
        order.verify(tradeClient).recordSession(new SessionSummaryDTO(DATE, 2, 1, 1));
    }

    @Test
    void trippedBreakerMonitorsButSkipsEntries() {
        when(tradeClient.monitor(anyList())).thenReturn(Mono.just(new MonitorResponse(3, 2, 1, 2)));
        when(tradeClient.riskStatus()).thenReturn(Mono.just(new RiskStatusResponse(null,
            RiskCheckResult.breaker(CircuitBreaker.DAILY_LOSS, 2.5, 2.0))));
        recordsAnySession();

        SessionReport report = service.runSession(DATE).block();

        assertThat(report.status()).isEqualTo(SessionStatus.RISK_BLOCKED);
        assertThat(report.signals()).isZero();
        assertThat(report.tradesClosed()).isEqualTo(2);
        assertThat(report.note()).contains("daily_loss");
        verify(feed, never()).live(any());
        verifyNoInteractions(feedbackAdapter, predictorProvider, pipeline);
        verify(tradeClient).recordSession(new SessionSummaryDTO(DATE, 0, 0, 2));
    }

    @Test
    void extremeRegimeSkipsPrediction() {
        RegimeAssessment extreme = new RegimeAssessment(DATE, MarketRegime.EXTREME, 0.0,
            "bull", "extreme", 22_000.0, 21_000.0, 35.0);
        when(tradeClient.monitor(anyList())).thenReturn(Mono.just(MonitorResponse.none()));
        when(tradeClient.riskStatus()).thenReturn(Mono.just(allowed()));
        when(feedbackAdapter.fetchSnapshot(any(Duration.class))).thenReturn(Mono.just(FeedbackSnapshot.empty()));
        when(regimeDetector.detect(anyList(), anyList(), eq(DATE))).thenReturn(extreme);
        recordsAnySession();

        SessionReport report = service.runSession(DATE).block();

        assertThat(report.status()).isEqualTo(SessionStatus.REGIME_HALTED);
        assertThat(report.regime()).isEqualTo(MarketRegime.EXTREME);
        verifyNoInteractions(predictorProvider, pipeline);
    }

    @Test
    @DisplayName("a failed monitor call fails the session and leaves it unrecorded")
    void monitorFailureIsNotRecorded() {
        when(tradeClient.monitor(anyList())).thenReturn(Mono.error(new IllegalStateException("trade-service down")));

        assertThatThrownBy(() -> service.runSession(DATE).block())
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("trade-service down");
        verify(tradeClient, never()).recordSession(any());
    }

    @Test
    void concurrentRunIsRejected() {
        lenient().when(tradeClient.monitor(anyList())).thenReturn(Mono.never());

        Disposable first = service.runSession(DATE).subscribe();
        try {
            assertThatThrownBy(() -> service.runSession(DATE).block())
                .isInstanceOf(SessionInProgressException.class);
        } finally {
            first.dispose();
        }
    }

    // ── catch-up ──────────────────────────────────────────────────────────────

    @Test
    void catchUpReplaysMissedDaysInOrder() {
        when(tradeClient.lastSession()).thenReturn(Mono.just(
            new SessionSummaryDTO(LocalDate.of(2026, 3, 6), 4, 2, 1)));
        when(tradeClient.monitor(anyList())).thenReturn(Mono.just(MonitorResponse.none()));
        when(tradeClient.riskStatus()).thenReturn(Mono.just(new RiskStatusResponse(null,
            RiskCheckResult.cooldown(30.0, "2026-03-10T06:30:00Z"))));
        recordsAnySession();

        CatchUpReport report = service.catchUp(DATE).block();

        assertThat(report.lastRecorded()).isEqualTo(LocalDate.of(2026, 3, 6));
        assertThat(report.sessions()).extracting(SessionReport::sessionDate)
            .containsExactly(LocalDate.of(2026, 3, 9), DATE);
        ArgumentCaptor<SessionSummaryDTO> recorded = ArgumentCaptor.forClass(SessionSummaryDTO.class);
        verify(tradeClient, times(2)).recordSession(recorded.capture());
        assertThat(recorded.getAllValues()).extracting(SessionSummaryDTO::sessionDate)
            .containsExactly(LocalDate.of(2026, 3, 9), DATE);
    }

    @Test
    void catchUpWithNothingPendingDoesNothing() {
        when(tradeClient.lastSession()).thenReturn(Mono.just(new SessionSummaryDTO(DATE, 0, 0, 0)));

        CatchUpReport report = service.catchUp(DATE).block();

        assertThat(report.sessions()).isEmpty();
        verify(tradeClient, never()).monitor(anyList());
    }

    @Test
    void freshInstallOnWeekendRunsNothing() {
        when(tradeClient.lastSession()).thenReturn(Mono.empty());

        CatchUpReport report = service.catchUp(LocalDate.of(2026, 3, 14)).block();

        assertThat(report.lastRecorded()).isNull();
        assertThat(report.sessions()).isEmpty();
    }
}
