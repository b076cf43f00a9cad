package com.patterntrader.trade.service;

import com.patterntrader.common.feedback.OutcomeRecord;
import com.patterntrader.common.model.AlertMessage;
import com.patterntrader.common.model.ConfidenceLevel;
import com.patterntrader.common.model.Direction;
import com.patterntrader.common.model.MarketRegime;
import com.patterntrader.common.model.RetrievalTier;
import com.patterntrader.common.model.TradeSignal;
import com.patterntrader.common.risk.CircuitBreaker;
import com.patterntrader.common.risk.CircuitBreakerEvaluator;
import com.patterntrader.common.risk.CloseTransition;
import com.patterntrader.common.risk.RiskCheckResult;
import com.patterntrader.common.risk.RiskLimits;
import com.patterntrader.common.risk.RiskState;
import com.patterntrader.common.trade.Candle;
import com.patterntrader.common.trade.TradeStatus;
import com.patterntrader.common.trade.TradingCalendar;
import com.patterntrader.trade.client.FeedbackServiceClient;
import com.patterntrader.trade.client.NotificationClient;
import com.patterntrader.trade.config.TradeProperties;
import com.patterntrader.trade.dto.MonitorReport;
import com.patterntrader.trade.dto.SignalDecision;
import com.patterntrader.trade.model.TradeRecord;
import com.patterntrader.trade.repository.TradeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TradeLifecycleServiceTest {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    private static final Instant NOW = Instant.parse("2026-03-10T06:00:00Z");
    private static final LocalDate SIGNAL_DATE = LocalDate.of(2026, 3, 2);
    // 15:30 IST on the signal date
    private static final Instant SIGNAL_SESSION_CLOSE = Instant.parse("2026-03-02T10:00:00Z");

    @Mock TradeRepository tradeRepository;
    @Mock RiskManager riskManager;
    @Mock FeedbackServiceClient feedbackClient;
    @Mock NotificationClient notificationClient;
    @Mock TransactionalOperator transactionalOperator;

    private TradeLifecycleService service;

    @BeforeEach
    void setUp() {
        service = new TradeLifecycleService(tradeRepository, riskManager, feedbackClient, notificationClient,
            transactionalOperator, new TradeProperties(), IST, Clock.fixed(NOW, IST));
    }

    @SuppressWarnings("unchecked")
    private void passThroughTransactions() {
        when(transactionalOperator.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static TradeSignal signal(String instrument, String sector, Direction direction) {
        return new TradeSignal(instrument, sector, "hammer", "uptrend", SIGNAL_DATE, 5, direction,
            100.0, 97.0, 106.0, 3.0, 6.0, 3.0, 62.0, 60.0, 0.58, 0.55, ConfidenceLevel.HIGH,
            RetrievalTier.TIER_1, 1.4, MarketRegime.BULL_LOW_VOL, "test");
    }

    private static TradeRecord openTrade(long id, String instrument, String sector) {
        TradeRecord t = new TradeRecord();
        t.setId(id);
        t.setVersion(0L);
        t.setInstrument(instrument);
        t.setSector(sector);
        t.setPattern("hammer");
        t.setTrend("uptrend");
        t.setHorizonDays(5);
        t.setSignalDate(SIGNAL_DATE);
        t.setDirection("bullish");
        t.setEntryDate(SIGNAL_DATE);
        t.setEntryPrice(100.0);
        t.setStopLoss(97.0);
        t.setTarget(106.0);
        t.setStopLossPct(3.0);
        t.setTargetPct(6.0);
        t.setPositionPct(3.0);
        t.setPositionValue(30_000.0);
        t.setExpiryDate(TradingCalendar.addTradingDays(SIGNAL_DATE, 5));
        t.setStatus(TradeStatus.OPEN.name());
        return t;
    }

    private static Candle candle(String instrument, LocalDate date, double high, double low, double close) {
        return new Candle(instrument, date, 100.0, high, low, close);
    }

    private static RiskState account() {
        return CircuitBreakerEvaluator.initial(1_000_000, NOW, IST);
    }

    // ── acceptance ────────────────────────────────────────────────────────────

    @Test
    void neutralSignalIsRejectedAsInvalid() {
        assertThatThrownBy(() -> service.accept(signal("INFY", "it", Direction.NEUTRAL)).block())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("same instrument, horizon and signal date never opens a second trade")
    void duplicateKeyIsNoOp() {
        passThroughTransactions();
        when(tradeRepository.existsActiveKey("INFY", 5, SIGNAL_DATE)).thenReturn(Mono.just(true));

        SignalDecision decision = service.accept(signal("INFY", "it", Direction.BULLISH)).block();

        assertThat(decision.outcome()).isEqualTo(SignalDecision.Outcome.DUPLICATE);
        verify(riskManager, never()).canTrade(any(Instant.class));
        verify(tradeRepository, never()).save(any());
    }

    @Test
    void trippedBreakerRejectsWithoutStoringAnything() {
        passThroughTransactions();
        when(tradeRepository.existsActiveKey("INFY", 5, SIGNAL_DATE)).thenReturn(Mono.just(false));
        when(riskManager.canTrade(SIGNAL_SESSION_CLOSE))
            .thenReturn(Mono.just(RiskCheckResult.breaker(CircuitBreaker.DAILY_LOSS, 4.5, 3.0)));

        SignalDecision decision = service.accept(signal("INFY", "it", Direction.BULLISH)).block();

        assertThat(decision.outcome()).isEqualTo(SignalDecision.Outcome.REJECTED);
        assertThat(decision.check().reason()).isEqualTo("daily_loss");
        assertThat(decision.check().currentValue()).isEqualTo(4.5);
        verify(tradeRepository, never()).save(any());
    }

    @Test
    @DisplayName("entry check runs at the signal's session close, or now when that is still ahead")
    void entryCheckTime() {
        assertThat(service.entryCheckTime(signal("INFY", "it", Direction.BULLISH))).isEqualTo(SIGNAL_SESSION_CLOSE);

        TradeSignal today = new TradeSignal("INFY", "it", "hammer", "uptrend", LocalDate.of(2026, 3, 10), 5,
            Direction.BULLISH, 100.0, 97.0, 106.0, 3.0, 6.0, 3.0, 62.0, 60.0, 0.58, 0.55, ConfidenceLevel.HIGH,
            RetrievalTier.TIER_1, 1.4, MarketRegime.BULL_LOW_VOL, "test");
        assertThat(service.entryCheckTime(today)).isEqualTo(NOW);
    }

    @Test
    void sectorConcentrationCancelsTheTrade() {
        passThroughTransactions();
        when(tradeRepository.existsActiveKey("TCS", 5, SIGNAL_DATE)).thenReturn(Mono.just(false));
        when(riskManager.canTrade(SIGNAL_SESSION_CLOSE)).thenReturn(Mono.just(RiskCheckResult.allow()));
        when(riskManager.currentState()).thenReturn(Mono.just(account()));
        when(riskManager.limits()).thenReturn(RiskLimits.defaults());
        when(tradeRepository.findOpen())
            .thenReturn(Flux.just(openTrade(1, "INFY", "it"), openTrade(2, "WIPRO", "IT")));
        when(tradeRepository.save(any(TradeRecord.class))).thenAnswer(inv -> {
            TradeRecord t = inv.getArgument(0);
            t.setId(9L);
            return Mono.just(t);
        });

        SignalDecision decision = service.accept(signal("TCS", "it", Direction.BULLISH)).block();

        assertThat(decision.outcome()).isEqualTo(SignalDecision.Outcome.CANCELLED);
        assertThat(decision.tradeId()).isEqualTo(9L);
        assertThat(decision.check().reason()).isEqualTo(RiskCheckResult.SECTOR_CONCENTRATION);
        assertThat(decision.check().currentValue()).isEqualTo(3.0);

        ArgumentCaptor<TradeRecord> saved = ArgumentCaptor.forClass(TradeRecord.class);
        verify(tradeRepository).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo("CANCELLED");
        assertThat(saved.getValue().getCancelReason()).isEqualTo(RiskCheckResult.SECTOR_CONCENTRATION);
    }

    @Test
    void acceptedSignalOpensSizedTrade() {
        passThroughTransactions();
        when(tradeRepository.existsActiveKey("INFY", 5, SIGNAL_DATE)).thenReturn(Mono.just(false));
        when(riskManager.canTrade(SIGNAL_SESSION_CLOSE)).thenReturn(Mono.just(RiskCheckResult.allow()));
        when(riskManager.currentState()).thenReturn(Mono.just(account()));
        when(riskManager.limits()).thenReturn(RiskLimits.defaults());
        when(tradeRepository.findOpen()).thenReturn(Flux.empty());
        when(tradeRepository.save(any(TradeRecord.class))).thenAnswer(inv -> {
            TradeRecord t = inv.getArgument(0);
            t.setId(11L);
            return Mono.just(t);
        });

        SignalDecision decision = service.accept(signal("INFY", "it", Direction.BULLISH)).block();

        assertThat(decision.outcome()).isEqualTo(SignalDecision.Outcome.ACCEPTED);
        assertThat(decision.tradeId()).isEqualTo(11L);

        ArgumentCaptor<TradeRecord> saved = ArgumentCaptor.forClass(TradeRecord.class);
        verify(tradeRepository).save(saved.capture());
        TradeRecord t = saved.getValue();
        assertThat(t.getStatus()).isEqualTo("OPEN");
        assertThat(t.getDirection()).isEqualTo("bullish");
        assertThat(t.getPositionValue()).isEqualTo(30_000.0);
        assertThat(t.getExpiryDate()).isEqualTo(LocalDate.of(2026, 3, 9));
        assertThat(t.getRegime()).isEqualTo("bull_low_vol");
    }

    @Test
    void racingInsertOnTheUniqueKeyCountsAsDuplicate() {
        passThroughTransactions();
        when(tradeRepository.existsActiveKey("INFY", 5, SIGNAL_DATE)).thenReturn(Mono.just(false));
        when(riskManager.canTrade(SIGNAL_SESSION_CLOSE)).thenReturn(Mono.just(RiskCheckResult.allow()));
        when(riskManager.currentState()).thenReturn(Mono.just(account()));
        when(riskManager.limits()).thenReturn(RiskLimits.defaults());
        when(tradeRepository.findOpen()).thenReturn(Flux.empty());
        when(tradeRepository.save(any(TradeRecord.class)))
            .thenReturn(Mono.error(new DataIntegrityViolationException("ux_trades_dedup")));

        SignalDecision decision = service.accept(signal("INFY", "it", Direction.BULLISH)).block();

        assertThat(decision.outcome()).isEqualTo(SignalDecision.Outcome.DUPLICATE);
    }

    // ── monitoring ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("target hit closes the trade, updates risk state and alerts once")
    void targetHitClosesTrade() {
        passThroughTransactions();
        TradeRecord trade = openTrade(1, "INFY", "it");
        when(tradeRepository.findOpen()).thenReturn(Flux.just(trade));
        when(tradeRepository.findById(1L)).thenReturn(Mono.just(trade));
        when(tradeRepository.save(any(TradeRecord.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(riskManager.applyClose(anyDouble(), any(Instant.class)))
            .thenReturn(Mono.just(new CloseTransition(account(), List.of(), List.of())));
        when(notificationClient.send(any(AlertMessage.class))).thenReturn(Mono.empty());
        when(tradeRepository.findUnpublished()).thenReturn(Flux.empty());

        MonitorReport report = service.monitor(List.of(
            candle("INFY", SIGNAL_DATE, 110.0, 90.0, 100.0),
            candle("INFY", LocalDate.of(2026, 3, 3), 107.0, 99.5, 106.5),
            candle("TCS", LocalDate.of(2026, 3, 3), 120.0, 80.0, 100.0))).block();

        assertThat(report.checked()).isEqualTo(1);
        assertThat(report.closed()).isEqualTo(1);
        assertThat(report.stillOpen()).isZero();

        assertThat(trade.getStatus()).isEqualTo("CLOSED_TARGET");
        assertThat(trade.getExitPrice()).isEqualTo(106.0);
        assertThat(trade.getExitDate()).isEqualTo(LocalDate.of(2026, 3, 3));
        assertThat(trade.getReturnPct()).isCloseTo(5.95, within(1e-9));
        assertThat(trade.getPnl()).isCloseTo(1785.0, within(1e-9));
        assertThat(trade.getStopLossTriggered()).isFalse();
        assertThat(trade.getClosedAt()).isEqualTo(Instant.parse("2026-03-03T10:00:00Z"));

        ArgumentCaptor<Double> pnl = ArgumentCaptor.forClass(Double.class);
        verify(riskManager).applyClose(pnl.capture(), eq(Instant.parse("2026-03-03T10:00:00Z")));
        assertThat(pnl.getValue()).isCloseTo(1785.0, within(1e-9));
        verify(notificationClient, times(1)).send(any(AlertMessage.class));
    }

    @Test
    void stopBeatsTargetOnTheSameBar() {
        passThroughTransactions();
        TradeRecord trade = openTrade(1, "INFY", "it");
        when(tradeRepository.findOpen()).thenReturn(Flux.just(trade));
        when(tradeRepository.findById(1L)).thenReturn(Mono.just(trade));
        when(tradeRepository.save(any(TradeRecord.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(riskManager.applyClose(anyDouble(), any(Instant.class)))
            .thenReturn(Mono.just(new CloseTransition(account(), List.of(), List.of())));
        when(notificationClient.send(any(AlertMessage.class))).thenReturn(Mono.empty());
        when(tradeRepository.findUnpublished()).thenReturn(Flux.empty());

        service.monitor(List.of(candle("INFY", LocalDate.of(2026, 3, 3), 108.0, 96.0, 100.0))).block();

        assertThat(trade.getStatus()).isEqualTo("CLOSED_SL");
        assertThat(trade.getReturnPct()).isCloseTo(-3.05, within(1e-9));
        assertThat(trade.getStopLossTriggered()).isTrue();
    }

    @Test
    void newlyTrippedBreakerSendsCriticalAlert() {
        passThroughTransactions();
        TradeRecord trade = openTrade(1, "INFY", "it");
        RiskState after = account();
        when(tradeRepository.findOpen()).thenReturn(Flux.just(trade));
        when(tradeRepository.findById(1L)).thenReturn(Mono.just(trade));
        when(tradeRepository.save(any(TradeRecord.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(riskManager.applyClose(anyDouble(), any(Instant.class))).thenReturn(Mono.just(
            new CloseTransition(after, List.of(), List.of(CircuitBreaker.CONSECUTIVE_LOSSES))));
        when(riskManager.limits()).thenReturn(RiskLimits.defaults());
        when(notificationClient.send(any(AlertMessage.class))).thenReturn(Mono.empty());
        when(tradeRepository.findUnpublished()).thenReturn(Flux.empty());

        service.monitor(List.of(candle("INFY", LocalDate.of(2026, 3, 3), 101.0, 96.0, 97.0))).block();

        ArgumentCaptor<AlertMessage> alerts = ArgumentCaptor.forClass(AlertMessage.class);
        verify(notificationClient, times(2)).send(alerts.capture());
        assertThat(alerts.getAllValues()).extracting(AlertMessage::kind)
            .containsExactly(AlertMessage.TRADE_CLOSED, AlertMessage.BREAKER_TRIPPED);
        assertThat(alerts.getAllValues().get(1).severity()).isEqualTo("CRITICAL");
    }

    @Test
    @DisplayName("a trade already closed by an earlier run is not closed again")
    void closingIsIdempotent() {
        passThroughTransactions();
        TradeRecord stale = openTrade(1, "INFY", "it");
        TradeRecord current = openTrade(1, "INFY", "it");
        current.setStatus(TradeStatus.CLOSED_TARGET.name());
        when(tradeRepository.findOpen()).thenReturn(Flux.just(stale));
        when(tradeRepository.findById(1L)).thenReturn(Mono.just(current));
        when(tradeRepository.findUnpublished()).thenReturn(Flux.empty());

        MonitorReport report = service.monitor(List.of(
            candle("INFY", LocalDate.of(2026, 3, 3), 107.0, 99.5, 106.5))).block();

        assertThat(report.closed()).isZero();
        verify(riskManager, never()).applyClose(anyDouble(), any());
        verify(tradeRepository, never()).save(any());
    }

    @Test
    void quietBarOnlyTracksExcursions() {
        TradeRecord trade = openTrade(1, "INFY", "it");
        when(tradeRepository.findOpen()).thenReturn(Flux.just(trade));
        when(tradeRepository.save(any(TradeRecord.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(tradeRepository.findUnpublished()).thenReturn(Flux.empty());

        MonitorReport report = service.monitor(List.of(
            candle("INFY", LocalDate.of(2026, 3, 3), 102.0, 99.0, 101.0))).block();

        assertThat(report.closed()).isZero();
        assertThat(report.stillOpen()).isEqualTo(1);
        assertThat(trade.getStatus()).isEqualTo("OPEN");
        assertThat(trade.getMfePct()).isCloseTo(2.0, within(1e-9));
        assertThat(trade.getMaePct()).isCloseTo(-1.0, within(1e-9));
        verify(riskManager, never()).applyClose(anyDouble(), any());
    }

    // ── outcome emission ──────────────────────────────────────────────────────

    @Test
    void failedPublishStaysPendingForTheNextRun() {
        TradeRecord first = openTrade(1, "INFY", "it");
        first.setStatus("CLOSED_TARGET");
        first.setReturnPct(5.95);
        TradeRecord second = openTrade(2, "TCS", "it");
        second.setStatus("CLOSED_SL");
        second.setReturnPct(-3.05);
        when(tradeRepository.findUnpublished()).thenReturn(Flux.just(first, second));
        when(feedbackClient.publish(any(OutcomeRecord.class))).thenReturn(Mono.just(true), Mono.just(false));
        when(tradeRepository.markPublished(1L)).thenReturn(Mono.just(1));

        Integer published = service.publishPending().block();

        assertThat(published).isEqualTo(1);
        verify(tradeRepository, never()).markPublished(2L);
    }

    @Test
    void outcomeCarriesTradeKeyAndWinFlag() {
        TradeRecord t = openTrade(1, "INFY", "it");
        t.setStatus("CLOSED_SL");
        t.setReturnPct(-3.05);
        t.setStopLossTriggered(true);

        OutcomeRecord outcome = TradeLifecycleService.toOutcome(t);

        assertThat(outcome.tradeId()).isEqualTo("INFY:2026-03-02:5");
        assertThat(outcome.win()).isFalse();
        assertThat(outcome.stopLossTriggered()).isTrue();
        assertThat(outcome.direction()).isEqualTo(Direction.BULLISH);
        assertThat(outcome.missingFields()).isEmpty();
    }
}
