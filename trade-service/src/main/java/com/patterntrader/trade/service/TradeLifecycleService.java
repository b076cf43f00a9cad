package com.patterntrader.trade.service;

import com.patterntrader.common.feedback.OutcomeRecord;
import com.patterntrader.common.model.AlertMessage;
import com.patterntrader.common.model.Direction;
import com.patterntrader.common.model.TradeSignal;
import com.patterntrader.common.risk.CircuitBreaker;
import com.patterntrader.common.risk.CircuitBreakerEvaluator;
import com.patterntrader.common.risk.CloseTransition;
import com.patterntrader.common.risk.OpenPosition;
import com.patterntrader.common.risk.PreEntryGate;
import com.patterntrader.common.risk.RiskCheckResult;
import com.patterntrader.common.trade.Candle;
import com.patterntrader.common.trade.ExitDecision;
import com.patterntrader.common.trade.ExitEvaluator;
import com.patterntrader.common.trade.TradeStatus;
import com.patterntrader.common.trade.TradingCalendar;
import com.patterntrader.trade.client.FeedbackServiceClient;
import com.patterntrader.trade.client.NotificationClient;
import com.patterntrader.trade.config.TradeProperties;
import com.patterntrader.trade.dto.MonitorReport;
import com.patterntrader.trade.dto.SignalDecision;
import com.patterntrader.trade.model.TradeRecord;
import com.patterntrader.trade.repository.TradeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Trade lifecycle: {@code OPEN → CLOSED_SL | CLOSED_TARGET | CLOSED_EXPIRY}, or {@code CANCELLED}
 * when a pre-entry gate fails.
 *
 * <h3>Acceptance</h3>
 * Dedup on (instrument, horizon, signal date), then the circuit-breaker gate, then the pre-entry
 * gates. Runs in one transaction; the partial unique index turns a racing duplicate into a no-op.
 *
 * <h3>Monitoring</h3>
 * Each open trade is checked against its candles after the entry date. A close and the matching
 * risk-state update commit together. Re-running the monitor over the same candles is a no-op
 * for trades that are already terminal.
 *
 * <h3>Outcome emission</h3>
 * After the closes, every closed trade not yet acknowledged by feedback-service is posted; failures
 * are retried on the next monitor run.
 */
@Service
public class TradeLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TradeLifecycleService.class);

    private final TradeRepository tradeRepository;
    private final RiskManager riskManager;
    private final FeedbackServiceClient feedbackClient;
    private final NotificationClient notificationClient;
    private final TransactionalOperator transactionalOperator;
    private final TradeProperties properties;
    private final ZoneId zone;
    private final Clock clock;

    public TradeLifecycleService(TradeRepository tradeRepository,
                                 RiskManager riskManager,
                                 FeedbackServiceClient feedbackClient,
                                 NotificationClient notificationClient,
                                 TransactionalOperator transactionalOperator,
                                 TradeProperties properties,
                                 ZoneId tradingZone,
                                 Clock clock) {
        this.tradeRepository       = tradeRepository;
        this.riskManager           = riskManager;
        this.feedbackClient        = feedbackClient;
        this.notificationClient    = notificationClient;
        this.transactionalOperator = transactionalOperator;
        this.properties            = properties.validated();
        this.zone                  = tradingZone;
        this.clock                 = clock;
    }

    // ── acceptance ────────────────────────────────────────────────────────────

    public Mono<SignalDecision> accept(TradeSignal signal) {
        if (signal.direction() == null || signal.direction() == Direction.NEUTRAL || signal.positionPct() <= 0
                || signal.signalDate() == null || signal.instrument() == null || signal.horizonDays() <= 0) {
            return Mono.error(new IllegalArgumentException(
                "signal is not tradable: instrument=" + signal.instrument() + " direction=" + signal.direction()
                    + " positionPct=" + signal.positionPct()));
        }

        Mono<SignalDecision> work = tradeRepository
            .existsActiveKey(signal.instrument(), signal.horizonDays(), signal.signalDate())
            .flatMap(exists -> {
                if (exists) {
                    log.info("[Trade] Duplicate signal ignored. instrument={} horizon={} signalDate={}",
                        signal.instrument(), signal.horizonDays(), signal.signalDate());
                    return Mono.just(SignalDecision.duplicate());
                }
                return riskManager.canTrade(entryCheckTime(signal)).flatMap(check -> check.allowed()
                    ? gateAndOpen(signal)
                    : Mono.just(SignalDecision.rejected(check)));
            });

        return transactionalOperator.transactional(work)
            .onErrorResume(DataIntegrityViolationException.class, e -> {
                log.info("[Trade] Concurrent duplicate ignored. instrument={} horizon={} signalDate={}",
                    signal.instrument(), signal.horizonDays(), signal.signalDate());
                return Mono.just(SignalDecision.duplicate());
            });
    }

    /** Session close of the signal date, or now when that is still ahead. */
    Instant entryCheckTime(TradeSignal signal) {
        Instant sessionClose = signal.signalDate().atTime(properties.getSessionClose()).atZone(zone).toInstant();
        Instant now = clock.instant();
        return sessionClose.isBefore(now) ? sessionClose : now;
    }

    private Mono<SignalDecision> gateAndOpen(TradeSignal signal) {
        Mono<List<OpenPosition>> open = tradeRepository.findOpen()
            .map(t -> new OpenPosition(t.getInstrument(), t.getSector(), t.getHorizonDays()))
            .collectList();

        return open.flatMap(positions -> riskManager.currentState().map(state -> newTrade(signal, state.capital()))
            .flatMap(trade -> {
                RiskCheckResult gate = PreEntryGate.check(positions, signal.sector(), signal.horizonDays(),
                                                          riskManager.limits());
                if (!gate.allowed()) {
                    trade.setStatus(TradeStatus.CANCELLED.name());
                    trade.setCancelReason(gate.reason());
                    return tradeRepository.save(trade)
                        .doOnNext(t -> log.info("[Trade] Cancelled before fill. id={} instrument={} reason={} value={} limit={}",
                            t.getId(), t.getInstrument(), gate.reason(),
                            String.format("%.2f", gate.currentValue()), String.format("%.2f", gate.threshold())))
                        .map(t -> SignalDecision.cancelled(t.getId(), gate));
                }
                return tradeRepository.save(trade)
                    .doOnNext(t -> log.info("[Trade] Opened. id={} instrument={} pattern={} {} horizon={} entry={} sl={} target={} size={}%",
                        t.getId(), t.getInstrument(), t.getPattern(), t.getDirection(), t.getHorizonDays(),
                        t.getEntryPrice(), t.getStopLoss(), t.getTarget(), t.getPositionPct()))
                    .map(t -> SignalDecision.accepted(t.getId()));
            }));
    }

    private TradeRecord newTrade(TradeSignal s, double capital) {
        TradeRecord t = new TradeRecord();
        t.setInstrument(s.instrument());
        t.setHorizonDays(s.horizonDays());
        t.setSignalDate(s.signalDate());
        t.setSector(s.sector());
        t.setPattern(s.pattern());
        t.setTrend(s.trend());
        t.setDirection(s.direction().label());
        t.setTier(s.tier() == null ? null : s.tier().name());
        t.setRegime(s.regime() == null ? null : s.regime().label());
        t.setWinRate(s.winRate());
        t.setConfidence(s.confidence());
        t.setConfidenceLevel(s.level() == null ? null : s.level().name());
        t.setVolumeRatio(s.volumeRatio());
        t.setEntryDate(s.signalDate());
        t.setEntryPrice(s.entryPrice());
        t.setStopLoss(s.stopLoss());
        t.setTarget(s.target());
        t.setStopLossPct(s.stopLossPct());
        t.setTargetPct(s.targetPct());
        t.setPositionPct(s.positionPct());
        t.setPositionValue(round2(capital * s.positionPct() / 100.0));
        t.setExpiryDate(TradingCalendar.addTradingDays(s.signalDate(), s.horizonDays()));
        t.setCreatedAt(clock.instant());
        t.setStatus(TradeStatus.OPEN.name());
        return t;
    }

    // ── monitoring ────────────────────────────────────────────────────────────

    public Mono<MonitorReport> monitor(List<Candle> candles) {
        Map<String, List<Candle>> byInstrument = candles.stream()
            .filter(c -> c.instrument() != null && c.date() != null)
            .collect(Collectors.groupingBy(Candle::instrument));
        byInstrument.values().forEach(list -> list.sort(Comparator.comparing(Candle::date)));

        return tradeRepository.findOpen().collectList()
            .flatMap(open -> Flux.fromIterable(open)
                .concatMap(t -> evaluate(t, byInstrument.getOrDefault(t.getInstrument(), List.of())))
                .filter(Boolean::booleanValue)
                .count()
                .flatMap(closed -> publishPending()
                    .map(published -> new MonitorReport(open.size(), closed.intValue(),
                                                        open.size() - closed.intValue(), published))))
            .doOnNext(r -> log.info("[Monitor] Done. checked={} closed={} open={} published={}",
                r.checked(), r.closed(), r.stillOpen(), r.outcomesPublished()));
    }

    /** @return true when this call closed the trade */
    private Mono<Boolean> evaluate(TradeRecord trade, List<Candle> candles) {
        Direction direction = Direction.fromLabel(trade.getDirection());
        double mfe = trade.getMfePct();
        double mae = trade.getMaePct();
        for (Candle candle : candles) {
            if (!candle.date().isAfter(trade.getEntryDate())) continue;
            ExitDecision decision = ExitEvaluator.evaluate(direction, trade.getEntryPrice(), trade.getStopLoss(),
                trade.getTarget(), trade.getExpiryDate(), candle, mfe, mae);
            mfe = decision.mfePct();
            mae = decision.maePct();
            if (decision.closes()) {
                return close(trade.getId(), decision, candle.date());
            }
        }
        if (mfe != trade.getMfePct() || mae != trade.getMaePct()) {
            trade.setMfePct(mfe);
            trade.setMaePct(mae);
            return tradeRepository.save(trade).thenReturn(false);
        }
        return Mono.just(false);
    }

    private record Closed(TradeRecord trade, CloseTransition transition) {}

    private Mono<Boolean> close(Long tradeId, ExitDecision decision, LocalDate exitDate) {
        Instant closedAt = exitDate.atTime(properties.getSessionClose()).atZone(zone).toInstant();

        Mono<Closed> work = tradeRepository.findById(tradeId)
            .filter(t -> TradeStatus.valueOf(t.getStatus()).canTransitionTo(decision.status()))
            .flatMap(t -> {
                Direction direction = Direction.fromLabel(t.getDirection());
                double returnPct = round4(ExitEvaluator.returnPct(direction, t.getEntryPrice(), decision.exitPrice())
                                          - properties.getRoundTripCostPct());
                double pnl = round2(t.getPositionValue() * returnPct / 100.0);

                t.setStatus(decision.status().name());
                t.setExitDate(exitDate);
                t.setExitPrice(decision.exitPrice());
                t.setClosedAt(closedAt);
                t.setReturnPct(returnPct);
                t.setPnl(pnl);
                t.setMfePct(decision.mfePct());
                t.setMaePct(decision.maePct());
                t.setStopLossTriggered(decision.status() == TradeStatus.CLOSED_SL
                                       || decision.maePct() <= -t.getStopLossPct());
                return tradeRepository.save(t)
                    .flatMap(saved -> riskManager.applyClose(pnl, closedAt)
                        .map(transition -> new Closed(saved, transition)));
            });

        return transactionalOperator.transactional(work)
            .doOnError(e -> log.error("[Monitor] Close rolled back. tradeId={}", tradeId, e))
            .flatMap(c -> {
                TradeRecord t = c.trade();
                log.info("[Monitor] Closed. id={} instrument={} status={} exit={} return={}% pnl={}",
                    t.getId(), t.getInstrument(), t.getStatus(), t.getExitPrice(), t.getReturnPct(), t.getPnl());
                return alertsFor(c).thenReturn(true);
            })
            .defaultIfEmpty(false);
    }

    private Mono<Void> alertsFor(Closed closed) {
        TradeRecord t = closed.trade();
        AlertMessage tradeAlert = new AlertMessage(AlertMessage.TRADE_CLOSED, "INFO",
            t.getInstrument() + " " + t.getStatus(),
            Map.of("pattern", String.valueOf(t.getPattern()),
                   "horizon", String.valueOf(t.getHorizonDays()),
                   "return", String.format("%.2f%%", t.getReturnPct()),
                   "pnl", String.format("%.2f", t.getPnl())));

        List<AlertMessage> breakerAlerts = closed.transition().newlyTripped().stream()
            .map(b -> breakerAlert(b, closed.transition()))
            .toList();

        return Flux.concat(Flux.just(tradeAlert), Flux.fromIterable(breakerAlerts))
            .concatMap(notificationClient::send)
            .then();
    }

    private AlertMessage breakerAlert(CircuitBreaker breaker, CloseTransition transition) {
        return new AlertMessage(AlertMessage.BREAKER_TRIPPED, "CRITICAL", "Circuit breaker " + breaker.reason(),
            Map.of("value", String.format("%.2f", CircuitBreakerEvaluator.currentValue(transition.state(), breaker)),
                   "threshold", String.format("%.2f", CircuitBreakerEvaluator.threshold(riskManager.limits(), breaker)),
                   "cooldownUntil", String.valueOf(transition.state().cooldownUntil())));
    }

    // ── outcome emission ──────────────────────────────────────────────────────

    /** Posts every unacknowledged closed trade. @return number acknowledged in this call */
    public Mono<Integer> publishPending() {
        return tradeRepository.findUnpublished()
            .concatMap(t -> feedbackClient.publish(toOutcome(t))
                .flatMap(ok -> ok
                    ? tradeRepository.markPublished(t.getId()).thenReturn(1)
                    : Mono.just(0)))
            .reduce(0, Integer::sum);
    }

    static String outcomeId(TradeRecord t) {
        return t.getInstrument() + ":" + t.getSignalDate() + ":" + t.getHorizonDays();
    }

    static OutcomeRecord toOutcome(TradeRecord t) {
        double returnPct = t.getReturnPct() == null ? 0.0 : t.getReturnPct();
        return new OutcomeRecord(outcomeId(t), t.getInstrument(), t.getPattern(), t.getTrend(), t.getSector(),
            t.getHorizonDays(), Direction.fromLabel(t.getDirection()), returnPct, returnPct > 0,
            Boolean.TRUE.equals(t.getStopLossTriggered()), t.getStatus(), t.getVolumeRatio(),
            t.getEntryDate(), t.getClosedAt(), t.getMfePct(), t.getMaePct());
    }

    public Flux<TradeRecord> openTrades() {
        return tradeRepository.findOpen();
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static double round4(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
