package com.patterntrader.trade.service;

import com.patterntrader.common.exception.RiskStatePersistenceException;
import com.patterntrader.common.risk.CircuitBreakerEvaluator;
import com.patterntrader.common.risk.CloseTransition;
import com.patterntrader.common.risk.RiskCheckResult;
import com.patterntrader.common.risk.RiskLimits;
import com.patterntrader.common.risk.RiskState;
import com.patterntrader.trade.config.RiskProperties;
import com.patterntrader.trade.model.RiskStateRecord;
import com.patterntrader.trade.repository.RiskStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Persistent account-risk state and the circuit-breaker gate.
 *
 * <p>The state lives in one {@code risk_state} row. Every mutation is read-modify-write on that
 * row under its optimistic version, and is meant to run inside the caller's transaction (the
 * trade close that produced it), so capital, counters and breaker flags move together or not
 * at all.
 *
 * <p>Read or write failures surface as {@link RiskStatePersistenceException}. There is no
 * fallback to a default state: an unreadable risk state blocks trading.
 */
@Service
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private final RiskStateRepository repository;
    private final RiskLimits limits;
    private final RiskProperties properties;
    private final ZoneId zone;
    private final Clock clock;

    public RiskManager(RiskStateRepository repository, RiskLimits limits, RiskProperties properties,
                       ZoneId tradingZone, Clock clock) {
        this.repository = repository;
        this.limits     = limits;
        this.properties = properties;
        this.zone       = tradingZone;
        this.clock      = clock;
    }

    public RiskLimits limits() {
        return limits;
    }

    /** Current state with date/month/cooldown rollovers applied for display. */
    public Mono<RiskState> currentState() {
        Instant now = clock.instant();
        return loadOrCreate(now)
            .map(r -> CircuitBreakerEvaluator.refresh(r.toState(), now, zone));
    }

    public Mono<RiskCheckResult> canTrade() {
        return canTrade(clock.instant());
    }

    /**
     * Entry gate as of {@code at}. A replayed session is checked at its own session time, so
     * breakers and cooldowns started by that day's closes still apply to that day's entries.
     */
    public Mono<RiskCheckResult> canTrade(Instant at) {
        return loadOrCreate(at)
            .map(r -> CircuitBreakerEvaluator.canTrade(r.toState(), at, zone, limits))
            .doOnNext(result -> {
                if (!result.allowed()) {
                    log.info("[RiskManager] Entry blocked. reason={} value={} threshold={}",
                        result.reason(), String.format("%.2f", result.currentValue()),
                        String.format("%.2f", result.threshold()));
                }
            });
    }

    /**
     * Applies one realized pnl. Must be subscribed inside the transaction that closes the trade.
     */
    public Mono<CloseTransition> applyClose(double pnl, Instant closedAt) {
        return loadOrCreate(closedAt)
            .flatMap(record -> {
                CloseTransition transition =
                    CircuitBreakerEvaluator.recordClose(record.toState(), pnl, closedAt, zone, limits);
                return save(record.apply(transition.state(), clock.instant()))
                    .thenReturn(transition);
            })
            .doOnNext(t -> {
                RiskState s = t.state();
                log.info("[RiskManager] Close applied. pnl={} capital={} peak={} dailyPnl={} streak={} breakers={}",
                    String.format("%.2f", pnl), String.format("%.2f", s.capital()),
                    String.format("%.2f", s.peakCapital()), String.format("%.2f", s.dailyPnl()),
                    s.consecutiveLosses(), s.breakers());
                t.newlyTripped().forEach(b -> log.warn("[RiskManager] Breaker tripped. breaker={} value={} threshold={} cooldownUntil={}",
                    b.reason(), String.format("%.2f", CircuitBreakerEvaluator.currentValue(s, b)),
                    String.format("%.2f", CircuitBreakerEvaluator.threshold(limits, b)), s.cooldownUntil()));
            });
    }

    /** Operator reset. Refuses to run without explicit confirmation. */
    public Mono<RiskState> manualReset(boolean confirm) {
        if (!confirm) {
            return Mono.error(new IllegalArgumentException("manual breaker reset requires confirm=true"));
        }
        Instant now = clock.instant();
        return loadOrCreate(now)
            .flatMap(record -> {
                RiskState before = CircuitBreakerEvaluator.refresh(record.toState(), now, zone);
                RiskState after  = CircuitBreakerEvaluator.manualReset(before);
                log.warn("[RiskManager] Manual reset. clearedBreakers={} cooldownUntil={} streak={}",
                    before.breakers(), before.cooldownUntil(), before.consecutiveLosses());
                return save(record.apply(after, now)).thenReturn(after);
            });
    }

    // ── persistence ───────────────────────────────────────────────────────────

    private Mono<RiskStateRecord> loadOrCreate(Instant now) {
        return repository.findById(RiskStateRecord.SINGLETON_ID)
            .onErrorMap(e -> new RiskStatePersistenceException("failed to load risk state", e))
            .switchIfEmpty(Mono.defer(() -> {
                RiskState initial = CircuitBreakerEvaluator.initial(properties.getInitialCapital(), now, zone);
                log.info("[RiskManager] No persisted state; initializing. capital={}", properties.getInitialCapital());
                return save(RiskStateRecord.create(initial, now));
            }));
    }

    private Mono<RiskStateRecord> save(RiskStateRecord record) {
        return repository.save(record)
            .onErrorMap(e -> !(e instanceof RiskStatePersistenceException),
                e -> new RiskStatePersistenceException("failed to write risk state", e));
    }
}
