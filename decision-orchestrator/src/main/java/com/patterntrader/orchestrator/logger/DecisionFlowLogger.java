package com.patterntrader.orchestrator.logger;

import com.patterntrader.orchestrator.trace.SessionTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage log of one session run. Side effects only.
 *
 * <ol>
 *   <li>{@link #SESSION_STARTED}</li>
 *   <li>{@link #TRADES_MONITORED}: open trades checked against the day's candles</li>
 *   <li>{@link #RISK_CHECKED}: breaker and cooldown state read from trade-service</li>
 *   <li>{@link #CONTEXT_LOADED}: feedback snapshot and regime in hand</li>
 *   <li>{@link #PREDICTIONS_COMPLETED}</li>
 *   <li>{@link #SIGNALS_SUBMITTED}</li>
 *   <li>{@link #SESSION_RECORDED}: date written to the session log</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(DecisionFlowLogger.TRADES_MONITORED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String SESSION_STARTED       = "SESSION_STARTED";
    public static final String TRADES_MONITORED      = "TRADES_MONITORED";
    public static final String RISK_CHECKED          = "RISK_CHECKED";
    public static final String CONTEXT_LOADED        = "CONTEXT_LOADED";
    public static final String PREDICTIONS_COMPLETED = "PREDICTIONS_COMPLETED";
    public static final String SIGNALS_SUBMITTED     = "SIGNALS_SUBMITTED";
    public static final String SESSION_RECORDED      = "SESSION_RECORDED";

    /** {@code doOnEach} consumer; fires on onNext only and reads the session id from the signal's context. */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String sessionId = SessionTrace.getSessionId(signal.getContextView());
            SessionTrace.withMdc(sessionId, () ->
                log.info("[DecisionFlow] stage={} sessionId={}", stageName, sessionId)
            );
        };
    }

    public void logWithSessionId(String stageName, String sessionId, String detail) {
        SessionTrace.withMdc(sessionId, () ->
            log.info("[DecisionFlow] stage={} sessionId={} {}", stageName, sessionId, detail)
        );
    }
}
