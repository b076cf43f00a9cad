package com.patterntrader.trade.service;

import com.patterntrader.trade.dto.SessionSummary;
import com.patterntrader.trade.repository.SessionLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/** Processed-session bookkeeping used by the orchestrator's catch-up. */
@Service
public class SessionLogService {

    private static final Logger log = LoggerFactory.getLogger(SessionLogService.class);

    private final SessionLogRepository repository;

    public SessionLogService(SessionLogRepository repository) {
        this.repository = repository;
    }

    public Mono<SessionSummary> lastSession() {
        return repository.findLatest()
            .map(r -> new SessionSummary(r.getSessionDate(), r.getSignalsReceived(),
                                         r.getSignalsAccepted(), r.getTradesClosed()));
    }

    public Mono<SessionSummary> record(LocalDate date, SessionSummary summary) {
        return repository.upsert(date, summary.signalsReceived(), summary.signalsAccepted(), summary.tradesClosed())
            .doOnSuccess(n -> log.info("[Session] Recorded. date={} signals={} accepted={} closed={}",
                date, summary.signalsReceived(), summary.signalsAccepted(), summary.tradesClosed()))
            .thenReturn(new SessionSummary(date, summary.signalsReceived(), summary.signalsAccepted(),
                                           summary.tradesClosed()));
    }
}
