package com.patterntrader.trade.repository;

import com.patterntrader.trade.model.SessionLogRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface SessionLogRepository extends ReactiveCrudRepository<SessionLogRecord, Long> {

    @Query("SELECT * FROM session_log ORDER BY session_date DESC LIMIT 1")
    Mono<SessionLogRecord> findLatest();

    /** Re-running a session overwrites its counters. */
    @Modifying
    @Query("""
        INSERT INTO session_log (session_date, signals_received, signals_accepted, trades_closed, processed_at)
        VALUES (:sessionDate, :signalsReceived, :signalsAccepted, :tradesClosed, NOW())
        ON CONFLICT (session_date) DO UPDATE SET
            signals_received = EXCLUDED.signals_received,
            signals_accepted = EXCLUDED.signals_accepted,
            trades_closed    = EXCLUDED.trades_closed,
            processed_at     = NOW()
        """)
    Mono<Integer> upsert(LocalDate sessionDate, int signalsReceived, int signalsAccepted, int tradesClosed);
}
