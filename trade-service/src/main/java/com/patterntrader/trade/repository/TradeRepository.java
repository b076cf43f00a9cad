package com.patterntrader.trade.repository;

import com.patterntrader.trade.model.TradeRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface TradeRepository extends ReactiveCrudRepository<TradeRecord, Long> {

    /**
     * True when a non-cancelled trade already holds this dedup key, whether still open
     * or already closed.
     */
    @Query("""
        SELECT EXISTS (
            SELECT 1 FROM trades
             WHERE instrument   = :instrument
               AND horizon_days = :horizonDays
               AND signal_date  = :signalDate
               AND status      <> 'CANCELLED')
        """)
    Mono<Boolean> existsActiveKey(String instrument, int horizonDays, LocalDate signalDate);

    @Query("SELECT * FROM trades WHERE status = 'OPEN' ORDER BY entry_date, id")
    Flux<TradeRecord> findOpen();

    @Query("""
        SELECT * FROM trades
         WHERE status IN ('CLOSED_SL', 'CLOSED_TARGET', 'CLOSED_EXPIRY')
         ORDER BY closed_at, id
        """)
    Flux<TradeRecord> findClosed();

    @Query("""
        SELECT * FROM trades
         WHERE status IN ('CLOSED_SL', 'CLOSED_TARGET', 'CLOSED_EXPIRY')
           AND outcome_published = FALSE
         ORDER BY closed_at, id
        """)
    Flux<TradeRecord> findUnpublished();

    @Modifying
    @Query("UPDATE trades SET outcome_published = TRUE, version = version + 1 WHERE id = :id")
    Mono<Integer> markPublished(Long id);
}
