package com.patterntrader.feedback.repository;

import com.patterntrader.feedback.model.OutcomeEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface OutcomeRepository extends ReactiveCrudRepository<OutcomeEntity, Long> {

    Mono<Boolean> existsByTradeId(String tradeId);

    /** All outcomes in ingestion order; the aggregator input. */
    @Query("SELECT * FROM trade_outcomes ORDER BY id")
    Flux<OutcomeEntity> findAllInIngestionOrder();
}
