package com.patterntrader.feedback.repository;

import com.patterntrader.feedback.model.AdjustmentEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface AdjustmentRepository extends ReactiveCrudRepository<AdjustmentEntity, Long> {

    @Query("""
        SELECT * FROM feedback_adjustments
        ORDER BY category, pattern, trend, horizon, sector
        """)
    Flux<AdjustmentEntity> findAllOrdered();

    @Modifying
    @Query("DELETE FROM feedback_adjustments")
    Mono<Integer> clear();
}
