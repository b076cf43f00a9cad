package com.patterntrader.feedback.repository;

import com.patterntrader.feedback.model.FilterEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface FilterRepository extends ReactiveCrudRepository<FilterEntity, Long> {

    @Query("SELECT * FROM feedback_filters ORDER BY category, pattern, horizon, sector")
    Flux<FilterEntity> findAllOrdered();

    @Modifying
    @Query("DELETE FROM feedback_filters")
    Mono<Integer> clear();
}
