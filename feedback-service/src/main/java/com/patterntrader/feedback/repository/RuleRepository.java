package com.patterntrader.feedback.repository;

import com.patterntrader.feedback.model.RuleEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface RuleRepository extends ReactiveCrudRepository<RuleEntity, Long> {

    @Query("SELECT * FROM feedback_rules ORDER BY context")
    Flux<RuleEntity> findAllOrdered();

    @Modifying
    @Query("DELETE FROM feedback_rules")
    Mono<Integer> clear();
}
