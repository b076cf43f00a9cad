package com.patterntrader.feedback.repository;

import com.patterntrader.feedback.model.FeedbackMeta;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Repository
public interface FeedbackMetaRepository extends ReactiveCrudRepository<FeedbackMeta, Long> {

    /**
     * Row lock held until the surrounding transaction ends. Every writer takes it first,
     * so concurrent ingestions apply one after another.
     */
    @Query("SELECT * FROM feedback_meta WHERE id = 1 FOR UPDATE")
    Mono<FeedbackMeta> lockCurrent();

    @Query("SELECT * FROM feedback_meta WHERE id = 1")
    Mono<FeedbackMeta> findCurrent();

    @Modifying
    @Query("""
        UPDATE feedback_meta
           SET version        = :version,
               generated_at   = :generatedAt,
               total_outcomes = :totalOutcomes
         WHERE id = 1
        """)
    Mono<Integer> publish(long version, Instant generatedAt, int totalOutcomes);
}
