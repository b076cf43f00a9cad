package com.patterntrader.feedback.service;

import com.patterntrader.common.exception.IncompleteOutcomeException;
import com.patterntrader.common.exception.TradingCoreException;
import com.patterntrader.common.feedback.FeedbackAggregator;
import com.patterntrader.common.feedback.FeedbackSnapshot;
import com.patterntrader.common.feedback.OutcomeRecord;
import com.patterntrader.feedback.dto.IngestResult;
import com.patterntrader.feedback.model.AdjustmentEntity;
import com.patterntrader.feedback.model.FeedbackMeta;
import com.patterntrader.feedback.model.FilterEntity;
import com.patterntrader.feedback.model.OutcomeEntity;
import com.patterntrader.feedback.model.RuleEntity;
import com.patterntrader.feedback.repository.AdjustmentRepository;
import com.patterntrader.feedback.repository.FeedbackMetaRepository;
import com.patterntrader.feedback.repository.FilterRepository;
import com.patterntrader.feedback.repository.OutcomeRepository;
import com.patterntrader.feedback.repository.RuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Write side of the feedback store.
 *
 * <p>One call = one transaction:
 * <ol>
 *   <li>reject records missing a segmentation field</li>
 *   <li>lock {@code feedback_meta}; concurrent writers queue here</li>
 *   <li>skip trade ids already stored (at-most-once ingestion)</li>
 *   <li>insert the outcome, recompute every segment from all stored outcomes</li>
 *   <li>replace the aggregate rows and bump the version</li>
 * </ol>
 * A failure anywhere rolls the whole step back, so readers only ever observe complete versions.
 */
@Service
public class FeedbackIngestionService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackIngestionService.class);

    private final OutcomeRepository outcomeRepository;
    private final AdjustmentRepository adjustmentRepository;
    private final RuleRepository ruleRepository;
    private final FilterRepository filterRepository;
    private final FeedbackMetaRepository metaRepository;
    private final FeedbackAggregator aggregator;
    private final TransactionalOperator writeTransactions;
    private final Clock clock;

    public FeedbackIngestionService(OutcomeRepository outcomeRepository,
                                    AdjustmentRepository adjustmentRepository,
                                    RuleRepository ruleRepository,
                                    FilterRepository filterRepository,
                                    FeedbackMetaRepository metaRepository,
                                    FeedbackAggregator aggregator,
                                    @Qualifier("writeTransactions") TransactionalOperator writeTransactions,
                                    Clock clock) {
        this.outcomeRepository    = outcomeRepository;
        this.adjustmentRepository = adjustmentRepository;
        this.ruleRepository       = ruleRepository;
        this.filterRepository     = filterRepository;
        this.metaRepository       = metaRepository;
        this.aggregator           = aggregator;
        this.writeTransactions    = writeTransactions;
        this.clock                = clock;
    }

    public Mono<IngestResult> ingest(OutcomeRecord outcome) {
        List<String> missing = outcome.missingFields();
        if (!missing.isEmpty()) {
            log.warn("[FeedbackStore] Rejected incomplete outcome. tradeId={} missing={}", outcome.tradeId(), missing);
            return Mono.error(new IncompleteOutcomeException(outcome.tradeId(), missing));
        }

        Mono<IngestResult> work = metaRepository.lockCurrent()
            .switchIfEmpty(Mono.error(new TradingCoreException("FeedbackStore", "feedback_meta row is missing")))
            .flatMap(meta -> outcomeRepository.existsByTradeId(outcome.tradeId())
                .flatMap(exists -> {
                    if (exists) {
                        log.info("[FeedbackStore] Duplicate outcome ignored. tradeId={} version={}",
                                 outcome.tradeId(), meta.getVersion());
                        return Mono.just(IngestResult.duplicate(outcome.tradeId(), meta.getVersion(),
                                                                meta.getTotalOutcomes()));
                    }
                    Instant now = clock.instant();
                    return outcomeRepository.save(OutcomeEntity.from(outcome, now))
                        .then(regenerate(meta, now))
                        .map(snapshot -> IngestResult.accepted(outcome.tradeId(), snapshot.version(),
                                                               snapshot.totalOutcomes()));
                }));

        return writeTransactions.transactional(work)
            .doOnError(e -> !(e instanceof IncompleteOutcomeException),
                e -> log.error("[FeedbackStore] Ingestion failed, rolled back. tradeId={}", outcome.tradeId(), e));
    }

    /** Recomputes all aggregates from stored outcomes and publishes them as {@code meta.version + 1}. */
    private Mono<FeedbackSnapshot> regenerate(FeedbackMeta meta, Instant now) {
        long nextVersion = meta.getVersion() + 1;
        return outcomeRepository.findAllInIngestionOrder()
            .map(OutcomeEntity::toRecord)
            .collectList()
            .map(outcomes -> aggregator.aggregate(outcomes, now, nextVersion))
            .flatMap(snapshot -> adjustmentRepository.clear()
                .then(ruleRepository.clear())
                .then(filterRepository.clear())
                .thenMany(adjustmentRepository.saveAll(snapshot.adjustments().stream().map(AdjustmentEntity::from).toList()))
                .thenMany(ruleRepository.saveAll(snapshot.rules().stream().map(RuleEntity::from).toList()))
                .thenMany(filterRepository.saveAll(snapshot.filters().stream().map(FilterEntity::from).toList()))
                .then(metaRepository.publish(snapshot.version(), now, snapshot.totalOutcomes()))
                .doOnSuccess(rows -> log.info(
                    "[FeedbackStore] Snapshot published. version={} outcomes={} adjustments={} rules={} filters={}",
                    snapshot.version(), snapshot.totalOutcomes(), snapshot.adjustments().size(),
                    snapshot.rules().size(), snapshot.filters().size()))
                .thenReturn(snapshot));
    }
}
