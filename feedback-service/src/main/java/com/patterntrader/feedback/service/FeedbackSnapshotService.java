package com.patterntrader.feedback.service;

import com.patterntrader.common.feedback.FeedbackSnapshot;
import com.patterntrader.feedback.model.AdjustmentEntity;
import com.patterntrader.feedback.model.FilterEntity;
import com.patterntrader.feedback.model.RuleEntity;
import com.patterntrader.feedback.repository.AdjustmentRepository;
import com.patterntrader.feedback.repository.FeedbackMetaRepository;
import com.patterntrader.feedback.repository.FilterRepository;
import com.patterntrader.feedback.repository.RuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

/**
 * Read side of the feedback store. All four tables are read in one read-only
 * REPEATABLE READ transaction, so the returned snapshot is a single version.
 */
@Service
public class FeedbackSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackSnapshotService.class);

    private final FeedbackMetaRepository metaRepository;
    private final AdjustmentRepository adjustmentRepository;
    private final RuleRepository ruleRepository;
    private final FilterRepository filterRepository;
    private final TransactionalOperator snapshotTransactions;

    public FeedbackSnapshotService(FeedbackMetaRepository metaRepository,
                                   AdjustmentRepository adjustmentRepository,
                                   RuleRepository ruleRepository,
                                   FilterRepository filterRepository,
                                   @Qualifier("snapshotTransactions") TransactionalOperator snapshotTransactions) {
        this.metaRepository       = metaRepository;
        this.adjustmentRepository = adjustmentRepository;
        this.ruleRepository       = ruleRepository;
        this.filterRepository     = filterRepository;
        this.snapshotTransactions = snapshotTransactions;
    }

    public Mono<FeedbackSnapshot> current() {
        Mono<FeedbackSnapshot> read = metaRepository.findCurrent()
            .flatMap(meta -> adjustmentRepository.findAllOrdered().map(AdjustmentEntity::toRecord).collectList()
                .flatMap(adjustments -> ruleRepository.findAllOrdered().map(RuleEntity::toRule).collectList()
                    .flatMap(rules -> filterRepository.findAllOrdered().map(FilterEntity::toFilter).collectList()
                        .map(filters -> new FeedbackSnapshot(meta.getVersion(), meta.getGeneratedAt(),
                            meta.getTotalOutcomes(), adjustments, rules, filters)))))
            .defaultIfEmpty(FeedbackSnapshot.empty());

        return snapshotTransactions.transactional(read)
            .doOnSuccess(s -> log.debug("[FeedbackStore] Snapshot read. version={} adjustments={}",
                                        s.version(), s.adjustments().size()));
    }
}
