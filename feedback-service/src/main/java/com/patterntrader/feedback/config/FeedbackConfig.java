package com.patterntrader.feedback.config;

import com.patterntrader.common.feedback.FeedbackAggregator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.reactive.TransactionalOperator;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.time.Clock;

@Configuration
public class FeedbackConfig {

    @Bean
    public FeedbackAggregator feedbackAggregator(FeedbackProperties properties) {
        return new FeedbackAggregator(properties.toSettings());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Ingestion: read committed plus the feedback_meta row lock. */
    @Bean
    public TransactionalOperator writeTransactions(ReactiveTransactionManager transactionManager) {
        return TransactionalOperator.create(transactionManager);
    }

    /** Snapshot reads see every table at one point in time. */
    @Bean
    public TransactionalOperator snapshotTransactions(ReactiveTransactionManager transactionManager) {
        DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
        definition.setReadOnly(true);
        definition.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        return TransactionalOperator.create(transactionManager, definition);
    }
}
