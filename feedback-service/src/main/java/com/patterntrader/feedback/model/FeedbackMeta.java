package com.patterntrader.feedback.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * Single-row table (id = 1) holding the current snapshot version.
 *
 * <p>Writers take {@code SELECT ... FOR UPDATE} on this row before touching the aggregate
 * tables, which serializes ingestion.
 */
@Data
@NoArgsConstructor
@Table("feedback_meta")
public class FeedbackMeta {

    @Id
    private Long id;

    private long version;
    private Instant generatedAt;
    private int totalOutcomes;
}
