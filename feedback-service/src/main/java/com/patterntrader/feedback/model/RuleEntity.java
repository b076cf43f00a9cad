package com.patterntrader.feedback.model;

import com.patterntrader.common.feedback.QualitativeRule;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

@Data
@NoArgsConstructor
@Table("feedback_rules")
public class RuleEntity {

    @Id
    private Long id;

    private String context;
    private double confidence;
    private String description;

    public static RuleEntity from(QualitativeRule rule) {
        RuleEntity e = new RuleEntity();
        e.setContext(rule.context());
        e.setConfidence(rule.confidence());
        e.setDescription(rule.description());
        return e;
    }

    public QualitativeRule toRule() {
        return new QualitativeRule(context, confidence, description);
    }
}
