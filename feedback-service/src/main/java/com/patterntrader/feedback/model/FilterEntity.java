package com.patterntrader.feedback.model;

import com.patterntrader.common.feedback.AdjustmentCategory;
import com.patterntrader.common.feedback.AdjustmentKey;
import com.patterntrader.common.feedback.FilterAction;
import com.patterntrader.common.feedback.FilterAdjustment;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/** Penalty or boost on a pattern, horizon or sector segment. */
@Data
@NoArgsConstructor
@Table("feedback_filters")
public class FilterEntity {

    @Id
    private Long id;

    private String category;
    private String pattern;
    private String trend;
    private Integer horizon;
    private String sector;

    private String action;
    private double winRate;
    private int totalTrades;

    public static FilterEntity from(FilterAdjustment f) {
        FilterEntity e = new FilterEntity();
        AdjustmentKey k = f.key();
        e.setCategory(k.category().storeName());
        e.setPattern(k.pattern());
        e.setTrend(k.trend());
        e.setHorizon(k.horizon());
        e.setSector(k.sector());
        e.setAction(f.action().name());
        e.setWinRate(f.winRate());
        e.setTotalTrades(f.totalTrades());
        return e;
    }

    public FilterAdjustment toFilter() {
        AdjustmentKey key = new AdjustmentKey(AdjustmentCategory.fromStoreName(category), pattern, trend, horizon, sector);
        return new FilterAdjustment(key, FilterAction.valueOf(action), winRate, totalTrades);
    }
}
