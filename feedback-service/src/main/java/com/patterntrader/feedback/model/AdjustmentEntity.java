package com.patterntrader.feedback.model;

import com.patterntrader.common.feedback.AdjustmentCategory;
import com.patterntrader.common.feedback.AdjustmentKey;
import com.patterntrader.common.feedback.AdjustmentRecord;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Current segment statistics. The table holds exactly one snapshot version; ingestion
 * deletes and rewrites it inside the same transaction that bumps {@code feedback_meta.version}.
 *
 * <p>{@code category} uses the store names ({@code pattern_adjustments}, {@code triple_adjustments}, ...).
 */
@Data
@NoArgsConstructor
@Table("feedback_adjustments")
public class AdjustmentEntity {

    @Id
    private Long id;

    private String category;
    private String pattern;
    private String trend;
    private Integer horizon;
    private String sector;

    private int totalTrades;
    private int wins;
    private double winRate;
    private Double decayWeightedWinRate;
    private Double volumeConfirmedWinRate;
    private Double volumeUnconfirmedWinRate;

    public static AdjustmentEntity from(AdjustmentRecord r) {
        AdjustmentEntity e = new AdjustmentEntity();
        AdjustmentKey k = r.key();
        e.setCategory(k.category().storeName());
        e.setPattern(k.pattern());
        e.setTrend(k.trend());
        e.setHorizon(k.horizon());
        e.setSector(k.sector());
        e.setTotalTrades(r.totalTrades());
        e.setWins(r.wins());
        e.setWinRate(r.winRate());
        e.setDecayWeightedWinRate(r.decayWeightedWinRate());
        e.setVolumeConfirmedWinRate(r.volumeConfirmedWinRate());
        e.setVolumeUnconfirmedWinRate(r.volumeUnconfirmedWinRate());
        return e;
    }

    public AdjustmentRecord toRecord() {
        AdjustmentKey key = new AdjustmentKey(AdjustmentCategory.fromStoreName(category), pattern, trend, horizon, sector);
        return new AdjustmentRecord(key, totalTrades, wins, winRate, decayWeightedWinRate,
                                    volumeConfirmedWinRate, volumeUnconfirmedWinRate);
    }
}
