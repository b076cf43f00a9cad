package com.patterntrader.feedback.model;

import com.patterntrader.common.feedback.OutcomeRecord;
import com.patterntrader.common.model.Direction;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One ingested trade outcome. {@code tradeId} is unique; the aggregates are always
 * recomputed from the full set of these rows.
 */
@Data
@NoArgsConstructor
@Table("trade_outcomes")
public class OutcomeEntity {

    @Id
    private Long id;

    private String tradeId;
    private String instrument;
    private String pattern;
    private String trend;
    private String sector;
    private Integer horizon;
    private String direction;

    private double returnPct;
    private boolean win;
    private boolean stopLossTriggered;
    private String exitStatus;
    private Double volumeRatio;

    private LocalDate entryDate;
    private Instant closedAt;
    private double mfePct;
    private double maePct;

    private Instant receivedAt;

    public static OutcomeEntity from(OutcomeRecord r, Instant receivedAt) {
        OutcomeEntity e = new OutcomeEntity();
        e.setTradeId(r.tradeId());
        e.setInstrument(r.instrument());
        e.setPattern(r.pattern().trim().toLowerCase());
        e.setTrend(r.trend().trim().toLowerCase());
        e.setSector(r.sector().trim().toLowerCase());
        e.setHorizon(r.horizon());
        e.setDirection(r.direction().label());
        e.setReturnPct(r.returnPct());
        e.setWin(r.win());
        e.setStopLossTriggered(r.stopLossTriggered());
        e.setExitStatus(r.exitStatus());
        e.setVolumeRatio(r.volumeRatio());
        e.setEntryDate(r.entryDate());
        e.setClosedAt(r.closedAt());
        e.setMfePct(r.mfePct());
        e.setMaePct(r.maePct());
        e.setReceivedAt(receivedAt);
        return e;
    }

    public OutcomeRecord toRecord() {
        return new OutcomeRecord(tradeId, instrument, pattern, trend, sector, horizon,
            Direction.fromLabel(direction), returnPct, win, stopLossTriggered, exitStatus, volumeRatio,
            entryDate, closedAt, mfePct, maePct);
    }
}
