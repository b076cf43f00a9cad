package com.patterntrader.trade.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A trade from acceptance to its terminal status.
 *
 * <p>Entry fields are written once on acceptance. Exit fields, excursions and {@code status}
 * are written only by the monitor step, and never again once the status is terminal.
 * {@code version} guards against two writers closing the same trade.
 *
 * <p>The partial unique index on {@code (instrument, horizon_days, signal_date) WHERE status <> 'CANCELLED'}
 * enforces the dedup key.
 */
@Data
@NoArgsConstructor
@Table("trades")
public class TradeRecord {

    @Id
    private Long id;

    @Version
    private Long version;

    // ── identity ──
    private String instrument;
    private int horizonDays;
    private LocalDate signalDate;

    // ── signal context ──
    private String sector;
    private String pattern;
    private String trend;
    private String direction;
    private String tier;
    private String regime;
    private double winRate;
    private double confidence;
    private String confidenceLevel;
    private Double volumeRatio;

    // ── entry ──
    private LocalDate entryDate;
    private double entryPrice;
    private double stopLoss;
    private double target;
    private double stopLossPct;
    private double targetPct;
    private double positionPct;
    private double positionValue;
    private LocalDate expiryDate;
    private Instant createdAt;

    // ── lifecycle ──
    private String status;
    private String cancelReason;
    private double mfePct;
    private double maePct;

    // ── exit ──
    private LocalDate exitDate;
    private Double exitPrice;
    private Instant closedAt;
    private Double returnPct;
    private Double pnl;
    private Boolean stopLossTriggered;
    private boolean outcomePublished;
}
