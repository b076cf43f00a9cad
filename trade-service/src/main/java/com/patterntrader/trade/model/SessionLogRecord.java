package com.patterntrader.trade.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.time.LocalDate;

/** One processed trading session; the latest row is where catch-up resumes. */
@Data
@NoArgsConstructor
@Table("session_log")
public class SessionLogRecord {

    @Id
    private Long id;

    private LocalDate sessionDate;
    private int signalsReceived;
    private int signalsAccepted;
    private int tradesClosed;
    private Instant processedAt;
}
