package com.chainpulse.domain;

import com.chainpulse.domain.report.DeFiMetrics;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Metrics snapshot of the accumulated dataset, replaced after every sync cycle.
 */
@NoArgsConstructor
@Getter
@Setter
public class AccumulatedMetrics {

    private DeFiMetrics.FinancialMetrics financial;
    private DeFiMetrics.ActivityMetrics activity;
    private DeFiMetrics.PerformanceMetrics performance;

    private int totalTransactions;
    private int uniqueUsers;
    private int totalEvents;
    private BigDecimal totalValue = BigDecimal.ZERO;
    private double avgTransactionsPerUser;
    private Instant dataFreshness;

    private int syncCyclesCompleted;
    private long lastProcessedBlock;
    private String blockRangeProcessed;
    private int duplicatesSkipped;
    /** 100 minus the share of this cycle's normalized transactions that were already accumulated. */
    private double dataIntegrityScore;

    private String uxGrade;
    private double uxCompletionRate;
    private int uxBottleneckCount;
    private double averageSessionDuration;
    private double userRetentionRate;
    private double userActivationRate;
    private double averageJourneyLength;
}
