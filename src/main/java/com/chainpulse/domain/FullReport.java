package com.chainpulse.domain;

import com.chainpulse.domain.report.JourneyReport;
import com.chainpulse.domain.report.LifecycleReport;
import com.chainpulse.domain.report.UxBottleneckReport;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Detailed per-cycle report stored under the analysis results. Transaction, event and user lists are capped;
 * the counts in {@link Summary} cover the whole accumulated dataset.
 */
public record FullReport(
        List<AccumulatedTransaction> transactions,
        List<AccumulatedEvent> events,
        List<AccumulatedUser> users,
        AccumulatedMetrics defiMetrics,
        UxBottleneckReport uxAnalysis,
        JourneyReport userJourneys,
        LifecycleReport userLifecycle,
        Summary summary,
        Metadata metadata
) {

    public record Summary(
            int totalTransactions,
            int uniqueUsers,
            int totalEvents,
            BigDecimal totalValue,
            double dataIntegrityScore,
            String uxGrade,
            int uxBottleneckCount,
            double userRetentionRate,
            double averageJourneyLength
    ) {}

    public record Metadata(
            int syncCycle,
            Instant lastUpdated,
            List<String> processedBlockRanges,
            long lastProcessedBlock,
            String fetchMethod,
            double dataIntegrityScore,
            int duplicatesSkipped
    ) {}
}
