package com.chainpulse.ingestion.sync.cycle;

import com.chainpulse.domain.AccumulatedMetrics;
import com.chainpulse.domain.AccumulatedUser;
import com.chainpulse.domain.AnalysisResults;
import com.chainpulse.domain.FullReport;
import com.chainpulse.ingestion.config.ContinuousSyncProperties;
import com.chainpulse.ingestion.store.AccumulatedDataset;
import com.chainpulse.ingestion.sync.SyncRun;
import com.chainpulse.ingestion.sync.window.BlockWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Builds the persisted results snapshot of a cycle: aggregate metrics plus the capped full report.
 */
@Component
@RequiredArgsConstructor
public class CycleSnapshotAssembler {

    private final ContinuousSyncProperties properties;

    /**
     * @param lastProcessedBlock the run's cursor after this window; can be above {@code window.toBlock()} when the
     *                           chain head went backwards
     */
    AnalysisResults assemble(SyncRun run, BlockWindow window, long lastProcessedBlock, String fetchMethod,
                             int normalizedCount, int duplicatesSkipped, CycleAnalytics analytics, Instant now) {
        AccumulatedDataset dataset = run.getDataset();
        AccumulatedMetrics metrics = metrics(run, window, lastProcessedBlock, normalizedCount, duplicatesSkipped,
                analytics, now);

        FullReport report = new FullReport(
                dataset.recentTransactions(properties.getReportTransactionLimit()),
                dataset.recentEvents(properties.getReportEventLimit()),
                dataset.recentUsers(properties.getReportUserLimit()),
                metrics,
                analytics.uxAnalysis(),
                analytics.journeys(),
                analytics.lifecycle(),
                new FullReport.Summary(
                        metrics.getTotalTransactions(),
                        metrics.getUniqueUsers(),
                        metrics.getTotalEvents(),
                        metrics.getTotalValue(),
                        metrics.getDataIntegrityScore(),
                        metrics.getUxGrade(),
                        metrics.getUxBottleneckCount(),
                        metrics.getUserRetentionRate(),
                        metrics.getAverageJourneyLength()),
                new FullReport.Metadata(
                        run.getCycleNumber(),
                        now,
                        dataset.processedBlockRanges(),
                        lastProcessedBlock,
                        fetchMethod,
                        metrics.getDataIntegrityScore(),
                        duplicatesSkipped));

        return new AnalysisResults(new AnalysisResults.TargetResults(
                run.getTarget().contractAddress(),
                run.getTarget().chain(),
                metrics,
                dataset.transactionCount(),
                new AnalysisResults.BlockRange(window.fromBlock(), window.toBlock()),
                report));
    }

    private static AccumulatedMetrics metrics(SyncRun run, BlockWindow window, long lastProcessedBlock,
                                              int normalizedCount, int duplicatesSkipped,
                                              CycleAnalytics analytics, Instant now) {
        AccumulatedDataset dataset = run.getDataset();
        AccumulatedMetrics metrics = new AccumulatedMetrics();
        metrics.setFinancial(analytics.defiMetrics().financial());
        metrics.setActivity(analytics.defiMetrics().activity());
        metrics.setPerformance(analytics.defiMetrics().performance());

        metrics.setTotalTransactions(dataset.transactionCount());
        metrics.setUniqueUsers(dataset.userCount());
        metrics.setTotalEvents(dataset.eventCount());
        metrics.setTotalValue(dataset.users().stream()
                .map(AccumulatedUser::getTotalValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
        metrics.setAvgTransactionsPerUser(dataset.userCount() > 0
                ? (double) dataset.transactionCount() / dataset.userCount() : 0);
        metrics.setDataFreshness(now);

        metrics.setSyncCyclesCompleted(run.getCycleNumber());
        metrics.setLastProcessedBlock(lastProcessedBlock);
        metrics.setBlockRangeProcessed(window.toString());
        metrics.setDuplicatesSkipped(duplicatesSkipped);
        metrics.setDataIntegrityScore(integrityScore(duplicatesSkipped, normalizedCount));

        metrics.setUxGrade(analytics.uxAnalysis().uxGrade().grade());
        metrics.setUxCompletionRate(analytics.uxAnalysis().uxGrade().completionRate());
        metrics.setUxBottleneckCount(analytics.uxAnalysis().bottlenecks().size());
        metrics.setAverageSessionDuration(analytics.uxAnalysis().sessionDurations().averageDuration());
        metrics.setUserRetentionRate(analytics.lifecycle().summary().retentionRate());
        metrics.setUserActivationRate(analytics.lifecycle().activationMetrics().activationRate());
        metrics.setAverageJourneyLength(analytics.journeys().averageJourneyLength());
        return metrics;
    }

    /** Share of this cycle's normalized transactions that were new, as a percentage. */
    static double integrityScore(int duplicatesSkipped, int normalizedCount) {
        return 100 - (duplicatesSkipped / (double) Math.max(normalizedCount, 1)) * 100;
    }
}
