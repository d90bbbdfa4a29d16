package com.chainpulse.ingestion.sync.cycle;

import com.chainpulse.analytics.journey.UserJourneyAnalyzer;
import com.chainpulse.analytics.lifecycle.UserLifecycleAnalyzer;
import com.chainpulse.analytics.metrics.DeFiMetricsCalculator;
import com.chainpulse.analytics.ux.UxBottleneckDetector;
import com.chainpulse.common.StringUtils;
import com.chainpulse.common.SyncConfigurationException;
import com.chainpulse.domain.AccumulatedTransaction;
import com.chainpulse.domain.AnalysisResults;
import com.chainpulse.domain.ContractInteractions;
import com.chainpulse.domain.DefaultContractUpdate;
import com.chainpulse.domain.NormalizedTransaction;
import com.chainpulse.ingestion.adapter.ContractInteractionSource;
import com.chainpulse.ingestion.normalizer.TransactionNormalizer;
import com.chainpulse.ingestion.store.AccumulatedDataset;
import com.chainpulse.ingestion.store.MergeResult;
import com.chainpulse.ingestion.store.UserAggregator;
import com.chainpulse.ingestion.sync.SyncRun;
import com.chainpulse.ingestion.sync.SyncTarget;
import com.chainpulse.ingestion.sync.progress.SyncRecordBridge;
import com.chainpulse.ingestion.sync.window.BlockWindow;
import com.chainpulse.ingestion.sync.window.SyncWindowPlanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Runs one fetch-merge-analyze-persist cycle of a continuous sync. Does not catch or retry: any failure
 * propagates to the loop, which decides whether to continue.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncCycleExecutor {

    static final String FETCH_METHOD = "interaction-based";
    static final long ESTIMATED_CYCLE_DURATION_MS = 45_000;

    private final List<ContractInteractionSource> interactionSources;
    private final SyncWindowPlanner windowPlanner;
    private final TransactionNormalizer transactionNormalizer;
    private final UserAggregator userAggregator;
    private final DeFiMetricsCalculator defiMetricsCalculator;
    private final UxBottleneckDetector uxBottleneckDetector;
    private final UserJourneyAnalyzer userJourneyAnalyzer;
    private final UserLifecycleAnalyzer userLifecycleAnalyzer;
    private final CycleSnapshotAssembler snapshotAssembler;
    private final SyncRecordBridge recordBridge;

    public CycleReport execute(SyncRun run) {
        int cycle = run.getCycleNumber();
        SyncTarget target = run.getTarget();
        if (StringUtils.isBlank(target.chain())) {
            throw new SyncConfigurationException("Target contract chain is missing from configuration");
        }

        int progress = cycleProgress(cycle);
        recordBridge.markCycleStarted(run.getAnalysisId(), cycle, progress, run.getLastProcessedBlock(),
                FETCH_METHOD, ESTIMATED_CYCLE_DURATION_MS);
        recordBridge.writeUserOnboarding(run.getUserId(), DefaultContractUpdate.progress(progress));

        ContractInteractionSource source = sourceFor(target.chain());
        long head = source.getCurrentBlockNumber(target.chain());
        BlockWindow window = windowPlanner.planWindow(head, run.getLastProcessedBlock(), cycle, target);
        log.debug("Cycle {} for analysis {}: fetching blocks {} ({} blocks)", cycle, run.getAnalysisId(), window, window.size());

        ContractInteractions interactions = source.fetchContractInteractions(
                target.contractAddress(), window.fromBlock(), window.toBlock(), target.chain());
        List<NormalizedTransaction> normalized =
                transactionNormalizer.normalizeTransactions(interactions.transactions(), target.chain());

        AccumulatedDataset dataset = run.getDataset();
        Instant now = Instant.now();
        MergeResult txMerge = dataset.mergeTransactions(normalized, cycle, now);
        MergeResult eventMerge = dataset.mergeEvents(interactions.events(), cycle, now);
        int newUsers = dataset.replaceUsers(userAggregator.deriveUsers(dataset.transactions(), dataset.events(), cycle));
        dataset.recordProcessedRange(window.fromBlock(), window.toBlock());

        CycleAnalytics analytics = analyze(dataset.transactions(), target.contractAddress());
        String fetchMethod = interactions.method() != null ? interactions.method() : FETCH_METHOD;
        long cursor = run.cursorAfter(window.toBlock());
        AnalysisResults results = snapshotAssembler.assemble(
                run, window, cursor, fetchMethod, normalized.size(), txMerge.skipped(), analytics, now);

        CycleReport report = new CycleReport(txMerge.added(), eventMerge.added(), newUsers, txMerge.skipped(), window);
        recordBridge.recordCycleResults(run.getAnalysisId(), results, cursor,
                summaryLines(cycle, report, dataset, analytics, results));
        log.info("Cycle {} for analysis {} done: {} new txs, {} new events, {} new users, {} duplicates; totals {} txs, {} users, {} events",
                cycle, run.getAnalysisId(), report.newTransactionsCount(), report.newEventsCount(),
                report.newUsersCount(), report.duplicatesSkipped(),
                dataset.transactionCount(), dataset.userCount(), dataset.eventCount());
        return report;
    }

    static int cycleProgress(int cycle) {
        return Math.min(90, 10 + cycle * 2);
    }

    private ContractInteractionSource sourceFor(String chain) {
        return interactionSources.stream()
                .filter(s -> s.supports(chain))
                .findFirst()
                .orElseThrow(() -> new SyncConfigurationException("No interaction source supports chain " + chain));
    }

    private CycleAnalytics analyze(Collection<AccumulatedTransaction> transactions, String contractAddress) {
        return new CycleAnalytics(
                defiMetricsCalculator.calculateAllMetrics(transactions, StringUtils.normalizeAddress(contractAddress)),
                uxBottleneckDetector.analyzeUxBottlenecks(transactions),
                userJourneyAnalyzer.analyzeJourneys(transactions),
                userLifecycleAnalyzer.analyzeUserLifecycle(transactions));
    }

    private static List<String> summaryLines(int cycle, CycleReport report, AccumulatedDataset dataset,
                                             CycleAnalytics analytics, AnalysisResults results) {
        String prefix = "Cycle " + cycle + ": ";
        double integrity = results.target().metrics().getDataIntegrityScore();
        return List.of(
                prefix + "Added " + report.newTransactionsCount() + " new transactions, " + report.newEventsCount()
                        + " new events, " + report.newUsersCount() + " new users (" + report.duplicatesSkipped()
                        + " duplicates skipped)",
                prefix + "Total accumulated - " + dataset.transactionCount() + " transactions, "
                        + dataset.userCount() + " users, " + dataset.eventCount() + " events",
                prefix + "UX Grade: " + analytics.uxAnalysis().uxGrade().grade()
                        + ", Bottlenecks: " + analytics.uxAnalysis().bottlenecks().size()
                        + ", Retention: " + String.format(Locale.ROOT, "%.1f", analytics.lifecycle().summary().retentionRate()) + "%",
                prefix + "Data integrity score: " + Math.round(integrity) + "%");
    }
}
