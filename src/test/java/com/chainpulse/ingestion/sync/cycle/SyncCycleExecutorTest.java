package com.chainpulse.ingestion.sync.cycle;

import com.chainpulse.analytics.journey.UserJourneyAnalyzer;
import com.chainpulse.analytics.lifecycle.UserLifecycleAnalyzer;
import com.chainpulse.analytics.metrics.DeFiMetricsCalculator;
import com.chainpulse.analytics.ux.UxBottleneckDetector;
import com.chainpulse.common.SyncConfigurationException;
import com.chainpulse.domain.AnalysisResults;
import com.chainpulse.domain.ContractEvent;
import com.chainpulse.domain.ContractInteractions;
import com.chainpulse.domain.DefaultContractUpdate;
import com.chainpulse.domain.RawContractTransaction;
import com.chainpulse.ingestion.adapter.ContractInteractionSource;
import com.chainpulse.ingestion.adapter.RpcException;
import com.chainpulse.ingestion.config.ContinuousSyncProperties;
import com.chainpulse.ingestion.normalizer.FunctionSelectorRegistry;
import com.chainpulse.ingestion.normalizer.GasCostCalculator;
import com.chainpulse.ingestion.normalizer.TransactionNormalizer;
import com.chainpulse.ingestion.store.UserAggregator;
import com.chainpulse.ingestion.sync.SyncRun;
import com.chainpulse.ingestion.sync.SyncTarget;
import com.chainpulse.ingestion.sync.progress.SyncRecordBridge;
import com.chainpulse.ingestion.sync.window.BlockWindow;
import com.chainpulse.ingestion.sync.window.SyncWindowPlanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SyncCycleExecutorTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");
    private static final long BLOCK_TIME = NOW.minusSeconds(3_600).getEpochSecond();
    private static final String CONTRACT = "0x1111111111111111111111111111111111111111";
    private static final String ALICE = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    private static final String BOB = "0xbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb";

    @Mock private ContractInteractionSource source;
    @Mock private SyncRecordBridge recordBridge;

    private SyncCycleExecutor executor;
    private SyncRun run;

    @BeforeEach
    void setUp() {
        ContinuousSyncProperties properties = new ContinuousSyncProperties();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        executor = new SyncCycleExecutor(
                List.of(source),
                new SyncWindowPlanner(properties),
                new TransactionNormalizer(new GasCostCalculator(), new FunctionSelectorRegistry()),
                new UserAggregator(),
                new DeFiMetricsCalculator(clock),
                new UxBottleneckDetector(),
                new UserJourneyAnalyzer(),
                new UserLifecycleAnalyzer(clock),
                new CycleSnapshotAssembler(properties),
                recordBridge);
        run = new SyncRun("analysis-1", "user-1", new SyncTarget(CONTRACT, "lisk", "comprehensive", null));
        when(source.supports("lisk")).thenReturn(true);
        when(source.getCurrentBlockNumber("lisk")).thenReturn(1_000_000L);
    }

    @Test
    @DisplayName("first cycle merges everything, writes start progress, results and four summary lines")
    void firstCycle() {
        when(source.fetchContractInteractions(CONTRACT, 900_000L, 1_000_000L, "lisk"))
                .thenReturn(interactions(List.of(tx("0x01", ALICE), tx("0x02", ALICE), tx("0x03", BOB)),
                        List.of(event("0x01", 0), event("0x03", 0))));

        CycleReport report = executor.execute(run);

        assertThat(report).isEqualTo(new CycleReport(3, 2, 2, 0, new BlockWindow(900_000, 1_000_000)));
        verify(recordBridge).markCycleStarted("analysis-1", 1, 12, null, "interaction-based", 45_000L);
        ArgumentCaptor<DefaultContractUpdate> userUpdate = ArgumentCaptor.forClass(DefaultContractUpdate.class);
        verify(recordBridge).writeUserOnboarding(eq("user-1"), userUpdate.capture());
        assertThat(userUpdate.getValue().getIndexingProgress()).isEqualTo(12);

        List<String> logs = captureLogs();
        assertThat(logs).hasSize(4);
        assertThat(logs.get(0)).isEqualTo("Cycle 1: Added 3 new transactions, 2 new events, 2 new users (0 duplicates skipped)");
        assertThat(logs.get(1)).isEqualTo("Cycle 1: Total accumulated - 3 transactions, 2 users, 2 events");
        assertThat(logs.get(2)).startsWith("Cycle 1: UX Grade: ").contains("Bottlenecks: ").endsWith("%");
        assertThat(logs.get(3)).isEqualTo("Cycle 1: Data integrity score: 100%");

        AnalysisResults.TargetResults target = captureResults().target();
        assertThat(target.transactions()).isEqualTo(3);
        assertThat(target.blockRange()).isEqualTo(new AnalysisResults.BlockRange(900_000, 1_000_000));
        assertThat(target.metrics().getUniqueUsers()).isEqualTo(2);
        assertThat(target.metrics().getTotalValue()).isEqualByComparingTo("3");
        assertThat(target.fullReport().metadata().processedBlockRanges()).containsExactly("900000-1000000");
        assertThat(target.fullReport().users()).hasSize(2);
    }

    @Test
    @DisplayName("overlapping second cycle counts duplicates and lowers the integrity score")
    void secondCycleWithDuplicates() {
        when(source.fetchContractInteractions(anyString(), anyLong(), anyLong(), anyString()))
                .thenReturn(interactions(List.of(tx("0x01", ALICE), tx("0x02", ALICE), tx("0x03", BOB)), List.of()));
        executor.execute(run);
        run.advanceTo(1_000_000);
        run.nextCycle();

        when(source.getCurrentBlockNumber("lisk")).thenReturn(1_000_500L);
        when(source.fetchContractInteractions(CONTRACT, 1_000_001L, 1_000_500L, "lisk"))
                .thenReturn(interactions(List.of(tx("0x01", ALICE), tx("0x02", ALICE), tx("0x03", BOB), tx("0x04", BOB)), List.of()));

        CycleReport report = executor.execute(run);

        assertThat(report.newTransactionsCount()).isEqualTo(1);
        assertThat(report.duplicatesSkipped()).isEqualTo(3);
        assertThat(report.newUsersCount()).isZero();
        assertThat(run.getDataset().transactionCount()).isEqualTo(4);
        List<String> logs = captureLogs();
        assertThat(logs).contains(
                "Cycle 2: Added 1 new transactions, 0 new events, 0 new users (3 duplicates skipped)",
                "Cycle 2: Data integrity score: 25%");
    }

    @Test
    @DisplayName("a head behind the cursor does not move the persisted last processed block back")
    void headBehindCursor_keepsPersistedCursor() {
        run.advanceTo(1_000_000);
        run.nextCycle();
        when(source.getCurrentBlockNumber("lisk")).thenReturn(999_000L);
        when(source.fetchContractInteractions(anyString(), anyLong(), anyLong(), anyString()))
                .thenReturn(interactions(List.of(tx("0x01", ALICE)), List.of()));

        CycleReport report = executor.execute(run);

        assertThat(report.window().toBlock()).isEqualTo(999_000L);
        ArgumentCaptor<AnalysisResults> captor = ArgumentCaptor.forClass(AnalysisResults.class);
        verify(recordBridge).recordCycleResults(eq("analysis-1"), captor.capture(), eq(1_000_000L), any());
        AnalysisResults.TargetResults target = captor.getValue().target();
        assertThat(target.metrics().getLastProcessedBlock()).isEqualTo(1_000_000L);
        assertThat(target.fullReport().metadata().lastProcessedBlock()).isEqualTo(1_000_000L);
        assertThat(target.blockRange().to()).isEqualTo(999_000L);
    }

    @Test
    @DisplayName("a chain without interaction source is a configuration error")
    void unsupportedChain() {
        when(source.supports("lisk")).thenReturn(false);

        assertThatThrownBy(() -> executor.execute(run)).isInstanceOf(SyncConfigurationException.class);
    }

    @Test
    @DisplayName("a missing chain fails before anything is written")
    void missingChain() {
        SyncRun noChain = new SyncRun("analysis-1", "user-1", new SyncTarget(CONTRACT, " ", null, null));

        assertThatThrownBy(() -> executor.execute(noChain))
                .isInstanceOf(SyncConfigurationException.class)
                .hasMessageContaining("chain is missing");
        verify(recordBridge, never()).markCycleStarted(anyString(), anyInt(), anyInt(), any(), anyString(), anyLong());
    }

    @Test
    @DisplayName("fetch failures propagate and leave the dataset untouched")
    void fetchFailurePropagates() {
        when(source.fetchContractInteractions(anyString(), anyLong(), anyLong(), anyString()))
                .thenThrow(new RpcException("HTTP 429"));

        assertThatThrownBy(() -> executor.execute(run)).isInstanceOf(RpcException.class);
        assertThat(run.getDataset().transactionCount()).isZero();
        verify(recordBridge, never()).recordCycleResults(anyString(), any(), anyLong(), any());
    }

    @Test
    void cycleProgress_isCappedAt90() {
        assertThat(SyncCycleExecutor.cycleProgress(1)).isEqualTo(12);
        assertThat(SyncCycleExecutor.cycleProgress(40)).isEqualTo(90);
    }

    @SuppressWarnings("unchecked")
    private List<String> captureLogs() {
        ArgumentCaptor<List<String>> captor = ArgumentCaptor.forClass(List.class);
        verify(recordBridge, atLeastOnce())
                .recordCycleResults(eq("analysis-1"), any(), anyLong(), captor.capture());
        return captor.getValue();
    }

    private AnalysisResults captureResults() {
        ArgumentCaptor<AnalysisResults> captor = ArgumentCaptor.forClass(AnalysisResults.class);
        verify(recordBridge).recordCycleResults(eq("analysis-1"), captor.capture(), anyLong(), any());
        return captor.getValue();
    }

    private static ContractInteractions interactions(List<RawContractTransaction> txs, List<ContractEvent> events) {
        return new ContractInteractions(new ArrayList<>(txs), new ArrayList<>(events),
                new ContractInteractions.Summary(txs.size(), events.size(), 100_001), "interaction-based");
    }

    private static RawContractTransaction tx(String hash, String from) {
        return new RawContractTransaction(hash, from, CONTRACT,
                BigInteger.TEN.pow(18), BigInteger.valueOf(1_000_000_000L), BigInteger.valueOf(21_000), BigInteger.valueOf(50_000),
                "0xa9059cbb0000", 999_999L, BLOCK_TIME, true);
    }

    private static ContractEvent event(String txHash, int logIndex) {
        return new ContractEvent(CONTRACT, List.of("0xddf252ad"), "0x", 999_999L, txHash, 0, "0xblock", logIndex);
    }
}
