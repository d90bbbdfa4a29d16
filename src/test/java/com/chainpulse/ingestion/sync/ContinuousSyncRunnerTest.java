package com.chainpulse.ingestion.sync;

import com.chainpulse.common.SyncConfigurationException;
import com.chainpulse.domain.ContractAnalysis;
import com.chainpulse.domain.ContractAnalysis.AnalysisStatus;
import com.chainpulse.domain.DefaultContractUpdate;
import com.chainpulse.domain.SyncMetadata;
import com.chainpulse.ingestion.adapter.RpcException;
import com.chainpulse.ingestion.config.ContinuousSyncProperties;
import com.chainpulse.ingestion.sync.cycle.CycleReport;
import com.chainpulse.ingestion.sync.cycle.SyncCycleExecutor;
import com.chainpulse.ingestion.sync.progress.SyncRecordBridge;
import com.chainpulse.ingestion.sync.window.BlockWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ContinuousSyncRunnerTest {

    private static final String ANALYSIS_ID = "analysis-1";
    private static final String USER_ID = "user-1";
    private static final SyncTarget TARGET = new SyncTarget("0xcontract", "lisk", "comprehensive", null);

    @Mock private SyncCycleExecutor cycleExecutor;
    @Mock private SyncRecordBridge recordBridge;

    private ContinuousSyncProperties properties;
    private ContinuousSyncRunner runner;

    @BeforeEach
    void setUp() {
        properties = new ContinuousSyncProperties();
        properties.setInterCycleDelayMs(0);
        runner = new ContinuousSyncRunner(cycleExecutor, recordBridge, properties);
        when(recordBridge.read(ANALYSIS_ID)).thenReturn(Optional.of(running()));
    }

    @Test
    @DisplayName("5 productive cycles then 10 empty ones complete the loop at cycle 15")
    void exhaustsAfterTenEmptyCycles() {
        when(cycleExecutor.execute(any())).thenAnswer(inv -> {
            SyncRun run = inv.getArgument(0);
            return run.getCycleNumber() <= 5 ? report(3, 1, run.getCycleNumber() * 100L) : empty(run.getCycleNumber() * 100L);
        });

        SyncTerminalState state = runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID);

        assertThat(state).isEqualTo(SyncTerminalState.COMPLETED_EXHAUSTED);
        verify(cycleExecutor, times(15)).execute(any());
        Map<String, Object> metadata = captureCompletionMetadata();
        assertThat(metadata)
                .containsEntry(SyncMetadata.COMPLETED_AFTER_CYCLES, 15)
                .containsEntry(SyncMetadata.EMPTY_CYCLES, 10)
                .containsEntry(SyncMetadata.AUTO_STOPPED_REASON, "No new data detected");
        assertThat(captureUserUpdates()).last()
                .extracting(DefaultContractUpdate::getCompletionReason)
                .isEqualTo("auto-stopped-no-data");
    }

    @Test
    @DisplayName("a cycle with data resets the empty streak")
    void dataResetsEmptyStreak() {
        properties.setEmptyCycleThreshold(3);
        AtomicInteger calls = new AtomicInteger();
        when(cycleExecutor.execute(any())).thenAnswer(inv -> {
            int n = calls.incrementAndGet();
            return n == 3 ? report(1, 0, n) : empty(n);
        });

        runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID);

        verify(cycleExecutor, times(6)).execute(any());
        assertThat(captureCompletionMetadata()).containsEntry(SyncMetadata.COMPLETED_AFTER_CYCLES, 6);
    }

    @Test
    @DisplayName("the loop stops after 50 cycles even when data keeps coming")
    void stopsAtCycleCeiling() {
        when(cycleExecutor.execute(any())).thenAnswer(inv -> {
            SyncRun run = inv.getArgument(0);
            return report(1, 1, run.getCycleNumber());
        });

        SyncTerminalState state = runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID);

        assertThat(state).isEqualTo(SyncTerminalState.COMPLETED_CEILING);
        verify(cycleExecutor, times(50)).execute(any());
        assertThat(captureCompletionMetadata())
                .containsEntry(SyncMetadata.COMPLETED_AFTER_CYCLES, 50)
                .containsEntry(SyncMetadata.AUTO_STOPPED_REASON, "Maximum cycles reached");
        assertThat(captureUserUpdates()).last()
                .extracting(DefaultContractUpdate::getCompletionReason)
                .isEqualTo("max-cycles-reached");
    }

    @Test
    @DisplayName("a failed cycle is logged and neither resets nor extends the empty streak")
    void failedCycleIsTolerated() {
        properties.setEmptyCycleThreshold(3);
        when(cycleExecutor.execute(any())).thenAnswer(inv -> {
            SyncRun run = inv.getArgument(0);
            if (run.getCycleNumber() == 2) {
                throw new RpcException("connection reset");
            }
            return empty(run.getCycleNumber());
        });

        SyncTerminalState state = runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID);

        assertThat(state).isEqualTo(SyncTerminalState.COMPLETED_EXHAUSTED);
        verify(recordBridge).appendLog(ANALYSIS_ID, "Cycle 2: Error - connection reset (interaction-based fetch)");
        verify(cycleExecutor, times(4)).execute(any());
        assertThat(captureCompletionMetadata())
                .containsEntry(SyncMetadata.COMPLETED_AFTER_CYCLES, 4)
                .containsEntry(SyncMetadata.EMPTY_CYCLES, 3);
    }

    @Test
    @DisplayName("a failing error log write does not end the loop")
    void errorLogFailureIsSwallowedPerCycle() {
        properties.setMaxCycles(2);
        when(cycleExecutor.execute(any())).thenThrow(new RpcException("timeout"));
        doThrow(new IllegalStateException("mongo down"))
                .when(recordBridge).appendLog(eq(ANALYSIS_ID), anyString());

        SyncTerminalState state = runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID);

        assertThat(state).isEqualTo(SyncTerminalState.COMPLETED_CEILING);
        verify(cycleExecutor, times(2)).execute(any());
    }

    @Test
    @DisplayName("a failed read of the analysis record counts as a failed cycle")
    void recordReadFailureIsTolerated() {
        properties.setMaxCycles(3);
        when(recordBridge.read(ANALYSIS_ID))
                .thenThrow(new DataAccessResourceFailureException("mongo blip"))
                .thenReturn(Optional.of(running()));
        when(cycleExecutor.execute(any())).thenAnswer(inv -> report(1, 0, 10));

        SyncTerminalState state = runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID);

        assertThat(state).isEqualTo(SyncTerminalState.COMPLETED_CEILING);
        verify(cycleExecutor, times(2)).execute(any());
        verify(recordBridge).appendLog(ANALYSIS_ID, "Cycle 1: Error - mongo blip (interaction-based fetch)");
        assertThat(captureUserUpdates()).last()
                .extracting(DefaultContractUpdate::getCompletionReason)
                .isEqualTo("max-cycles-reached");
    }

    @Test
    @DisplayName("a failed completion write after the empty streak is retried on the next empty cycle")
    void exhaustionWriteFailureIsTolerated() {
        properties.setEmptyCycleThreshold(2);
        when(cycleExecutor.execute(any())).thenAnswer(inv -> {
            SyncRun run = inv.getArgument(0);
            return empty(run.getCycleNumber() * 10L);
        });
        doThrow(new DataAccessResourceFailureException("write timeout"))
                .doNothing()
                .when(recordBridge).markCompleted(eq(ANALYSIS_ID), anyMap(), anyString());

        SyncTerminalState state = runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID);

        assertThat(state).isEqualTo(SyncTerminalState.COMPLETED_EXHAUSTED);
        verify(cycleExecutor, times(3)).execute(any());
        verify(recordBridge, times(2)).markCompleted(eq(ANALYSIS_ID), anyMap(), anyString());
        verify(recordBridge).appendLog(ANALYSIS_ID, "Cycle 2: Error - write timeout (interaction-based fetch)");
    }

    @Test
    @DisplayName("a failed user write after completion does not fail the run")
    void userCompletionWriteFailureIsLogged() {
        properties.setMaxCycles(1);
        when(cycleExecutor.execute(any())).thenAnswer(inv -> report(1, 0, 10));
        doThrow(new DataAccessResourceFailureException("users unavailable"))
                .when(recordBridge).writeUserOnboarding(eq(USER_ID), any());

        SyncTerminalState state = runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID);

        assertThat(state).isEqualTo(SyncTerminalState.COMPLETED_CEILING);
        verify(recordBridge).markCompleted(eq(ANALYSIS_ID), anyMap(), anyString());
        verify(recordBridge, times(1)).writeUserOnboarding(eq(USER_ID), any());
    }

    @Test
    @DisplayName("the processed-block cursor never moves backwards")
    void lastProcessedBlockIsMonotonic() {
        properties.setMaxCycles(4);
        long[] heads = {1_000, 1_200, 1_100, 1_300};
        List<Long> seenCursors = new ArrayList<>();
        when(cycleExecutor.execute(any())).thenAnswer(inv -> {
            SyncRun run = inv.getArgument(0);
            seenCursors.add(run.getLastProcessedBlock());
            return report(1, 0, heads[run.getCycleNumber() - 1]);
        });

        runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID);

        assertThat(seenCursors).containsExactly(null, 1_000L, 1_200L, 1_200L);
    }

    @Test
    @DisplayName("clearing the continuous flag stops the loop before the next cycle")
    void stopFlagEndsLoop() {
        ContractAnalysis stopped = running();
        stopped.getMetadata().setContinuous(false);
        when(recordBridge.read(ANALYSIS_ID)).thenReturn(Optional.of(running()), Optional.of(running()), Optional.of(stopped));
        when(cycleExecutor.execute(any())).thenAnswer(inv -> report(1, 0, 10));

        SyncTerminalState state = runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID);

        assertThat(state).isEqualTo(SyncTerminalState.COMPLETED_STOPPED);
        verify(cycleExecutor, times(2)).execute(any());
        verify(recordBridge, never()).markCompleted(anyString(), anyMap(), anyString());
        assertThat(captureUserUpdates()).last()
                .extracting(DefaultContractUpdate::getCompletionReason)
                .isEqualTo("user_requested");
    }

    @Test
    @DisplayName("a deleted analysis ends the loop without running a cycle")
    void missingRecordIsTerminal() {
        when(recordBridge.read(ANALYSIS_ID)).thenReturn(Optional.empty());

        SyncTerminalState state = runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID);

        assertThat(state).isEqualTo(SyncTerminalState.FAILED_TERMINAL);
        verify(cycleExecutor, never()).execute(any());
        verify(recordBridge, never()).markCompleted(anyString(), anyMap(), anyString());
        assertThat(captureUserUpdates()).last()
                .extracting(DefaultContractUpdate::getCompletionReason)
                .isEqualTo("normal-completion");
    }

    @Test
    void evaluatePreCycle_coversRecordStates() {
        SyncRun run = new SyncRun(ANALYSIS_ID, USER_ID, TARGET);

        assertThat(runner.evaluatePreCycle(run)).isEmpty();

        ContractAnalysis failed = running();
        failed.setStatus(AnalysisStatus.FAILED);
        when(recordBridge.read(ANALYSIS_ID)).thenReturn(Optional.of(failed));
        assertThat(runner.evaluatePreCycle(run)).contains(SyncTerminalState.FAILED_TERMINAL);

        ContractAnalysis completedNoFlag = running();
        completedNoFlag.setStatus(AnalysisStatus.COMPLETED);
        completedNoFlag.getMetadata().setContinuous(null);
        when(recordBridge.read(ANALYSIS_ID)).thenReturn(Optional.of(completedNoFlag));
        assertThat(runner.evaluatePreCycle(run)).contains(SyncTerminalState.COMPLETED_STOPPED);

        ContractAnalysis pendingContinuous = running();
        pendingContinuous.setStatus(AnalysisStatus.PENDING);
        when(recordBridge.read(ANALYSIS_ID)).thenReturn(Optional.of(pendingContinuous));
        assertThat(runner.evaluatePreCycle(run)).isEmpty();
    }

    @Test
    @DisplayName("a configuration error ends the loop, marks the user failed and propagates")
    void configurationErrorIsTerminal() {
        when(cycleExecutor.execute(any())).thenThrow(new SyncConfigurationException("Target contract chain is missing from configuration"));

        assertThatThrownBy(() -> runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID))
                .isInstanceOf(SyncConfigurationException.class);

        verify(cycleExecutor, times(1)).execute(any());
        DefaultContractUpdate update = captureUserUpdates().get(0);
        assertThat(update.getError()).isEqualTo("Target contract chain is missing from configuration");
        assertThat(update.getIndexed()).isFalse();
        assertThat(update.getIndexingProgress()).isZero();
        assertThat(update.getContinuousSync()).isFalse();
    }

    @Test
    @DisplayName("interrupting the runner thread ends the loop and keeps the interrupt flag")
    void interruptStopsLoop() {
        properties.setInterCycleDelayMs(60_000);
        when(cycleExecutor.execute(any())).thenAnswer(inv -> report(1, 0, 10));

        Thread.currentThread().interrupt();
        SyncTerminalState state;
        try {
            state = runner.performContinuousContractSync(ANALYSIS_ID, TARGET, USER_ID);
        } finally {
            assertThat(Thread.interrupted()).isTrue();
        }

        assertThat(state).isEqualTo(SyncTerminalState.COMPLETED_STOPPED);
        verify(cycleExecutor, times(1)).execute(any());
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> captureCompletionMetadata() {
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(recordBridge).markCompleted(eq(ANALYSIS_ID), captor.capture(), anyString());
        return captor.getValue();
    }

    private List<DefaultContractUpdate> captureUserUpdates() {
        ArgumentCaptor<DefaultContractUpdate> captor = ArgumentCaptor.forClass(DefaultContractUpdate.class);
        verify(recordBridge, atLeastOnce()).writeUserOnboarding(eq(USER_ID), captor.capture());
        return captor.getAllValues();
    }

    private static ContractAnalysis running() {
        ContractAnalysis analysis = new ContractAnalysis();
        analysis.setId(ANALYSIS_ID);
        analysis.setStatus(AnalysisStatus.RUNNING);
        analysis.getMetadata().setContinuous(true);
        return analysis;
    }

    private static CycleReport report(int newTxs, int newEvents, long toBlock) {
        return new CycleReport(newTxs, newEvents, 0, 0, new BlockWindow(0, toBlock));
    }

    private static CycleReport empty(long toBlock) {
        return new CycleReport(0, 0, 0, 4, new BlockWindow(0, toBlock));
    }
}
