package com.chainpulse.ingestion.contract.command;

import com.chainpulse.domain.AnalysisUpdate;
import com.chainpulse.domain.ContinuousCompletionReason;
import com.chainpulse.domain.ContinuousSyncRequestedEvent;
import com.chainpulse.domain.ContractAnalysis;
import com.chainpulse.domain.ContractAnalysis.AnalysisStatus;
import com.chainpulse.domain.ContractAnalysisRepository;
import com.chainpulse.domain.DefaultContract;
import com.chainpulse.domain.DefaultContractUpdate;
import com.chainpulse.domain.SyncMetadata;
import com.chainpulse.domain.UserAccount;
import com.chainpulse.domain.UserAccountRepository;
import com.chainpulse.ingestion.sync.ActiveSyncRegistry;
import com.chainpulse.ingestion.sync.SyncTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static com.chainpulse.ingestion.contract.command.ContinuousSyncCommandException.NO_ACTIVE_SYNC;
import static com.chainpulse.ingestion.contract.command.ContinuousSyncCommandException.NO_DEFAULT_CONTRACT;
import static com.chainpulse.ingestion.contract.command.ContinuousSyncCommandException.SYNC_ALREADY_RUNNING;
import static com.chainpulse.ingestion.contract.command.ContinuousSyncCommandException.USER_NOT_FOUND;

/**
 * Starts and stops continuous sync of a user's default contract. Starting registers the sync on the analysis
 * record and publishes {@link ContinuousSyncRequestedEvent}; stopping flips {@code metadata.continuous}, which the
 * running loop observes before its next cycle.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContinuousSyncCommandService {

    static final int START_PROGRESS = 10;

    private final UserAccountRepository userAccountRepository;
    private final ContractAnalysisRepository contractAnalysisRepository;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final ActiveSyncRegistry activeSyncRegistry;

    /**
     * Resumes the user's latest analysis (keeping its results and logs) or creates one, then triggers the sync loop.
     * A resumed analysis is updated field by field so that writes of a loop still winding down are not lost.
     *
     * @param searchStrategy null keeps the analysis' previous strategy, or "comprehensive" for a new analysis
     * @throws ContinuousSyncCommandException USER_NOT_FOUND, NO_DEFAULT_CONTRACT or SYNC_ALREADY_RUNNING, the latter
     *                                        also while a stopped loop for the analysis has not exited yet
     */
    public ContinuousSyncStarted start(String userId, String searchStrategy, Long blockRange) {
        DefaultContract contract = defaultContractOf(userId);
        Instant now = Instant.now();
        Optional<ContractAnalysis> latest = contractAnalysisRepository.findFirstByUserIdOrderByCreatedAtDesc(userId);
        if (latest.isPresent() && isContinuouslyRunning(latest.get())) {
            throw new ContinuousSyncCommandException(SYNC_ALREADY_RUNNING,
                    "Continuous sync already running for analysis " + latest.get().getId());
        }
        if (latest.isPresent() && activeSyncRegistry.isRunning(latest.get().getId())) {
            throw new ContinuousSyncCommandException(SYNC_ALREADY_RUNNING,
                    "Previous continuous sync for analysis " + latest.get().getId() + " is still stopping, retry shortly");
        }

        String analysisId;
        int cycle;
        String strategy;
        Long range;
        if (latest.isPresent()) {
            ContractAnalysis previous = latest.get();
            SyncMetadata metadata = previous.getMetadata();
            analysisId = previous.getId();
            cycle = metadata.getSyncCycle() != null ? metadata.getSyncCycle() + 1 : 1;
            strategy = searchStrategy != null ? searchStrategy
                    : metadata.getSearchStrategy() != null ? metadata.getSearchStrategy() : SyncTarget.COMPREHENSIVE;
            range = blockRange != null ? blockRange : metadata.getBlockRange();
            AnalysisUpdate.AnalysisUpdateBuilder update = AnalysisUpdate.builder()
                    .status(AnalysisStatus.RUNNING)
                    .progress(START_PROGRESS)
                    .reopen(true)
                    .metadata(SyncMetadata.DEFAULT_CONTRACT, true)
                    .metadata(SyncMetadata.CONTINUOUS, true)
                    .metadata(SyncMetadata.CONTINUOUS_STARTED, now)
                    .metadata(SyncMetadata.SYNC_CYCLE, cycle)
                    .metadata(SyncMetadata.SEARCH_STRATEGY, strategy)
                    .log("Starting continuous sync cycle " + cycle + "...");
            if (range != null) {
                update.metadata(SyncMetadata.BLOCK_RANGE, range);
            }
            if (!contractAnalysisRepository.applyUpdate(analysisId, update.build())) {
                throw new ContinuousSyncCommandException(NO_ACTIVE_SYNC, "Analysis " + analysisId + " no longer exists");
            }
        } else {
            cycle = 1;
            strategy = searchStrategy != null ? searchStrategy : SyncTarget.COMPREHENSIVE;
            range = blockRange;
            analysisId = contractAnalysisRepository.save(newAnalysis(userId, contract, strategy, range, now)).getId();
        }

        userAccountRepository.updateDefaultContract(userId, DefaultContractUpdate.builder()
                .lastAnalysisId(analysisId)
                .indexed(false)
                .indexingProgress(START_PROGRESS)
                .continuousSync(true)
                .continuousSyncStarted(now)
                .lastUpdate(now)
                .clearError(true)
                .build());

        boolean resumed = latest.isPresent();
        log.info("Continuous sync requested for user {} on analysis {} (cycle {}, {})",
                userId, analysisId, cycle, resumed ? "resumed" : "new");
        applicationEventPublisher.publishEvent(new ContinuousSyncRequestedEvent(
                analysisId, userId, contract.getAddress(), contract.getChain(), strategy, range));
        return new ContinuousSyncStarted(analysisId, cycle, resumed);
    }

    /**
     * Marks the running continuous analysis completed and turns continuous mode off.
     *
     * @throws ContinuousSyncCommandException USER_NOT_FOUND, NO_DEFAULT_CONTRACT or NO_ACTIVE_SYNC
     */
    public ContinuousSyncStopped stop(String userId) {
        defaultContractOf(userId);
        ContractAnalysis analysis = contractAnalysisRepository.findFirstByUserIdOrderByCreatedAtDesc(userId)
                .filter(ContinuousSyncCommandService::isContinuouslyRunning)
                .orElseThrow(() -> new ContinuousSyncCommandException(NO_ACTIVE_SYNC,
                        "No continuous sync is currently running for the default contract"));
        Instant now = Instant.now();
        SyncMetadata metadata = analysis.getMetadata();
        int cycles = metadata.getSyncCycle() != null ? metadata.getSyncCycle() : 1;

        contractAnalysisRepository.applyUpdate(analysis.getId(), AnalysisUpdate.builder()
                .status(AnalysisStatus.COMPLETED)
                .progress(100)
                .metadata(SyncMetadata.CONTINUOUS, false)
                .metadata(SyncMetadata.CONTINUOUS_STOPPED, now)
                .metadata(SyncMetadata.STOPPED_BY_CYCLE, cycles)
                .log("Continuous sync stopped by user after " + cycles + " cycles")
                .completedAt(now)
                .build());

        userAccountRepository.updateDefaultContract(userId, DefaultContractUpdate.builder()
                .continuousSync(false)
                .continuousSyncStopped(now)
                .indexed(true)
                .indexingProgress(100)
                .completionReason(ContinuousCompletionReason.USER_REQUESTED.code())
                .lastUpdate(now)
                .build());

        Instant started = metadata.getContinuousStarted() != null ? metadata.getContinuousStarted() : analysis.getCreatedAt();
        long durationMs = started != null ? Duration.between(started, now).toMillis() : 0;
        log.info("Continuous sync for analysis {} stopped by user {} after {} cycle(s)", analysis.getId(), userId, cycles);
        return new ContinuousSyncStopped(analysis.getId(), cycles, durationMs);
    }

    private DefaultContract defaultContractOf(String userId) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ContinuousSyncCommandException(USER_NOT_FOUND, "User not found: " + userId));
        DefaultContract contract = user.getOnboarding() != null ? user.getOnboarding().getDefaultContract() : null;
        if (contract == null || contract.getAddress() == null) {
            throw new ContinuousSyncCommandException(NO_DEFAULT_CONTRACT,
                    "User has not completed onboarding or has no default contract");
        }
        return contract;
    }

    static boolean isContinuouslyRunning(ContractAnalysis analysis) {
        return (analysis.getStatus() == AnalysisStatus.RUNNING || analysis.getStatus() == AnalysisStatus.PENDING)
                && analysis.getMetadata() != null
                && Boolean.TRUE.equals(analysis.getMetadata().getContinuous());
    }

    private static ContractAnalysis newAnalysis(String userId, DefaultContract contract, String searchStrategy,
                                                Long blockRange, Instant now) {
        ContractAnalysis analysis = new ContractAnalysis();
        analysis.setUserId(userId);
        analysis.setContractAddress(contract.getAddress());
        analysis.setChain(contract.getChain());
        analysis.setContractName(contract.getName());
        analysis.setCreatedAt(now);
        analysis.setUpdatedAt(now);
        analysis.setStatus(AnalysisStatus.RUNNING);
        analysis.setProgress(START_PROGRESS);
        SyncMetadata metadata = analysis.getMetadata();
        metadata.setDefaultContract(true);
        metadata.setContinuous(true);
        metadata.setContinuousStarted(now);
        metadata.setSyncCycle(1);
        metadata.setSearchStrategy(searchStrategy);
        metadata.setBlockRange(blockRange);
        analysis.getLogs().add("Starting continuous sync mode...");
        return analysis;
    }
}
