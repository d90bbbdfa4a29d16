package com.chainpulse.ingestion.contract.query;

import com.chainpulse.domain.ContractAnalysis;
import com.chainpulse.domain.ContractAnalysisRepository;
import com.chainpulse.ingestion.job.ContinuousSyncJobLauncher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read-only continuous sync status for API (GET /contracts/{userId}/continuous-sync).
 */
@Service
@RequiredArgsConstructor
public class ContinuousSyncStatusService {

    private final ContractAnalysisRepository contractAnalysisRepository;
    private final ContinuousSyncJobLauncher continuousSyncJobLauncher;

    public Optional<ContractAnalysis> findLatestAnalysis(String userId) {
        return contractAnalysisRepository.findFirstByUserIdOrderByCreatedAtDesc(userId);
    }

    /** True while a sync loop for the analysis occupies a thread in this process. */
    public boolean isLoopActive(String analysisId) {
        return continuousSyncJobLauncher.isRunning(analysisId);
    }
}
