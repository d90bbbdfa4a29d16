package com.chainpulse.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * Partial update of a user's {@link DefaultContract}. Null fields are left untouched;
 * {@code clearError} removes a previously recorded error.
 */
@Getter
@Builder
public class DefaultContractUpdate {

    private final String lastAnalysisId;
    private final Boolean indexed;
    private final Integer indexingProgress;
    private final Boolean continuousSync;
    private final Instant continuousSyncStarted;
    private final Instant continuousSyncStopped;
    private final Instant lastUpdate;
    private final String completionReason;
    private final String error;
    private final boolean clearError;

    /** Indexing progress only. */
    public static DefaultContractUpdate progress(int indexingProgress) {
        return DefaultContractUpdate.builder()
                .indexingProgress(indexingProgress)
                .lastUpdate(Instant.now())
                .build();
    }

    /** Terminal state of a loop that finished on its own or was stopped. */
    public static DefaultContractUpdate finished(ContinuousCompletionReason reason) {
        return DefaultContractUpdate.builder()
                .continuousSync(false)
                .indexed(true)
                .indexingProgress(100)
                .lastUpdate(Instant.now())
                .completionReason(reason.code())
                .build();
    }

    /** Terminal state of a loop that crashed. */
    public static DefaultContractUpdate failed(String message) {
        return DefaultContractUpdate.builder()
                .continuousSync(false)
                .indexed(false)
                .indexingProgress(0)
                .lastUpdate(Instant.now())
                .error(message)
                .build();
    }
}
