package com.chainpulse.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Partial update of a {@link ContractAnalysis}. Null top-level fields are left untouched, metadata entries are
 * merged key by key into {@code metadata} (use the {@link SyncMetadata} field constants) and logs are appended.
 * {@code reopen} clears the outcome of a finished run: error message, completion time and stop time.
 */
@Getter
@Builder
public class AnalysisUpdate {

    private final ContractAnalysis.AnalysisStatus status;
    private final Integer progress;
    @Singular("metadata")
    private final Map<String, Object> metadataFields;
    @Singular
    private final List<String> logs;
    private final AnalysisResults results;
    private final String errorMessage;
    private final Instant completedAt;
    private final boolean reopen;

    public boolean isEmpty() {
        return status == null && progress == null && metadataFields.isEmpty() && logs.isEmpty()
                && results == null && errorMessage == null && completedAt == null && !reopen;
    }
}
