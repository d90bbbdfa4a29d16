package com.chainpulse.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted record of one contract analysis. A continuous sync loop runs against exactly one of these:
 * it polls {@code status} and {@code metadata.continuous} for stop signals and overwrites {@code results}
 * with a fresh accumulated snapshot every cycle.
 */
@Document(collection = "contract_analyses")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ContractAnalysis {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String userId;
    private String contractAddress;
    private String chain;
    private String contractName;
    private AnalysisStatus status;
    private Integer progress;
    private SyncMetadata metadata = new SyncMetadata();
    private List<String> logs = new ArrayList<>();
    private AnalysisResults results;
    private String errorMessage;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    public enum AnalysisStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED
    }
}
