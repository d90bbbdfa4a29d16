package com.chainpulse.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * The contract a user registered during onboarding, with the indexing state shown to that user.
 */
@NoArgsConstructor
@Getter
@Setter
public class DefaultContract {

    public static final String PATH = "onboarding.defaultContract";

    private String address;
    private String chain;
    private String name;
    private String lastAnalysisId;
    private Boolean indexed;
    private Integer indexingProgress;
    private Boolean continuousSync;
    private Instant continuousSyncStarted;
    private Instant continuousSyncStopped;
    private Instant lastUpdate;
    private String completionReason;
    private String error;
}
