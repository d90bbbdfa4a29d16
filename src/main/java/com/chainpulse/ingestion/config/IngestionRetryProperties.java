package com.chainpulse.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * JSON-RPC retry policy (exponential backoff ± jitter).
 */
@ConfigurationProperties(prefix = "chainpulse.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. */
    private long baseDelayMs = 1000L;

    /** Jitter factor 0..1 (0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Attempts per call, including the first. */
    private int maxAttempts = 5;
}
