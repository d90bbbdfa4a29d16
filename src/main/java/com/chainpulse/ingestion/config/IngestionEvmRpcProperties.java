package com.chainpulse.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * EVM RPC throttling.
 */
@ConfigurationProperties(prefix = "chainpulse.ingestion.evm-rpc")
@NoArgsConstructor
@Getter
@Setter
public class IngestionEvmRpcProperties {

    /** Global EVM RPC budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 25;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 5_000;

    /** Log limiter waits longer than this. */
    private long localLimiterLogThresholdMs = 250;

    /** Transaction hashes per JSON-RPC batch when resolving transactions and receipts. */
    private int lookupBatchSize = 50;
}
