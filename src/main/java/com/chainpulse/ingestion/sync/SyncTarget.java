package com.chainpulse.ingestion.sync;

/**
 * Contract a continuous sync follows.
 *
 * @param searchStrategy "comprehensive" widens the first window; anything else (or null) uses the standard one
 * @param blockRange     fallback window size; null means the configured default
 */
public record SyncTarget(String contractAddress, String chain, String searchStrategy, Long blockRange) {

    public static final String COMPREHENSIVE = "comprehensive";

    public boolean isComprehensive() {
        return COMPREHENSIVE.equalsIgnoreCase(searchStrategy);
    }
}
