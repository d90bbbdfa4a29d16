package com.chainpulse.domain;

/**
 * Published after a continuous sync was registered on an analysis; triggers the sync loop.
 */
public record ContinuousSyncRequestedEvent(
        String analysisId,
        String userId,
        String contractAddress,
        String chain,
        String searchStrategy,
        Long blockRange
) {}
