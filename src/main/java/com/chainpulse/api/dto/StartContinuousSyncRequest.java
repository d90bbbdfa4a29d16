package com.chainpulse.api.dto;

import com.chainpulse.api.validation.SearchStrategy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

/**
 * POST /api/v1/contracts/{userId}/continuous-sync request body; every field is optional.
 *
 * @param blockRange fallback window size in blocks when the chain head has not moved
 */
public record StartContinuousSyncRequest(
        @SearchStrategy
        String searchStrategy,

        @Positive(message = "INVALID_BLOCK_RANGE")
        @Max(value = 1_000_000, message = "INVALID_BLOCK_RANGE")
        Long blockRange
) {
}
