package com.chainpulse.ingestion.store;

/**
 * Outcome of merging a batch into the accumulator.
 *
 * @param added   items whose key was not yet present
 * @param skipped items dropped because their key was already accumulated
 */
public record MergeResult(int added, int skipped) {
}
