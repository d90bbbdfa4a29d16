package com.chainpulse.ingestion.contract.command;

/**
 * @param syncCycle cycle number the analysis starts (or resumes) at
 */
public record ContinuousSyncStarted(String analysisId, int syncCycle, boolean resumed) {}
