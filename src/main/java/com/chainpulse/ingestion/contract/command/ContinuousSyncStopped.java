package com.chainpulse.ingestion.contract.command;

public record ContinuousSyncStopped(String analysisId, int cyclesCompleted, long totalDurationMs) {}
