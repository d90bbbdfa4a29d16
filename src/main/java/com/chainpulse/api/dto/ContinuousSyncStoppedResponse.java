package com.chainpulse.api.dto;

public record ContinuousSyncStoppedResponse(String analysisId, int cyclesCompleted, long totalDurationMs, String message) {}
