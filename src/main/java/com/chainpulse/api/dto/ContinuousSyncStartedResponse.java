package com.chainpulse.api.dto;

public record ContinuousSyncStartedResponse(String analysisId, int syncCycle, boolean resumed, String message) {}
