package com.chainpulse.ingestion.sync.cycle;

import com.chainpulse.domain.report.DeFiMetrics;
import com.chainpulse.domain.report.JourneyReport;
import com.chainpulse.domain.report.LifecycleReport;
import com.chainpulse.domain.report.UxBottleneckReport;

/**
 * Analyzer outputs computed over the whole accumulated dataset in one cycle.
 */
record CycleAnalytics(
        DeFiMetrics defiMetrics,
        UxBottleneckReport uxAnalysis,
        JourneyReport journeys,
        LifecycleReport lifecycle
) {}
