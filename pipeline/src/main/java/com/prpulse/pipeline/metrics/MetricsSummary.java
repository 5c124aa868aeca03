package com.prpulse.pipeline.metrics;

import java.time.Instant;

/**
 * Organization-level statistics for one window. All counts default to 0 and all
 * rates and averages to 0.0; none of the fields is ever {@code null}.
 */
public record MetricsSummary(
        long organizationId,
        int windowDays,
        Instant generatedAt,
        long totalPRs,
        long recentPRs,
        long mergedPRs,
        long recentMerged,
        long thisWeekMerged,
        long lastWeekMerged,
        double weeklyPRVolumeChange,
        double avgCycleTimeHours,
        double avgReviewTimeHours,
        long avgPRSize,
        double categorizationRate,
        long openPRCount,
        long trackedRepositories,
        double mergeRate
) {}
