package com.prpulse.pipeline.metrics;

/**
 * Activity of one tracked repository over a window. {@code hasData} is false
 * when no pull request was created in the window; the figures are then zero.
 */
public record RepositoryInsight(
        long repositoryId,
        String name,
        String fullName,
        boolean hasData,
        long totalPRs,
        long openPRs,
        double avgCycleTimeHours,
        long avgPRSize,
        long categorizedPRs,
        double categorizationRate,
        long contributorCount
) {}
