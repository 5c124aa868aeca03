package com.prpulse.pipeline.metrics;

public record ContributorStats(
        String userId,
        String name,
        long prsCreated,
        long reviewsGiven,
        double avgCycleTimeHours,
        long avgPRSize,
        double reviewThoroughness,
        long contributionScore
) {}
