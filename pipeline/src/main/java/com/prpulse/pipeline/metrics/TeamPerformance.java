package com.prpulse.pipeline.metrics;

import java.util.List;

/**
 * Contributor ranking for one window. {@code contributors} holds at most the
 * requested top N; the team-wide figures cover every contributor.
 */
public record TeamPerformance(
        long organizationId,
        int windowDays,
        List<ContributorStats> contributors,
        int totalContributors,
        double avgTeamCycleTimeHours,
        double collaborationIndex,
        double reviewCoverage
) {}
