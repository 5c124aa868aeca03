package com.prpulse.pipeline.metrics;

import java.util.List;

/**
 * Read-only statistics over the normalized store. Empty data yields the documented
 * zero values; store failures propagate.
 */
public interface MetricsService {

    int DEFAULT_WINDOW_DAYS = 30;

    int DEFAULT_INSIGHTS_WINDOW_DAYS = 90;

    MetricsSummary getSummary(long organizationId, int windowDays);

    /**
     * @param repositoryId restricts the series to one repository, or {@code null} for all
     */
    TimeSeries getTimeSeries(long organizationId, int days, Long repositoryId);

    default TeamPerformance getTeamPerformance(long organizationId, int windowDays, int topN) {
        return getTeamPerformance(organizationId, windowDays, topN, List.of());
    }

    /**
     * @param repositoryIds restricts pull requests, reviews and coverage to these
     *                      repositories; empty means every repository of the organization
     */
    TeamPerformance getTeamPerformance(long organizationId, int windowDays, int topN, List<Long> repositoryIds);

    List<CategoryShare> getCategoryDistribution(long organizationId, int windowDays);

    /**
     * One entry per tracked repository, busiest first. Pull requests count when
     * they were created inside the window.
     */
    List<RepositoryInsight> getRepositoryInsights(long organizationId, int windowDays);
}
