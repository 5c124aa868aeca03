package com.prpulse.pipeline.metrics;

import java.util.List;

public record TimeSeries(
        long organizationId,
        Long repositoryId,
        int days,
        List<CategorySeries> categories,
        List<TimeSeriesPoint> points
) {}
