package com.prpulse.pipeline.metrics;

import java.time.LocalDate;
import java.util.Map;

/**
 * One UTC calendar day. {@code categoryCounts} has an entry for every key of the
 * enclosing series, zero included.
 */
public record TimeSeriesPoint(
        LocalDate date,
        long prCount,
        long mergedCount,
        double avgCycleTimeHours,
        Map<String, Long> categoryCounts
) {}
