package com.prpulse.pipeline.metrics;

/**
 * A category as it appears in a time series: its stable key plus what to show for it.
 */
public record CategorySeries(String key, String label, String color) {}
