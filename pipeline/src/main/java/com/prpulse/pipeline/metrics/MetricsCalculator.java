package com.prpulse.pipeline.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Arithmetic shared by the metrics queries. Every method returns a neutral value
 * (zero) instead of failing on empty input.
 */
public final class MetricsCalculator {

    public static final String UNCATEGORIZED = "Uncategorized";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final double MILLIS_PER_HOUR = 3_600_000d;

    private MetricsCalculator() {
    }

    /**
     * {@code part / whole * 100}, rounded to one decimal; 0 when {@code whole} is 0.
     */
    public static double percentage(long part, long whole) {
        if (whole == 0) {
            return 0;
        }
        return roundOneDecimal(part * 100d / whole);
    }

    /**
     * Week-over-week change in percent. A previous value of 0 yields 0.
     */
    public static double percentChange(long current, long previous) {
        if (previous == 0) {
            return 0;
        }
        return roundOneDecimal((current - previous) * 100d / previous);
    }

    public static double ratio(long numerator, long denominator) {
        if (denominator == 0) {
            return 0;
        }
        return roundOneDecimal((double) numerator / denominator);
    }

    /**
     * Hours between two instants, or {@code null} when either is missing.
     */
    public static Double hoursBetween(Instant from, Instant to) {
        if (from == null || to == null) {
            return null;
        }
        return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
    }

    /**
     * Mean of the non-null values, rounded to one decimal; 0 when there are none.
     */
    public static double averageOf(Collection<Double> values) {
        return roundOneDecimal(values.stream()
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0));
    }

    public static double roundOneDecimal(double value) {
        return Math.round(value * 10) / 10.0;
    }

    /**
     * Stable series key for a category name: trimmed, with runs of whitespace
     * replaced by a single underscore. {@code null} maps to {@link #UNCATEGORIZED}.
     */
    public static String categoryKey(String categoryName) {
        if (categoryName == null || categoryName.isBlank()) {
            return UNCATEGORIZED;
        }
        return WHITESPACE.matcher(categoryName.trim()).replaceAll("_");
    }
}
