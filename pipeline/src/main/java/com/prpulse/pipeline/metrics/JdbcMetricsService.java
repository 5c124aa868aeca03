package com.prpulse.pipeline.metrics;

import com.prpulse.pipeline.store.Database;
import com.prpulse.pipeline.store.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link MetricsService} computed from the relational store.
 *
 * <p>Each call takes a single {@code now} from the clock and runs all of its
 * queries in one read-only transaction, so every figure of a result is measured
 * against the same snapshot. Durations are computed in Java from the stored
 * timestamps, which keeps the SQL portable.</p>
 */
public class JdbcMetricsService implements MetricsService {

    private static final Logger logger = LoggerFactory.getLogger(JdbcMetricsService.class);

    static final String UNCATEGORIZED_COLOR = "#6b7280";

    private static final String SUMMARY_COUNTS_SQL = """
            SELECT
                COUNT(pr.id) AS total_prs,
                SUM(CASE WHEN pr.created_at >= ? THEN 1 ELSE 0 END) AS recent_prs,
                SUM(CASE WHEN pr.state = 'merged' THEN 1 ELSE 0 END) AS merged_prs,
                SUM(CASE WHEN pr.state = 'merged' AND pr.created_at >= ? THEN 1 ELSE 0 END) AS recent_merged,
                SUM(CASE WHEN pr.state = 'merged' AND pr.merged_at >= ? AND pr.merged_at < ?
                         THEN 1 ELSE 0 END) AS this_week_merged,
                SUM(CASE WHEN pr.state = 'merged' AND pr.merged_at >= ? AND pr.merged_at < ?
                         THEN 1 ELSE 0 END) AS last_week_merged,
                SUM(CASE WHEN pr.created_at >= ? AND pr.category_id IS NOT NULL THEN 1 ELSE 0 END) AS categorized_prs,
                SUM(CASE WHEN pr.state = 'open' THEN 1 ELSE 0 END) AS open_prs
            FROM pull_requests pr
            JOIN repositories r ON r.id = pr.repository_id
            WHERE r.organization_id = ?
            """;

    // "First review" is the earliest submitted review of any state.
    private static final String MERGED_IN_WINDOW_SQL = """
            SELECT pr.created_at, pr.merged_at, pr.additions, pr.deletions,
                   (SELECT MIN(rv.submitted_at) FROM reviews rv WHERE rv.pull_request_id = pr.id) AS first_review_at
            FROM pull_requests pr
            JOIN repositories r ON r.id = pr.repository_id
            WHERE r.organization_id = ?
              AND pr.state = 'merged'
              AND pr.merged_at >= ?
            """;

    private static final String TRACKED_REPOSITORIES_SQL =
            "SELECT COUNT(*) FROM repositories WHERE organization_id = ? AND is_tracked = TRUE";

    private static final String VISIBLE_CATEGORIES_SQL = """
            SELECT name, color
            FROM categories
            WHERE is_default = TRUE OR organization_id = ?
            ORDER BY CASE WHEN is_default THEN 0 ELSE 1 END, name, id
            """;

    private static final String CREATED_IN_RANGE_SQL = """
            SELECT pr.created_at, c.name AS category_name
            FROM pull_requests pr
            JOIN repositories r ON r.id = pr.repository_id
            LEFT JOIN categories c ON c.id = pr.category_id
            WHERE r.organization_id = ?
              AND pr.created_at >= ?
              AND pr.created_at < ?
            """;

    private static final String MERGED_IN_RANGE_SQL = """
            SELECT pr.created_at, pr.merged_at
            FROM pull_requests pr
            JOIN repositories r ON r.id = pr.repository_id
            WHERE r.organization_id = ?
              AND pr.state = 'merged'
              AND pr.merged_at >= ?
              AND pr.merged_at < ?
            """;

    private static final String REPOSITORY_FILTER = "  AND pr.repository_id = ?\n";

    private static final String AUTHORED_IN_WINDOW_SQL = """
            SELECT pr.author_id, u.name AS author_name, pr.state, pr.created_at, pr.merged_at,
                   pr.additions, pr.deletions
            FROM pull_requests pr
            JOIN repositories r ON r.id = pr.repository_id
            LEFT JOIN users u ON u.id = pr.author_id
            WHERE r.organization_id = ?
              AND pr.created_at >= ?
              AND pr.author_id IS NOT NULL
            """;

    // Reviews on one's own pull requests do not count as reviews given.
    private static final String REVIEWS_GIVEN_SQL = """
            SELECT rv.reviewer_id, COUNT(rv.id) AS reviews_given
            FROM reviews rv
            JOIN pull_requests pr ON pr.id = rv.pull_request_id
            JOIN repositories r ON r.id = pr.repository_id
            WHERE r.organization_id = ?
              AND rv.submitted_at >= ?
              AND rv.reviewer_id IS NOT NULL
              AND (pr.author_id IS NULL OR pr.author_id <> rv.reviewer_id)
            """;

    private static final String REVIEWS_GIVEN_GROUPING = "GROUP BY rv.reviewer_id\n";

    private static final String REVIEW_COVERAGE_SQL = """
            SELECT
                COUNT(pr.id) AS total_prs,
                SUM(CASE WHEN EXISTS (SELECT 1 FROM reviews rv WHERE rv.pull_request_id = pr.id)
                         THEN 1 ELSE 0 END) AS reviewed_prs
            FROM pull_requests pr
            JOIN repositories r ON r.id = pr.repository_id
            WHERE r.organization_id = ?
              AND pr.created_at >= ?
            """;

    private static final String CATEGORY_DISTRIBUTION_SQL = """
            SELECT c.name AS category_name, c.color AS category_color, COUNT(pr.id) AS pr_count
            FROM pull_requests pr
            JOIN repositories r ON r.id = pr.repository_id
            LEFT JOIN categories c ON c.id = pr.category_id
            WHERE r.organization_id = ?
              AND pr.created_at >= ?
            GROUP BY c.name, c.color
            """;

    // The window sits in the join so that repositories without recent pull requests still appear.
    private static final String REPOSITORY_ACTIVITY_SQL = """
            SELECT r.id AS repository_id, r.name, r.full_name,
                   pr.id AS pr_id, pr.state, pr.created_at, pr.merged_at, pr.additions, pr.deletions,
                   pr.category_id, pr.author_id
            FROM repositories r
            LEFT JOIN pull_requests pr ON pr.repository_id = r.id AND pr.created_at >= ?
            WHERE r.organization_id = ?
              AND r.is_tracked = TRUE
            ORDER BY r.id
            """;

    private final JdbcTemplate jdbc;
    private final TransactionTemplate readOnly;
    private final Clock clock;
    private final ContributionWeights weights;

    public JdbcMetricsService(Database database, Clock clock) {
        this(database, clock, ContributionWeights.DEFAULT);
    }

    public JdbcMetricsService(Database database, Clock clock, ContributionWeights weights) {
        this.jdbc = database.jdbc();
        this.readOnly = database.readOnlyTransactions();
        this.clock = clock;
        this.weights = weights;
    }

    // =========================================================================
    // Summary
    // =========================================================================

    @Override
    public MetricsSummary getSummary(long organizationId, int windowDays) {
        requirePositive("windowDays", windowDays);
        Instant now = clock.instant();
        Instant windowStart = now.minus(Duration.ofDays(windowDays));
        Instant weekStart = now.minus(Duration.ofDays(7));
        Instant previousWeekStart = now.minus(Duration.ofDays(14));

        return readOnly.execute(status -> {
            SummaryCounts counts = jdbc.queryForObject(SUMMARY_COUNTS_SQL, (rs, rowNum) -> new SummaryCounts(
                            rs.getLong("total_prs"),
                            rs.getLong("recent_prs"),
                            rs.getLong("merged_prs"),
                            rs.getLong("recent_merged"),
                            rs.getLong("this_week_merged"),
                            rs.getLong("last_week_merged"),
                            rs.getLong("categorized_prs"),
                            rs.getLong("open_prs")),
                    Timestamps.toDb(windowStart), Timestamps.toDb(windowStart),
                    Timestamps.toDb(weekStart), Timestamps.toDb(now),
                    Timestamps.toDb(previousWeekStart), Timestamps.toDb(weekStart),
                    Timestamps.toDb(windowStart), organizationId);

            List<Double> cycleHours = new ArrayList<>();
            List<Double> reviewHours = new ArrayList<>();
            List<Double> sizes = new ArrayList<>();
            jdbc.query(MERGED_IN_WINDOW_SQL, rs -> {
                Instant createdAt = Timestamps.fromDb(rs, "created_at");
                cycleHours.add(MetricsCalculator.hoursBetween(createdAt, Timestamps.fromDb(rs, "merged_at")));
                reviewHours.add(MetricsCalculator.hoursBetween(createdAt, Timestamps.fromDb(rs, "first_review_at")));
                sizes.add((double) (rs.getInt("additions") + rs.getInt("deletions")));
            }, organizationId, Timestamps.toDb(windowStart));

            Long tracked = jdbc.queryForObject(TRACKED_REPOSITORIES_SQL, Long.class, organizationId);

            MetricsSummary summary = new MetricsSummary(
                    organizationId,
                    windowDays,
                    now,
                    counts.totalPRs(),
                    counts.recentPRs(),
                    counts.mergedPRs(),
                    counts.recentMerged(),
                    counts.thisWeekMerged(),
                    counts.lastWeekMerged(),
                    MetricsCalculator.percentChange(counts.thisWeekMerged(), counts.lastWeekMerged()),
                    MetricsCalculator.averageOf(cycleHours),
                    MetricsCalculator.averageOf(reviewHours),
                    Math.round(sizes.stream().mapToDouble(Double::doubleValue).average().orElse(0)),
                    MetricsCalculator.percentage(counts.categorizedPRs(), counts.recentPRs()),
                    counts.openPRs(),
                    tracked != null ? tracked : 0,
                    MetricsCalculator.percentage(counts.recentMerged(), counts.recentPRs()));
            logger.debug("Summary for organization {} over {} days: {}", organizationId, windowDays, summary);
            return summary;
        });
    }

    // =========================================================================
    // Time series
    // =========================================================================

    @Override
    public TimeSeries getTimeSeries(long organizationId, int days, Long repositoryId) {
        requirePositive("days", days);
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        LocalDate firstDay = today.minusDays(days - 1L);
        Instant rangeStart = firstDay.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant rangeEnd = today.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        return readOnly.execute(status -> {
            Map<String, CategorySeries> categories = new LinkedHashMap<>();
            jdbc.query(VISIBLE_CATEGORIES_SQL, rs -> {
                String name = rs.getString("name");
                categories.putIfAbsent(MetricsCalculator.categoryKey(name),
                        new CategorySeries(MetricsCalculator.categoryKey(name), name, rs.getString("color")));
            }, organizationId);
            categories.putIfAbsent(MetricsCalculator.UNCATEGORIZED, new CategorySeries(
                    MetricsCalculator.UNCATEGORIZED, MetricsCalculator.UNCATEGORIZED, UNCATEGORIZED_COLOR));

            Map<LocalDate, Map<String, Long>> createdByDay = new HashMap<>();
            jdbc.query(withRepositoryFilter(CREATED_IN_RANGE_SQL, repositoryId), rs -> {
                LocalDate day = utcDate(Timestamps.fromDb(rs, "created_at"));
                String categoryName = rs.getString("category_name");
                String key = MetricsCalculator.categoryKey(categoryName);
                categories.putIfAbsent(key, new CategorySeries(key, categoryName, null));
                createdByDay.computeIfAbsent(day, d -> new HashMap<>()).merge(key, 1L, Long::sum);
            }, rangeArgs(organizationId, rangeStart, rangeEnd, repositoryId));

            Map<LocalDate, List<Double>> cycleByMergeDay = new HashMap<>();
            jdbc.query(withRepositoryFilter(MERGED_IN_RANGE_SQL, repositoryId), rs -> {
                Instant mergedAt = Timestamps.fromDb(rs, "merged_at");
                cycleByMergeDay.computeIfAbsent(utcDate(mergedAt), d -> new ArrayList<>())
                        .add(MetricsCalculator.hoursBetween(Timestamps.fromDb(rs, "created_at"), mergedAt));
            }, rangeArgs(organizationId, rangeStart, rangeEnd, repositoryId));

            List<TimeSeriesPoint> points = new ArrayList<>(days);
            for (int i = 0; i < days; i++) {
                LocalDate day = firstDay.plusDays(i);
                Map<String, Long> counts = new LinkedHashMap<>();
                Map<String, Long> created = createdByDay.getOrDefault(day, Map.of());
                for (String key : categories.keySet()) {
                    counts.put(key, created.getOrDefault(key, 0L));
                }
                List<Double> cycles = cycleByMergeDay.getOrDefault(day, List.of());
                points.add(new TimeSeriesPoint(
                        day,
                        created.values().stream().mapToLong(Long::longValue).sum(),
                        cycles.size(),
                        MetricsCalculator.averageOf(cycles),
                        counts));
            }

            return new TimeSeries(organizationId, repositoryId, days, List.copyOf(categories.values()), points);
        });
    }

    // =========================================================================
    // Team performance
    // =========================================================================

    @Override
    public TeamPerformance getTeamPerformance(long organizationId, int windowDays, int topN,
                                              List<Long> repositoryIds) {
        requirePositive("windowDays", windowDays);
        requirePositive("topN", topN);
        Instant windowStart = clock.instant().minus(Duration.ofDays(windowDays));
        List<Long> repositories = repositoryIds != null ? repositoryIds : List.of();
        String filter = repositoriesFilter(repositories);
        Object[] args = windowArgs(organizationId, windowStart, repositories);

        return readOnly.execute(status -> {
            Map<String, AuthorTally> authors = new LinkedHashMap<>();
            jdbc.query(AUTHORED_IN_WINDOW_SQL + filter, rs -> {
                AuthorTally tally = authors.computeIfAbsent(rs.getString("author_id"), AuthorTally::new);
                tally.name = rs.getString("author_name");
                tally.prsCreated++;
                tally.sizes.add((double) (rs.getInt("additions") + rs.getInt("deletions")));
                if ("merged".equals(rs.getString("state"))) {
                    Double hours = MetricsCalculator.hoursBetween(
                            Timestamps.fromDb(rs, "created_at"), Timestamps.fromDb(rs, "merged_at"));
                    if (hours != null) {
                        tally.cycleHours.add(hours);
                    }
                }
            }, args);

            Map<String, Long> reviewsGiven = new HashMap<>();
            jdbc.query(REVIEWS_GIVEN_SQL + filter + REVIEWS_GIVEN_GROUPING, rs -> {
                reviewsGiven.put(rs.getString("reviewer_id"), rs.getLong("reviews_given"));
            }, args);

            long[] coverage = jdbc.queryForObject(REVIEW_COVERAGE_SQL + filter,
                    (rs, rowNum) -> new long[]{rs.getLong("total_prs"), rs.getLong("reviewed_prs")}, args);

            List<ContributorStats> ranked = new ArrayList<>();
            List<Double> teamCycleHours = new ArrayList<>();
            long totalPrs = 0;
            long totalReviews = 0;
            for (AuthorTally tally : authors.values()) {
                long reviews = reviewsGiven.getOrDefault(tally.userId, 0L);
                totalPrs += tally.prsCreated;
                totalReviews += reviews;
                teamCycleHours.addAll(tally.cycleHours);
                ranked.add(new ContributorStats(
                        tally.userId,
                        tally.name != null ? tally.name : tally.userId,
                        tally.prsCreated,
                        reviews,
                        MetricsCalculator.averageOf(tally.cycleHours),
                        Math.round(tally.sizes.stream().mapToDouble(Double::doubleValue).average().orElse(0)),
                        MetricsCalculator.percentage(reviews, tally.prsCreated),
                        weights.score(tally.prsCreated, reviews)));
            }
            ranked.sort(RANKING);

            return new TeamPerformance(
                    organizationId,
                    windowDays,
                    List.copyOf(ranked.subList(0, Math.min(topN, ranked.size()))),
                    ranked.size(),
                    MetricsCalculator.averageOf(teamCycleHours),
                    MetricsCalculator.ratio(totalReviews, totalPrs),
                    coverage != null ? MetricsCalculator.percentage(coverage[1], coverage[0]) : 0);
        });
    }

    static final Comparator<ContributorStats> RANKING = Comparator
            .comparingLong(ContributorStats::contributionScore).reversed()
            .thenComparing(Comparator.comparingLong(ContributorStats::prsCreated).reversed())
            .thenComparing(ContributorStats::userId);

    // =========================================================================
    // Category distribution
    // =========================================================================

    @Override
    public List<CategoryShare> getCategoryDistribution(long organizationId, int windowDays) {
        requirePositive("windowDays", windowDays);
        Instant windowStart = clock.instant().minus(Duration.ofDays(windowDays));

        return readOnly.execute(status -> {
            Map<String, long[]> countsByName = new LinkedHashMap<>();
            Map<String, String> colorsByName = new HashMap<>();
            jdbc.query(CATEGORY_DISTRIBUTION_SQL, rs -> {
                String name = rs.getString("category_name");
                String label = name != null ? name : MetricsCalculator.UNCATEGORIZED;
                String color = name != null ? rs.getString("category_color") : UNCATEGORIZED_COLOR;
                countsByName.computeIfAbsent(label, n -> new long[1])[0] += rs.getLong("pr_count");
                colorsByName.putIfAbsent(label, color);
            }, organizationId, Timestamps.toDb(windowStart));

            long total = countsByName.values().stream().mapToLong(c -> c[0]).sum();
            List<CategoryShare> shares = new ArrayList<>();
            countsByName.forEach((name, count) -> shares.add(new CategoryShare(
                    name, colorsByName.get(name), count[0], MetricsCalculator.percentage(count[0], total))));
            shares.sort(Comparator.comparingLong(CategoryShare::count).reversed()
                    .thenComparing(CategoryShare::name));
            return List.copyOf(shares);
        });
    }

    // =========================================================================
    // Repository insights
    // =========================================================================

    @Override
    public List<RepositoryInsight> getRepositoryInsights(long organizationId, int windowDays) {
        requirePositive("windowDays", windowDays);
        Instant windowStart = clock.instant().minus(Duration.ofDays(windowDays));

        return readOnly.execute(status -> {
            Map<Long, RepositoryTally> tallies = new LinkedHashMap<>();
            jdbc.query(REPOSITORY_ACTIVITY_SQL, rs -> {
                RepositoryTally tally = tallies.computeIfAbsent(rs.getLong("repository_id"), id -> new RepositoryTally());
                tally.name = rs.getString("name");
                tally.fullName = rs.getString("full_name");
                if (rs.getObject("pr_id") == null) {
                    return;
                }
                tally.totalPRs++;
                String state = rs.getString("state");
                if ("open".equals(state)) {
                    tally.openPRs++;
                } else if ("merged".equals(state)) {
                    tally.cycleHours.add(MetricsCalculator.hoursBetween(
                            Timestamps.fromDb(rs, "created_at"), Timestamps.fromDb(rs, "merged_at")));
                }
                tally.sizes.add((double) (rs.getInt("additions") + rs.getInt("deletions")));
                if (rs.getObject("category_id") != null) {
                    tally.categorizedPRs++;
                }
                String authorId = rs.getString("author_id");
                if (authorId != null) {
                    tally.authors.add(authorId);
                }
            }, Timestamps.toDb(windowStart), organizationId);

            List<RepositoryInsight> insights = new ArrayList<>();
            tallies.forEach((id, tally) -> insights.add(new RepositoryInsight(
                    id,
                    tally.name,
                    tally.fullName,
                    tally.totalPRs > 0,
                    tally.totalPRs,
                    tally.openPRs,
                    MetricsCalculator.averageOf(tally.cycleHours),
                    Math.round(tally.sizes.stream().mapToDouble(Double::doubleValue).average().orElse(0)),
                    tally.categorizedPRs,
                    MetricsCalculator.percentage(tally.categorizedPRs, tally.totalPRs),
                    tally.authors.size())));
            insights.sort(Comparator.comparingLong(RepositoryInsight::totalPRs).reversed()
                    .thenComparing(RepositoryInsight::fullName));
            logger.debug("Insights for {} tracked repositories of organization {}", insights.size(), organizationId);
            return List.copyOf(insights);
        });
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static String withRepositoryFilter(String sql, Long repositoryId) {
        return repositoryId != null ? sql + REPOSITORY_FILTER : sql;
    }

    private static String repositoriesFilter(List<Long> repositoryIds) {
        if (repositoryIds.isEmpty()) {
            return "";
        }
        return "  AND pr.repository_id IN (" + String.join(", ", Collections.nCopies(repositoryIds.size(), "?"))
                + ")\n";
    }

    private static Object[] windowArgs(long organizationId, Instant windowStart, List<Long> repositoryIds) {
        List<Object> args = new ArrayList<>();
        args.add(organizationId);
        args.add(Timestamps.toDb(windowStart));
        args.addAll(repositoryIds);
        return args.toArray();
    }

    private static Object[] rangeArgs(long organizationId, Instant start, Instant end, Long repositoryId) {
        if (repositoryId != null) {
            return new Object[]{organizationId, Timestamps.toDb(start), Timestamps.toDb(end), repositoryId};
        }
        return new Object[]{organizationId, Timestamps.toDb(start), Timestamps.toDb(end)};
    }

    private static LocalDate utcDate(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1, got " + value);
        }
    }

    private record SummaryCounts(
            long totalPRs,
            long recentPRs,
            long mergedPRs,
            long recentMerged,
            long thisWeekMerged,
            long lastWeekMerged,
            long categorizedPRs,
            long openPRs
    ) {}

    private static final class AuthorTally {
        private final String userId;
        private String name;
        private long prsCreated;
        private final List<Double> cycleHours = new ArrayList<>();
        private final List<Double> sizes = new ArrayList<>();

        private AuthorTally(String userId) {
            this.userId = userId;
        }
    }

    private static final class RepositoryTally {
        private String name;
        private String fullName;
        private long totalPRs;
        private long openPRs;
        private long categorizedPRs;
        private final List<Double> cycleHours = new ArrayList<>();
        private final List<Double> sizes = new ArrayList<>();
        private final Set<String> authors = new HashSet<>();
    }
}
