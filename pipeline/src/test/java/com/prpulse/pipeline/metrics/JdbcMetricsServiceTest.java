package com.prpulse.pipeline.metrics;

import com.prpulse.pipeline.domain.Organization;
import com.prpulse.pipeline.domain.PullRequest;
import com.prpulse.pipeline.domain.PullRequestState;
import com.prpulse.pipeline.domain.Repository;
import com.prpulse.pipeline.domain.Review;
import com.prpulse.pipeline.domain.ReviewState;
import com.prpulse.pipeline.store.CategoryStore;
import com.prpulse.pipeline.store.Database;
import com.prpulse.pipeline.store.OrganizationStore;
import com.prpulse.pipeline.store.PullRequestStore;
import com.prpulse.pipeline.store.RepositoryStore;
import com.prpulse.pipeline.store.ReviewStore;
import com.prpulse.pipeline.store.TestDatabase;
import com.prpulse.pipeline.store.UserStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Metrics computed over an in-memory store with a fixed clock.
 */
class JdbcMetricsServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private Database database;
    private PullRequestStore pullRequests;
    private ReviewStore reviews;
    private UserStore users;
    private CategoryStore categories;
    private JdbcMetricsService metrics;

    private Organization acme;
    private Repository api;
    private long nextExternalId = 10_000;
    private int nextNumber = 1;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        OrganizationStore organizations = new OrganizationStore(database.jdbc());
        pullRequests = new PullRequestStore(database.jdbc());
        reviews = new ReviewStore(database.jdbc());
        users = new UserStore(database.jdbc());
        categories = new CategoryStore(database.jdbc());
        metrics = new JdbcMetricsService(database, Clock.fixed(NOW, ZoneOffset.UTC));

        acme = organizations.insert(1001L, "acme", "Acme Inc", null);
        api = new RepositoryStore(database.jdbc()).insert(2001L, acme.id(), "api", "acme/api", false, true);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private static Instant daysAgo(double days) {
        return NOW.minus(Duration.ofMinutes(Math.round(days * 24 * 60)));
    }

    private String user(String id, String name) {
        users.insertPlaceholder(id);
        users.fillProfile(id, name, null);
        return id;
    }

    private PullRequest pr(long repositoryId, String authorId, Instant createdAt, Instant mergedAt) {
        PullRequestState state = mergedAt != null ? PullRequestState.MERGED : PullRequestState.OPEN;
        return pullRequests.insert(new PullRequest(0, nextExternalId++, repositoryId, nextNumber++, "PR", authorId,
                state, createdAt, createdAt, mergedAt, mergedAt, false, 10, 5, 1, null, null, null, null));
    }

    private void review(PullRequest pr, String reviewerId, Instant submittedAt) {
        reviews.insert(new Review(0, nextExternalId++, pr.id(), reviewerId, ReviewState.APPROVED, submittedAt));
    }

    // =========================================================================
    // Summary
    // =========================================================================

    @Test
    @DisplayName("Organization without pull requests yields zeros, never nulls")
    void summary_zeroDefaults() {
        MetricsSummary summary = metrics.getSummary(acme.id(), 30);

        assertEquals(0, summary.totalPRs());
        assertEquals(0.0, summary.mergeRate());
        assertEquals(0.0, summary.categorizationRate());
        assertEquals(0.0, summary.weeklyPRVolumeChange());
        assertEquals(0.0, summary.avgCycleTimeHours());
        assertEquals(0.0, summary.avgReviewTimeHours());
        assertEquals(0, summary.avgPRSize());
        assertEquals(1, summary.trackedRepositories());
        assertEquals(NOW, summary.generatedAt());
    }

    @Test
    @DisplayName("Tracking does not gate metrics: 10 tracked + 5 untracked merged PRs all count")
    void summary_trackingDoesNotGate() {
        Repository web = new RepositoryStore(database.jdbc())
                .insert(2002L, acme.id(), "web", "acme/web", false, false);
        for (int i = 0; i < 10; i++) {
            pr(api.id(), null, daysAgo(3), daysAgo(2));
        }
        for (int i = 0; i < 5; i++) {
            pr(web.id(), null, daysAgo(3), daysAgo(2));
        }

        MetricsSummary summary = metrics.getSummary(acme.id(), 30);

        assertEquals(15, summary.totalPRs());
        assertEquals(15, summary.mergedPRs());
        assertEquals(15, summary.recentMerged());
        assertEquals(1, summary.trackedRepositories());
        assertEquals(100.0, summary.mergeRate());
        assertEquals(15, summary.avgPRSize());
    }

    @Test
    @DisplayName("Created at T, first review at T+2h, merged at T+5h gives 5.0 and 2.0 hours")
    void summary_cycleAndReviewTime() {
        Instant t = daysAgo(2);
        String bob = user("502", "bob");
        PullRequest pr = pr(api.id(), null, t, t.plus(Duration.ofHours(5)));
        review(pr, bob, t.plus(Duration.ofHours(4)));
        review(pr, bob, t.plus(Duration.ofHours(2)));

        MetricsSummary summary = metrics.getSummary(acme.id(), 30);

        assertEquals(5.0, summary.avgCycleTimeHours());
        assertEquals(2.0, summary.avgReviewTimeHours());
    }

    @Test
    @DisplayName("Merged PR without created_at is counted but excluded from cycle time")
    void summary_nullCreatedAtExcluded() {
        Instant t = daysAgo(2);
        pr(api.id(), null, t, t.plus(Duration.ofHours(4)));
        pr(api.id(), null, null, t.plus(Duration.ofHours(1)));

        MetricsSummary summary = metrics.getSummary(acme.id(), 30);

        assertEquals(2, summary.mergedPRs());
        assertEquals(4.0, summary.avgCycleTimeHours());
    }

    @Test
    @DisplayName("Windows: recent counts, weekly change, categorization and open PRs")
    void summary_windows() {
        long bugs = categories.insert(null, "Bug Fixes", null, "#F87171", true).id();
        pr(api.id(), null, daysAgo(2), daysAgo(1));
        pr(api.id(), null, daysAgo(5), daysAgo(3));
        PullRequest categorized = pr(api.id(), null, daysAgo(12), daysAgo(10));
        pullRequests.assignCategory(categorized.id(), bugs, 0.9);
        pr(api.id(), null, daysAgo(20), null);
        pr(api.id(), null, daysAgo(60), daysAgo(59));

        MetricsSummary summary = metrics.getSummary(acme.id(), 30);

        assertEquals(5, summary.totalPRs());
        assertEquals(4, summary.recentPRs());
        assertEquals(4, summary.mergedPRs());
        assertEquals(3, summary.recentMerged());
        assertEquals(2, summary.thisWeekMerged());
        assertEquals(1, summary.lastWeekMerged());
        assertEquals(100.0, summary.weeklyPRVolumeChange());
        assertEquals(25.0, summary.categorizationRate());
        assertEquals(75.0, summary.mergeRate());
        assertEquals(1, summary.openPRCount());
    }

    @Test
    @DisplayName("Other organizations' pull requests are not counted")
    void summary_scopedToOrganization() {
        Organization globex = new OrganizationStore(database.jdbc()).insert(1002L, "globex", "Globex", null);
        Repository other = new RepositoryStore(database.jdbc())
                .insert(2009L, globex.id(), "core", "globex/core", false, true);
        pr(other.id(), null, daysAgo(1), null);

        assertEquals(0, metrics.getSummary(acme.id(), 30).totalPRs());
        assertEquals(1, metrics.getSummary(globex.id(), 30).totalPRs());
    }

    @Test
    @DisplayName("Window below one day is rejected")
    void summary_invalidWindow() {
        assertThrows(IllegalArgumentException.class, () -> metrics.getSummary(acme.id(), 0));
    }

    // =========================================================================
    // Time series
    // =========================================================================

    @Test
    @DisplayName("Seven days always yield seven contiguous points with every category key")
    void timeSeries_contiguous() {
        long bugs = categories.insert(null, "Bug Fixes", null, "#F87171", true).id();
        categories.insert(acme.id(), "Tech  Debt", null, "#FBBF24", false);
        PullRequest fix = pr(api.id(), null, Instant.parse("2024-06-10T09:00:00Z"), null);
        pullRequests.assignCategory(fix.id(), bugs, 0.8);
        pr(api.id(), null, Instant.parse("2024-06-10T17:00:00Z"), null);
        pr(api.id(), null, Instant.parse("2024-06-14T06:00:00Z"), Instant.parse("2024-06-15T06:00:00Z"));
        pr(api.id(), null, Instant.parse("2024-06-01T06:00:00Z"), null);

        TimeSeries series = metrics.getTimeSeries(acme.id(), 7, null);

        assertEquals(7, series.points().size());
        for (int i = 0; i < 7; i++) {
            assertEquals(LocalDate.of(2024, 6, 9).plusDays(i), series.points().get(i).date());
        }
        assertEquals(List.of("Bug_Fixes", "Tech_Debt", MetricsCalculator.UNCATEGORIZED),
                series.categories().stream().map(CategorySeries::key).toList());

        TimeSeriesPoint june10 = series.points().get(1);
        assertEquals(2, june10.prCount());
        assertEquals(Map.of("Bug_Fixes", 1L, "Tech_Debt", 0L, MetricsCalculator.UNCATEGORIZED, 1L),
                june10.categoryCounts());

        TimeSeriesPoint june12 = series.points().get(3);
        assertEquals(0, june12.prCount());
        assertEquals(Map.of("Bug_Fixes", 0L, "Tech_Debt", 0L, MetricsCalculator.UNCATEGORIZED, 0L),
                june12.categoryCounts());

        TimeSeriesPoint today = series.points().get(6);
        assertEquals(0, today.prCount());
        assertEquals(1, today.mergedCount());
        assertEquals(24.0, today.avgCycleTimeHours());
    }

    @Test
    @DisplayName("Repository filter restricts the series")
    void timeSeries_repositoryFilter() {
        Repository web = new RepositoryStore(database.jdbc())
                .insert(2002L, acme.id(), "web", "acme/web", false, true);
        pr(api.id(), null, daysAgo(1), null);
        pr(web.id(), null, daysAgo(1), null);
        pr(web.id(), null, daysAgo(1), null);

        long all = metrics.getTimeSeries(acme.id(), 3, null).points().stream()
                .mapToLong(TimeSeriesPoint::prCount).sum();
        long webOnly = metrics.getTimeSeries(acme.id(), 3, web.id()).points().stream()
                .mapToLong(TimeSeriesPoint::prCount).sum();

        assertEquals(3, all);
        assertEquals(2, webOnly);
    }

    @Test
    @DisplayName("Day count below one is rejected")
    void timeSeries_invalidDays() {
        assertThrows(IllegalArgumentException.class, () -> metrics.getTimeSeries(acme.id(), 0, null));
    }

    // =========================================================================
    // Team performance and category distribution
    // =========================================================================

    @Test
    @DisplayName("Contributors are ranked by score; self-reviews do not count")
    void team_ranking() {
        String alice = user("501", "alice");
        String bob = user("502", "bob");
        users.insertPlaceholder("503");
        PullRequest a1 = pr(api.id(), alice, daysAgo(5), daysAgo(5).plus(Duration.ofHours(6)));
        PullRequest a2 = pr(api.id(), alice, daysAgo(4), daysAgo(4).plus(Duration.ofHours(2)));
        PullRequest a3 = pr(api.id(), alice, daysAgo(3), null);
        PullRequest b1 = pr(api.id(), bob, daysAgo(3), null);
        pr(api.id(), "503", daysAgo(2), null);
        review(a1, bob, daysAgo(5).plus(Duration.ofHours(1)));
        review(a2, bob, daysAgo(4).plus(Duration.ofHours(1)));
        review(a3, alice, daysAgo(3).plus(Duration.ofHours(1)));
        review(b1, alice, daysAgo(3).plus(Duration.ofHours(1)));

        TeamPerformance team = metrics.getTeamPerformance(acme.id(), 30, 2);

        assertEquals(3, team.totalContributors());
        assertEquals(2, team.contributors().size());

        ContributorStats first = team.contributors().get(0);
        assertEquals("501", first.userId());
        assertEquals("alice", first.name());
        assertEquals(3, first.prsCreated());
        assertEquals(1, first.reviewsGiven());
        assertEquals(10, first.contributionScore());
        assertEquals(4.0, first.avgCycleTimeHours());
        assertEquals(33.3, first.reviewThoroughness());
        assertEquals(15, first.avgPRSize());

        ContributorStats second = team.contributors().get(1);
        assertEquals("502", second.userId());
        assertEquals(2, second.reviewsGiven());
        assertEquals(5, second.contributionScore());
        assertEquals(200.0, second.reviewThoroughness());

        assertEquals(0.6, team.collaborationIndex());
        assertEquals(80.0, team.reviewCoverage());
        assertEquals(4.0, team.avgTeamCycleTimeHours());
    }

    @Test
    @DisplayName("Placeholder contributors are listed under their id")
    void team_placeholderName() {
        users.insertPlaceholder("503");
        pr(api.id(), "503", daysAgo(2), null);

        TeamPerformance team = metrics.getTeamPerformance(acme.id(), 30, 10);

        assertEquals("503", team.contributors().get(0).name());
    }

    @Test
    @DisplayName("Repository filter narrows contributors, reviews and coverage")
    void team_repositoryFilter() {
        Repository web = new RepositoryStore(database.jdbc())
                .insert(2002L, acme.id(), "web", "acme/web", false, true);
        String alice = user("501", "alice");
        String bob = user("502", "bob");
        PullRequest a1 = pr(api.id(), alice, daysAgo(4), null);
        pr(api.id(), alice, daysAgo(3), null);
        PullRequest b1 = pr(web.id(), bob, daysAgo(3), null);
        review(a1, bob, daysAgo(3));
        review(b1, alice, daysAgo(2));

        TeamPerformance all = metrics.getTeamPerformance(acme.id(), 30, 10);
        TeamPerformance webOnly = metrics.getTeamPerformance(acme.id(), 30, 10, List.of(web.id()));

        assertEquals(2, all.totalContributors());
        assertEquals(1, webOnly.totalContributors());
        ContributorStats only = webOnly.contributors().get(0);
        assertEquals("502", only.userId());
        assertEquals(1, only.prsCreated());
        assertEquals(0, only.reviewsGiven());
        assertEquals(100.0, webOnly.reviewCoverage());
        assertEquals(0.0, webOnly.collaborationIndex());
    }

    @Test
    @DisplayName("Category distribution counts window PRs per category, busiest first")
    void categoryDistribution() {
        long bugs = categories.insert(null, "Bug Fixes", null, "#F87171", true).id();
        long features = categories.insert(null, "New Features", null, "#60A5FA", true).id();
        for (int i = 0; i < 3; i++) {
            pullRequests.assignCategory(pr(api.id(), null, daysAgo(2), null).id(), bugs, 0.9);
        }
        pullRequests.assignCategory(pr(api.id(), null, daysAgo(2), null).id(), features, 0.7);
        pr(api.id(), null, daysAgo(2), null);
        pullRequests.assignCategory(pr(api.id(), null, daysAgo(90), null).id(), features, 0.7);

        List<CategoryShare> shares = metrics.getCategoryDistribution(acme.id(), 30);

        assertEquals(List.of("Bug Fixes", "New Features", MetricsCalculator.UNCATEGORIZED),
                shares.stream().map(CategoryShare::name).toList());
        assertEquals(3, shares.get(0).count());
        assertEquals(60.0, shares.get(0).percentage());
        assertEquals("#F87171", shares.get(0).color());
        assertEquals(20.0, shares.get(2).percentage());
        assertEquals(JdbcMetricsService.UNCATEGORIZED_COLOR, shares.get(2).color());
    }

    // =========================================================================
    // Repository insights
    // =========================================================================

    @Test
    @DisplayName("Insights cover tracked repositories only, busiest first, counting the window")
    void repositoryInsights() {
        RepositoryStore repositories = new RepositoryStore(database.jdbc());
        Repository web = repositories.insert(2002L, acme.id(), "web", "acme/web", false, true);
        Repository legacy = repositories.insert(2003L, acme.id(), "legacy", "acme/legacy", false, false);
        long bugs = categories.insert(null, "Bug Fixes", null, "#F87171", true).id();
        String alice = user("501", "alice");
        String bob = user("502", "bob");

        pr(api.id(), alice, daysAgo(5), daysAgo(5).plus(Duration.ofHours(4)));
        pullRequests.assignCategory(pr(api.id(), bob, daysAgo(3), null).id(), bugs, 0.8);
        pr(api.id(), alice, daysAgo(100), null);
        pr(web.id(), bob, daysAgo(120), null);
        pr(legacy.id(), bob, daysAgo(2), null);

        List<RepositoryInsight> insights = metrics.getRepositoryInsights(acme.id(), 90);

        assertEquals(List.of("acme/api", "acme/web"), insights.stream().map(RepositoryInsight::fullName).toList());

        RepositoryInsight apiInsight = insights.get(0);
        assertTrue(apiInsight.hasData());
        assertEquals(2, apiInsight.totalPRs());
        assertEquals(1, apiInsight.openPRs());
        assertEquals(4.0, apiInsight.avgCycleTimeHours());
        assertEquals(15, apiInsight.avgPRSize());
        assertEquals(1, apiInsight.categorizedPRs());
        assertEquals(50.0, apiInsight.categorizationRate());
        assertEquals(2, apiInsight.contributorCount());

        RepositoryInsight webInsight = insights.get(1);
        assertFalse(webInsight.hasData());
        assertEquals(0, webInsight.totalPRs());
        assertEquals(0, webInsight.contributorCount());
        assertEquals(0.0, webInsight.avgCycleTimeHours());
    }

    @Test
    @DisplayName("Organization without tracked repositories has no insights")
    void repositoryInsights_empty() {
        new RepositoryStore(database.jdbc()).setTracked(api.id(), false);

        assertTrue(metrics.getRepositoryInsights(acme.id(), 90).isEmpty());
    }
}
