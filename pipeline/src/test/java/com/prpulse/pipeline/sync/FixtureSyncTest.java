package com.prpulse.pipeline.sync;

import com.prpulse.pipeline.client.FailureKind;
import com.prpulse.pipeline.client.FixtureSourceClient;
import com.prpulse.pipeline.domain.Organization;
import com.prpulse.pipeline.domain.PullRequest;
import com.prpulse.pipeline.domain.PullRequestState;
import com.prpulse.pipeline.domain.Repository;
import com.prpulse.pipeline.metrics.JdbcMetricsService;
import com.prpulse.pipeline.metrics.MetricsSummary;
import com.prpulse.pipeline.reconcile.Reconciler;
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

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Discovery, organization sync and metrics wired together over the JSON fixtures.
 */
class FixtureSyncTest {

    private Database database;
    private OrganizationStore organizations;
    private RepositoryStore repositories;
    private PullRequestStore pullRequests;
    private ReviewStore reviews;
    private ExecutorService executor;
    private SyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        database = TestDatabase.create();
        organizations = new OrganizationStore(database.jdbc());
        repositories = new RepositoryStore(database.jdbc());
        pullRequests = new PullRequestStore(database.jdbc());
        reviews = new ReviewStore(database.jdbc());
        Reconciler reconciler = new Reconciler(organizations, repositories, pullRequests, reviews,
                new UserStore(database.jdbc()));

        Path root = Path.of(Objects.requireNonNull(getClass().getResource("/fixtures")).toURI());
        executor = Executors.newFixedThreadPool(2);
        orchestrator = new SyncOrchestrator(new FixtureSourceClient(root), reconciler, organizations,
                repositories, new StaticCredentialProvider(Map.of(), "fixture-token"),
                new RetryPolicy(2, Duration.ZERO, Duration.ZERO, d -> { }), executor, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        database.close();
    }

    @Test
    @DisplayName("Fixture organization syncs end to end and feeds the metrics")
    void fixtureEndToEnd() {
        SyncResult discovery = orchestrator.discoverOrganizations("user-token");
        assertEquals(SyncRunState.COMPLETED, discovery.status());
        Organization acme = organizations.findByExternalId(1001L).orElseThrow();
        organizations.setInstallationId(acme.id(), "1");

        SyncResult result = orchestrator.syncOrganization(acme.id(), SyncMode.FULL);

        // acme/web has no pull request fixture
        assertEquals(SyncRunState.COMPLETED_WITH_ERRORS, result.status());
        assertEquals(List.of("acme/api"), result.synced());
        assertEquals("acme/web", result.errors().get(0).resource());
        assertEquals(FailureKind.NOT_FOUND, result.errors().get(0).kind());

        Repository api = repositories.findByExternalId(2001L).orElseThrow();
        assertTrue(api.isPrivate());
        List<PullRequest> stored = pullRequests.findByRepository(api.id());
        assertEquals(2, stored.size());
        assertEquals(PullRequestState.MERGED, stored.get(0).state());
        assertEquals(PullRequestState.OPEN, stored.get(1).state());
        assertEquals(2, reviews.findByPullRequest(stored.get(0).id()).size(), "Pending review is skipped");

        Clock afterFixtures = Clock.fixed(Instant.parse("2024-05-25T00:00:00Z"), ZoneOffset.UTC);
        MetricsSummary summary = new JdbcMetricsService(database, afterFixtures).getSummary(acme.id(), 30);
        assertEquals(2, summary.totalPRs());
        assertEquals(5.0, summary.avgCycleTimeHours());
        assertEquals(2.0, summary.avgReviewTimeHours());
        assertEquals(150, summary.avgPRSize());
        assertEquals(2, summary.trackedRepositories());
    }
}
