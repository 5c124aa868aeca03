package com.prpulse.pipeline.reconcile;

import com.prpulse.pipeline.domain.Organization;
import com.prpulse.pipeline.domain.PullRequest;
import com.prpulse.pipeline.domain.PullRequestState;
import com.prpulse.pipeline.domain.Repository;
import com.prpulse.pipeline.domain.Review;
import com.prpulse.pipeline.domain.ReviewState;
import com.prpulse.pipeline.domain.User;
import com.prpulse.pipeline.model.GitHubOrganization;
import com.prpulse.pipeline.model.GitHubPullRequest;
import com.prpulse.pipeline.model.GitHubRepository;
import com.prpulse.pipeline.model.GitHubReview;
import com.prpulse.pipeline.model.GitHubUser;
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

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reconciler behavior against an in-memory store: idempotency, field ownership,
 * state invariants and placeholder users.
 */
class ReconcilerTest {

    private static final GitHubUser ALICE = new GitHubUser(501L, "alice", "https://avatars/501");
    private static final GitHubUser BOB = new GitHubUser(502L, "bob", null);

    private Database database;
    private RepositoryStore repositories;
    private PullRequestStore pullRequests;
    private ReviewStore reviews;
    private UserStore users;
    private Reconciler reconciler;

    private Repository repository;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        OrganizationStore organizations = new OrganizationStore(database.jdbc());
        repositories = new RepositoryStore(database.jdbc());
        pullRequests = new PullRequestStore(database.jdbc());
        reviews = new ReviewStore(database.jdbc());
        users = new UserStore(database.jdbc());
        reconciler = new Reconciler(organizations, repositories, pullRequests, reviews, users);

        Organization org = reconciler.upsertOrganization(
                new GitHubOrganization(1001L, "acme", "Acme Inc", null)).record();
        repository = reconciler.upsertRepository(org.id(),
                new GitHubRepository(2001L, "api", "acme/api", false)).record();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private static GitHubPullRequest mergedPr(long id, int number, String title) {
        return new GitHubPullRequest(id, number, title, "closed", ALICE,
                Instant.parse("2024-05-10T08:00:00Z"), Instant.parse("2024-05-10T13:00:00Z"),
                Instant.parse("2024-05-10T13:00:00Z"), Instant.parse("2024-05-10T13:00:00Z"),
                false, 120, 30, 4);
    }

    // =========================================================================
    // Organizations and repositories
    // =========================================================================

    @Test
    @DisplayName("Organization upsert is idempotent and updates changed names")
    void organization_idempotent() {
        GitHubOrganization remote = new GitHubOrganization(1001L, "acme", "Acme Inc", null);

        assertEquals(UpsertOutcome.UNCHANGED, reconciler.upsertOrganization(remote).outcome());

        UpsertResult<Organization> renamed = reconciler.upsertOrganization(
                new GitHubOrganization(1001L, "acme", "Acme Corporation", "https://avatars/acme"));
        assertEquals(UpsertOutcome.UPDATED, renamed.outcome());
        assertEquals("Acme Corporation", renamed.record().name());
    }

    @Test
    @DisplayName("New repositories are tracked and the tracking flag survives later syncs")
    void repository_trackingPreserved() {
        assertTrue(repository.tracked());
        repositories.setTracked(repository.id(), false);

        UpsertResult<Repository> result = reconciler.upsertRepository(repository.organizationId(),
                new GitHubRepository(2001L, "api-v2", "acme/api-v2", true));

        assertEquals(UpsertOutcome.UPDATED, result.outcome());
        Repository stored = repositories.findById(repository.id()).orElseThrow();
        assertEquals("acme/api-v2", stored.fullName());
        assertFalse(stored.tracked(), "is_tracked belongs to the settings path");
    }

    @Test
    @DisplayName("Repository without full name is rejected")
    void repository_invalid() {
        InvalidRecordException ex = assertThrows(InvalidRecordException.class,
                () -> reconciler.upsertRepository(repository.organizationId(),
                        new GitHubRepository(2002L, "web", null, false)));

        assertEquals(EntityKind.REPOSITORY, ex.kind());
    }

    // =========================================================================
    // Pull requests
    // =========================================================================

    @Test
    @DisplayName("Applying the same snapshot twice inserts once and then reports unchanged")
    void pullRequest_idempotent() {
        GitHubPullRequest remote = mergedPr(3001L, 1, "Add login endpoint");

        UpsertResult<PullRequest> first = reconciler.upsertPullRequest(repository.id(), remote);
        UpsertResult<PullRequest> second = reconciler.upsertPullRequest(repository.id(), remote);

        assertEquals(UpsertOutcome.INSERTED, first.outcome());
        assertEquals(UpsertOutcome.UNCHANGED, second.outcome());
        assertEquals(first.record().id(), second.record().id());
        assertEquals(1, pullRequests.findByRepository(repository.id()).size());
    }

    @Test
    @DisplayName("Title change updates sync fields but keeps category and processing status")
    void pullRequest_fieldPreservation() {
        PullRequest inserted = reconciler.upsertPullRequest(repository.id(),
                mergedPr(3001L, 1, "Add login endpoint")).record();
        long categoryId = new CategoryStore(database.jdbc())
                .insert(null, "Bug Fixes", "Fixing issues and bugs", "#F87171", true).id();
        pullRequests.assignCategory(inserted.id(), categoryId, 0.92);
        pullRequests.updateProcessingStatus(inserted.id(), "done", null);

        UpsertResult<PullRequest> result = reconciler.upsertPullRequest(repository.id(),
                mergedPr(3001L, 1, "Add login and logout endpoints"));

        assertEquals(UpsertOutcome.UPDATED, result.outcome());
        PullRequest stored = pullRequests.findById(inserted.id()).orElseThrow();
        assertEquals("Add login and logout endpoints", stored.title());
        assertEquals(categoryId, stored.categoryId());
        assertEquals(0.92, stored.categoryConfidence());
        assertEquals("done", stored.processingStatus());
    }

    @Test
    @DisplayName("Counters missing from a list payload keep their stored values")
    void pullRequest_countersKept() {
        reconciler.upsertPullRequest(repository.id(), mergedPr(3001L, 1, "Add login endpoint"));
        GitHubPullRequest withoutCounters = new GitHubPullRequest(3001L, 1, "Add login endpoint", "closed", ALICE,
                Instant.parse("2024-05-10T08:00:00Z"), Instant.parse("2024-05-10T13:00:00Z"),
                Instant.parse("2024-05-10T13:00:00Z"), Instant.parse("2024-05-10T13:00:00Z"),
                false, null, null, null);

        UpsertResult<PullRequest> result = reconciler.upsertPullRequest(repository.id(), withoutCounters);

        assertEquals(UpsertOutcome.UNCHANGED, result.outcome());
        assertEquals(120, result.record().additions());
    }

    @Test
    @DisplayName("Duplicate number under a new external id resolves to the existing row")
    void pullRequest_duplicateNumber() {
        PullRequest original = reconciler.upsertPullRequest(repository.id(),
                mergedPr(3001L, 1, "Add login endpoint")).record();

        UpsertResult<PullRequest> result = reconciler.upsertPullRequest(repository.id(),
                mergedPr(3999L, 1, "Same number, other id"));

        assertEquals(UpsertOutcome.UNCHANGED, result.outcome());
        assertEquals(original.id(), result.record().id());
        assertEquals(1, pullRequests.findByRepository(repository.id()).size());
    }

    @Test
    @DisplayName("State is derived from merged_at and timestamps follow the state")
    void pullRequest_stateInvariants() {
        PullRequest merged = reconciler.upsertPullRequest(repository.id(),
                new GitHubPullRequest(3001L, 1, "Merged", "closed", ALICE,
                        Instant.parse("2024-05-10T08:00:00Z"), null, null,
                        Instant.parse("2024-05-10T13:00:00Z"), false, null, null, null)).record();
        assertEquals(PullRequestState.MERGED, merged.state());
        assertEquals(merged.mergedAt(), merged.closedAt(), "Merged without closed_at closes at merge time");

        PullRequest open = reconciler.upsertPullRequest(repository.id(),
                new GitHubPullRequest(3002L, 2, "Open", "open", ALICE,
                        Instant.parse("2024-05-11T08:00:00Z"), null,
                        Instant.parse("2024-05-11T09:00:00Z"), null, true, null, null, null)).record();
        assertEquals(PullRequestState.OPEN, open.state());
        assertNull(open.closedAt());
        assertNull(open.mergedAt());
        assertTrue(open.draft());

        PullRequest closed = reconciler.upsertPullRequest(repository.id(),
                new GitHubPullRequest(3003L, 3, "Closed", "closed", null,
                        Instant.parse("2024-05-12T08:00:00Z"), Instant.parse("2024-05-12T10:00:00Z"),
                        Instant.parse("2024-05-12T10:00:00Z"), null, false, null, null, null)).record();
        assertEquals(PullRequestState.CLOSED, closed.state());
        assertNull(closed.mergedAt());
        assertNull(closed.authorId(), "Deleted accounts leave the author empty");
    }

    @Test
    @DisplayName("Pull request without a title is rejected")
    void pullRequest_invalid() {
        GitHubPullRequest remote = new GitHubPullRequest(3001L, 1, null, "open", ALICE,
                null, null, null, null, false, null, null, null);

        InvalidRecordException ex = assertThrows(InvalidRecordException.class,
                () -> reconciler.upsertPullRequest(repository.id(), remote));

        assertEquals(EntityKind.PULL_REQUEST, ex.kind());
    }

    // =========================================================================
    // Reviews and users
    // =========================================================================

    @Test
    @DisplayName("Unknown author and reviewer become placeholder users filled from the payload")
    void users_placeholders() {
        PullRequest pr = reconciler.upsertPullRequest(repository.id(), mergedPr(3001L, 1, "Add login")).record();
        reconciler.upsertReview(pr.id(), new GitHubReview(4001L, BOB, "APPROVED",
                Instant.parse("2024-05-10T12:00:00Z")));

        assertEquals("501", pr.authorId());
        User alice = users.findById("501").orElseThrow();
        assertEquals("alice", alice.name());
        assertEquals("https://avatars/501", alice.image());
        User bob = users.findById("502").orElseThrow();
        assertEquals("bob", bob.name());
        assertNull(bob.image());
        assertNull(bob.email());
    }

    @Test
    @DisplayName("Existing user names are never overwritten")
    void users_profileKept() {
        database.jdbc().update("INSERT INTO users (id, name, email) VALUES (?, ?, ?)",
                "501", "Alice Liddell", "alice@example.com");

        UpsertResult<User> result = reconciler.ensureUser(ALICE);

        assertEquals(UpsertOutcome.UPDATED, result.outcome(), "Only the missing avatar is filled");
        assertEquals("Alice Liddell", result.record().name());
        assertEquals("https://avatars/501", result.record().image());
        assertEquals(UpsertOutcome.UNCHANGED, reconciler.ensureUser(ALICE).outcome());
    }

    @Test
    @DisplayName("Review upsert maps states, skips pending reviews and is idempotent")
    void reviews_upsert() {
        PullRequest pr = reconciler.upsertPullRequest(repository.id(), mergedPr(3001L, 1, "Add login")).record();
        GitHubReview approved = new GitHubReview(4001L, BOB, "approved", Instant.parse("2024-05-10T12:00:00Z"));

        Optional<UpsertResult<Review>> first = reconciler.upsertReview(pr.id(), approved);
        Optional<UpsertResult<Review>> again = reconciler.upsertReview(pr.id(), approved);
        Optional<UpsertResult<Review>> pending = reconciler.upsertReview(pr.id(),
                new GitHubReview(4002L, BOB, "PENDING", null));

        assertEquals(UpsertOutcome.INSERTED, first.orElseThrow().outcome());
        assertEquals(ReviewState.APPROVED, first.orElseThrow().record().state());
        assertEquals(UpsertOutcome.UNCHANGED, again.orElseThrow().outcome());
        assertTrue(pending.isEmpty());
        assertEquals(1, reviews.findByPullRequest(pr.id()).size());
    }

    @Test
    @DisplayName("Dismissal of a stored review is an update")
    void reviews_stateChange() {
        PullRequest pr = reconciler.upsertPullRequest(repository.id(), mergedPr(3001L, 1, "Add login")).record();
        reconciler.upsertReview(pr.id(), new GitHubReview(4001L, BOB, "CHANGES_REQUESTED",
                Instant.parse("2024-05-10T12:00:00Z")));

        UpsertResult<Review> result = reconciler.upsertReview(pr.id(), new GitHubReview(4001L, BOB, "DISMISSED",
                Instant.parse("2024-05-10T12:00:00Z"))).orElseThrow();

        assertEquals(UpsertOutcome.UPDATED, result.outcome());
        assertEquals(ReviewState.DISMISSED, reviews.findByExternalId(4001L).orElseThrow().state());
    }

    @Test
    @DisplayName("Submitted review without timestamp is rejected")
    void reviews_invalid() {
        PullRequest pr = reconciler.upsertPullRequest(repository.id(), mergedPr(3001L, 1, "Add login")).record();

        assertThrows(InvalidRecordException.class,
                () -> reconciler.upsertReview(pr.id(), new GitHubReview(4001L, BOB, "COMMENTED", null)));
    }
}
