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
import com.prpulse.pipeline.store.OrganizationStore;
import com.prpulse.pipeline.store.PullRequestStore;
import com.prpulse.pipeline.store.RepositoryStore;
import com.prpulse.pipeline.store.ReviewStore;
import com.prpulse.pipeline.store.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps remote entities onto local records keyed by their external ids and
 * decides between insert, update and no-op.
 *
 * <p>Every call commits on its own. Only sync-owned columns are ever written:
 * tracking flags, category assignments and processing status are preserved.
 * A unique-key violation from a concurrent writer is resolved by re-reading the
 * winner's row and reporting it as unchanged.</p>
 */
public class Reconciler {

    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    private final OrganizationStore organizations;
    private final RepositoryStore repositories;
    private final PullRequestStore pullRequests;
    private final ReviewStore reviews;
    private final UserStore users;

    public Reconciler(OrganizationStore organizations, RepositoryStore repositories,
                      PullRequestStore pullRequests, ReviewStore reviews, UserStore users) {
        this.organizations = organizations;
        this.repositories = repositories;
        this.pullRequests = pullRequests;
        this.reviews = reviews;
        this.users = users;
    }

    // =========================================================================
    // Organizations and repositories
    // =========================================================================

    public UpsertResult<Organization> upsertOrganization(GitHubOrganization remote) {
        if (remote.id() == null) {
            throw new InvalidRecordException(EntityKind.ORGANIZATION, "missing id");
        }
        if (isBlank(remote.login())) {
            throw new InvalidRecordException(EntityKind.ORGANIZATION, "missing login for id " + remote.id());
        }

        Optional<Organization> existing = organizations.findByExternalId(remote.id());
        if (existing.isEmpty()) {
            try {
                Organization created = organizations.insert(
                        remote.id(), remote.login(), remote.displayName(), remote.avatarUrl());
                logger.debug("Inserted organization {} ({})", created.login(), created.externalId());
                return UpsertResult.inserted(created);
            } catch (DuplicateKeyException e) {
                return UpsertResult.unchanged(reread(organizations.findByExternalId(remote.id()),
                        EntityKind.ORGANIZATION, remote.id(), e));
            }
        }

        Organization current = existing.get();
        if (Objects.equals(current.login(), remote.login())
                && Objects.equals(current.name(), remote.displayName())
                && Objects.equals(current.avatarUrl(), remote.avatarUrl())) {
            return UpsertResult.unchanged(current);
        }
        organizations.updateSyncFields(current.id(), remote.login(), remote.displayName(), remote.avatarUrl());
        return UpsertResult.updated(new Organization(current.id(), current.externalId(), remote.login(),
                remote.displayName(), remote.avatarUrl(), current.installationId()));
    }

    /**
     * New repositories start out tracked: they were listed through the
     * organization's installation, which is what grants access to them.
     */
    public UpsertResult<Repository> upsertRepository(long organizationId, GitHubRepository remote) {
        if (remote.id() == null) {
            throw new InvalidRecordException(EntityKind.REPOSITORY, "missing id");
        }
        if (isBlank(remote.fullName()) || isBlank(remote.name())) {
            throw new InvalidRecordException(EntityKind.REPOSITORY, "missing name for id " + remote.id());
        }

        Optional<Repository> existing = repositories.findByExternalId(remote.id());
        if (existing.isEmpty()) {
            try {
                Repository created = repositories.insert(remote.id(), organizationId, remote.name(),
                        remote.fullName(), remote.isPrivate(), true);
                logger.debug("Inserted repository {}", created.fullName());
                return UpsertResult.inserted(created);
            } catch (DuplicateKeyException e) {
                return UpsertResult.unchanged(reread(repositories.findByExternalId(remote.id()),
                        EntityKind.REPOSITORY, remote.id(), e));
            }
        }

        Repository current = existing.get();
        if (current.organizationId() == organizationId
                && Objects.equals(current.name(), remote.name())
                && Objects.equals(current.fullName(), remote.fullName())
                && current.isPrivate() == remote.isPrivate()) {
            return UpsertResult.unchanged(current);
        }
        repositories.updateSyncFields(current.id(), organizationId, remote.name(), remote.fullName(),
                remote.isPrivate());
        return UpsertResult.updated(new Repository(current.id(), current.externalId(), organizationId,
                remote.name(), remote.fullName(), remote.isPrivate(), current.tracked()));
    }

    // =========================================================================
    // Pull requests and reviews
    // =========================================================================

    public UpsertResult<PullRequest> upsertPullRequest(long repositoryId, GitHubPullRequest remote) {
        PullRequest incoming = toPullRequest(repositoryId, remote);

        Optional<PullRequest> existing = pullRequests.findByExternalId(incoming.externalId());
        if (existing.isEmpty()) {
            try {
                PullRequest created = pullRequests.insert(incoming);
                logger.debug("Inserted pull request #{} in repository {}", created.number(), repositoryId);
                return UpsertResult.inserted(created);
            } catch (DuplicateKeyException e) {
                // Either the external id or (repository, number) was taken concurrently.
                Optional<PullRequest> winner = pullRequests.findByExternalId(incoming.externalId())
                        .or(() -> pullRequests.findByRepositoryAndNumber(repositoryId, incoming.number()));
                return UpsertResult.unchanged(reread(winner, EntityKind.PULL_REQUEST, incoming.externalId(), e));
            }
        }

        PullRequest current = existing.get();
        PullRequest merged = current.withSyncFieldsOf(keepKnownCounters(incoming, current));

        if (merged.sameSyncFieldsAs(current)) {
            return UpsertResult.unchanged(current);
        }
        pullRequests.updateSyncFields(merged);
        logger.debug("Updated pull request #{} in repository {}", merged.number(), merged.repositoryId());
        return UpsertResult.updated(merged);
    }

    /**
     * @return empty for reviews that have not been submitted yet ({@code PENDING})
     */
    public Optional<UpsertResult<Review>> upsertReview(long pullRequestId, GitHubReview remote) {
        if (remote.id() == null) {
            throw new InvalidRecordException(EntityKind.REVIEW, "missing id");
        }
        Optional<ReviewState> state = ReviewState.fromRemote(remote.state());
        if (state.isEmpty()) {
            logger.debug("Skipping pending review {}", remote.id());
            return Optional.empty();
        }
        if (remote.submittedAt() == null) {
            throw new InvalidRecordException(EntityKind.REVIEW, "missing submitted_at for review " + remote.id());
        }

        String reviewerId = resolveUser(remote.user());
        Review incoming = new Review(0, remote.id(), pullRequestId, reviewerId, state.get(), remote.submittedAt());

        Optional<Review> existing = reviews.findByExternalId(remote.id());
        if (existing.isEmpty()) {
            return Optional.of(UpsertResult.inserted(reviews.insert(incoming)));
        }

        Review current = existing.get();
        if (Objects.equals(current.reviewerId(), incoming.reviewerId())
                && current.state() == incoming.state()
                && Objects.equals(current.submittedAt(), incoming.submittedAt())) {
            return Optional.of(UpsertResult.unchanged(current));
        }
        Review updated = new Review(current.id(), current.externalId(), current.pullRequestId(),
                incoming.reviewerId(), incoming.state(), incoming.submittedAt());
        reviews.updateSyncFields(updated);
        return Optional.of(UpsertResult.updated(updated));
    }

    // =========================================================================
    // Users
    // =========================================================================

    /**
     * Makes sure a user row exists for {@code remote}, creating a placeholder if
     * needed, then fills name and avatar where the row still lacks them.
     */
    public UpsertResult<User> ensureUser(GitHubUser remote) {
        if (remote == null || remote.id() == null) {
            throw new InvalidRecordException(EntityKind.USER, "missing id");
        }
        String id = String.valueOf(remote.id());
        boolean created = users.insertPlaceholder(id);
        boolean filled = users.fillProfile(id, remote.login(), remote.avatarUrl());

        User user = users.findById(id)
                .orElseThrow(() -> new IllegalStateException("User " + id + " vanished after insert"));
        if (created) {
            return UpsertResult.inserted(user);
        }
        return filled ? UpsertResult.updated(user) : UpsertResult.unchanged(user);
    }

    // =========================================================================
    // Mapping
    // =========================================================================

    PullRequest toPullRequest(long repositoryId, GitHubPullRequest remote) {
        if (remote.id() == null) {
            throw new InvalidRecordException(EntityKind.PULL_REQUEST, "missing id");
        }
        if (remote.number() == null) {
            throw new InvalidRecordException(EntityKind.PULL_REQUEST, "missing number for id " + remote.id());
        }
        if (remote.title() == null) {
            throw new InvalidRecordException(EntityKind.PULL_REQUEST, "missing title for #" + remote.number());
        }

        PullRequestState state = PullRequestState.fromRemote(remote.state(), remote.mergedAt() != null);
        Instant mergedAt = state == PullRequestState.MERGED ? remote.mergedAt() : null;
        Instant closedAt = null;
        if (state == PullRequestState.MERGED) {
            closedAt = firstNonNull(remote.closedAt(), remote.mergedAt());
        } else if (state == PullRequestState.CLOSED) {
            closedAt = firstNonNull(remote.closedAt(), remote.updatedAt());
            if (closedAt == null) {
                throw new InvalidRecordException(EntityKind.PULL_REQUEST,
                        "closed #" + remote.number() + " carries no closing time");
            }
        }

        return new PullRequest(0, remote.id(), repositoryId, remote.number(), remote.title(),
                resolveUser(remote.user()), state, remote.createdAt(), remote.updatedAt(), closedAt, mergedAt,
                Boolean.TRUE.equals(remote.draft()), remote.additions(), remote.deletions(), remote.changedFiles(),
                null, null, null, null);
    }

    /**
     * List payloads omit the diff counters; a missing counter keeps the stored value.
     */
    private static PullRequest keepKnownCounters(PullRequest incoming, PullRequest current) {
        return new PullRequest(0, incoming.externalId(), incoming.repositoryId(), incoming.number(),
                incoming.title(), incoming.authorId(), incoming.state(), incoming.createdAt(),
                incoming.updatedAt(), incoming.closedAt(), incoming.mergedAt(), incoming.draft(),
                firstNonNull(incoming.additions(), current.additions()),
                firstNonNull(incoming.deletions(), current.deletions()),
                firstNonNull(incoming.changedFiles(), current.changedFiles()),
                null, null, null, null);
    }

    /**
     * Deleted GitHub accounts come back as {@code null} users; those references stay empty.
     */
    private String resolveUser(GitHubUser remote) {
        if (remote == null || remote.id() == null) {
            return null;
        }
        return ensureUser(remote).record().id();
    }

    private static <T> T reread(Optional<T> winner, EntityKind kind, long externalId, DuplicateKeyException cause) {
        logger.debug("Concurrent insert of {} {}; using the stored row", kind, externalId);
        return winner.orElseThrow(() -> cause);
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
