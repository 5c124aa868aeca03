package com.prpulse.pipeline.sync;

import com.prpulse.pipeline.client.FailureKind;
import com.prpulse.pipeline.client.Page;
import com.prpulse.pipeline.client.SourceClient;
import com.prpulse.pipeline.client.SourceException;
import com.prpulse.pipeline.client.UnauthorizedException;
import com.prpulse.pipeline.domain.Organization;
import com.prpulse.pipeline.domain.PullRequest;
import com.prpulse.pipeline.domain.Repository;
import com.prpulse.pipeline.model.GitHubOrganization;
import com.prpulse.pipeline.model.GitHubPullRequest;
import com.prpulse.pipeline.model.GitHubRepository;
import com.prpulse.pipeline.model.GitHubReview;
import com.prpulse.pipeline.reconcile.InvalidRecordException;
import com.prpulse.pipeline.reconcile.Reconciler;
import com.prpulse.pipeline.reconcile.UpsertOutcome;
import com.prpulse.pipeline.reconcile.UpsertResult;
import com.prpulse.pipeline.store.OrganizationStore;
import com.prpulse.pipeline.store.RepositoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Drives organization and repository syncs: organization -> repositories ->
 * pull requests -> reviews.
 *
 * <p>Each entity upsert commits on its own, so a failure deep in a run keeps
 * earlier progress. Failures of one repository or pull request are recorded in
 * the result and never stop their siblings. Only an unknown target, a missing
 * authorization or a rejected credential ends the run as {@code FAILED}.</p>
 *
 * <p>Repositories of one organization are synced concurrently on the supplied
 * executor; within a repository, pages are fetched and applied in source order.</p>
 */
public class SyncOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    static final String MDC_RUN_ID = "runId";

    private final SourceClient client;
    private final Reconciler reconciler;
    private final OrganizationStore organizations;
    private final RepositoryStore repositories;
    private final CredentialProvider credentials;
    private final RetryPolicy retryPolicy;
    private final ExecutorService executor;
    private final Clock clock;

    public SyncOrchestrator(SourceClient client, Reconciler reconciler, OrganizationStore organizations,
                            RepositoryStore repositories, CredentialProvider credentials,
                            RetryPolicy retryPolicy, ExecutorService executor, Clock clock) {
        this.client = client;
        this.reconciler = reconciler;
        this.organizations = organizations;
        this.repositories = repositories;
        this.credentials = credentials;
        this.retryPolicy = retryPolicy;
        this.executor = executor;
        this.clock = clock;
    }

    // =========================================================================
    // Entry points
    // =========================================================================

    /**
     * Upserts every organization visible to a user token.
     */
    public SyncResult discoverOrganizations(String userToken) {
        SyncRun run = new SyncRun("discovery", clock);
        return withRunContext(run, () -> {
            run.start();
            if (userToken == null || userToken.isBlank()) {
                return failRun(run, "discovery", FailureKind.UNAUTHORIZED, "No user token supplied");
            }
            logger.info("Discovering organizations");

            String cursor = null;
            do {
                String pageCursor = cursor;
                Page<GitHubOrganization> page;
                try {
                    page = retryPolicy.execute("organizations",
                            () -> client.listOrganizations(userToken, pageCursor));
                } catch (UnauthorizedException e) {
                    return failRun(run, "organizations", e.kind(), e.getMessage());
                } catch (SourceException e) {
                    run.recordError("organizations", e.kind(), e.getMessage());
                    break;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return failRun(run, "organizations", FailureKind.TRANSIENT, "Interrupted");
                }

                for (GitHubOrganization remote : page.items()) {
                    String resource = remote.login() != null ? remote.login() : "organization:" + remote.id();
                    try {
                        run.record(reconciler.upsertOrganization(remote).outcome());
                        run.recordSynced(resource);
                    } catch (InvalidRecordException e) {
                        run.recordError(resource, FailureKind.VALIDATION, e.getMessage());
                    } catch (DataAccessException e) {
                        run.recordError(resource, FailureKind.STORE, e.getMessage());
                    }
                }
                cursor = page.nextCursor();
            } while (cursor != null);

            return finishRun(run);
        });
    }

    /**
     * Refreshes the organization's repository list, then syncs every tracked
     * repository concurrently.
     */
    public SyncResult syncOrganization(long organizationId, SyncMode mode) {
        SyncRun run = new SyncRun("organization:" + organizationId, clock);
        return withRunContext(run, () -> {
            run.start();

            Optional<Organization> found = organizations.findById(organizationId);
            if (found.isEmpty()) {
                return failRun(run, "organization:" + organizationId, FailureKind.NOT_FOUND,
                        "Unknown organization " + organizationId);
            }
            Organization organization = found.get();

            String token;
            try {
                token = credentials.tokenFor(organization);
            } catch (MissingAuthorizationException e) {
                return failRun(run, organization.login(), FailureKind.UNAUTHORIZED, e.getMessage());
            }

            logger.info("Starting {} sync of organization {}", mode, organization.login());
            syncRepositoryList(run, organization, token);
            if (run.isAborted()) {
                return finishRun(run);
            }

            List<Repository> tracked = repositories.findTrackedByOrganization(organization.id());
            logger.info("Syncing {} tracked repositories of {}", tracked.size(), organization.login());
            syncConcurrently(run, tracked, token, mode);

            return finishRun(run);
        });
    }

    /**
     * Syncs one repository's pull requests and reviews. Untracked repositories
     * complete immediately without ingesting anything.
     */
    public SyncResult syncRepository(long repositoryId, SyncMode mode) {
        SyncRun run = new SyncRun("repository:" + repositoryId, clock);
        return withRunContext(run, () -> {
            run.start();

            Optional<Repository> found = repositories.findById(repositoryId);
            if (found.isEmpty()) {
                return failRun(run, "repository:" + repositoryId, FailureKind.NOT_FOUND,
                        "Unknown repository " + repositoryId);
            }
            Repository repository = found.get();

            Optional<Organization> organization = organizations.findById(repository.organizationId());
            if (organization.isEmpty()) {
                return failRun(run, repository.fullName(), FailureKind.NOT_FOUND,
                        "Repository " + repository.fullName() + " has no organization");
            }

            String token;
            try {
                token = credentials.tokenFor(organization.get());
            } catch (MissingAuthorizationException e) {
                return failRun(run, organization.get().login(), FailureKind.UNAUTHORIZED, e.getMessage());
            }

            if (!repository.tracked()) {
                logger.info("Repository {} is not tracked; nothing to sync", repository.fullName());
                return finishRun(run);
            }

            logger.info("Starting {} sync of repository {}", mode, repository.fullName());
            syncOneRepository(run, repository, token, mode);
            return finishRun(run);
        });
    }

    /**
     * Entry point for "new events arrived" notifications, which identify the
     * repository by its source id. Always incremental.
     */
    public SyncResult syncRepositoryByExternalId(long externalId) {
        Optional<Repository> repository = repositories.findByExternalId(externalId);
        if (repository.isEmpty()) {
            SyncRun run = new SyncRun("repository-external:" + externalId, clock);
            return withRunContext(run, () -> {
                run.start();
                return failRun(run, "repository-external:" + externalId, FailureKind.NOT_FOUND,
                        "No local repository for external id " + externalId);
            });
        }
        return syncRepository(repository.get().id(), SyncMode.INCREMENTAL);
    }

    // =========================================================================
    // Repository list
    // =========================================================================

    private void syncRepositoryList(SyncRun run, Organization organization, String token) {
        String cursor = null;
        do {
            String pageCursor = cursor;
            Page<GitHubRepository> page;
            try {
                page = retryPolicy.execute(organization.login(),
                        () -> client.listRepositories(token, organization.login(), pageCursor));
            } catch (UnauthorizedException e) {
                run.abort(organization.login(), e.kind(), e.getMessage());
                return;
            } catch (SourceException e) {
                // Already-known repositories are still synced below.
                run.recordError(organization.login(), e.kind(), e.getMessage());
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.abort(organization.login(), FailureKind.TRANSIENT, "Interrupted");
                return;
            }

            for (GitHubRepository remote : page.items()) {
                String resource = remote.fullName() != null ? remote.fullName() : "repository:" + remote.id();
                try {
                    run.record(reconciler.upsertRepository(organization.id(), remote).outcome());
                } catch (InvalidRecordException e) {
                    run.recordError(resource, FailureKind.VALIDATION, e.getMessage());
                } catch (DataAccessException e) {
                    run.recordError(resource, FailureKind.STORE, e.getMessage());
                }
            }
            cursor = page.nextCursor();
        } while (cursor != null);
    }

    private void syncConcurrently(SyncRun run, List<Repository> tracked, String token, SyncMode mode) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (Repository repository : tracked) {
            futures.add(CompletableFuture.runAsync(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    syncOneRepository(run, repository, token, mode);
                } finally {
                    MDC.clear();
                }
            }, executor).exceptionally(failure -> {
                // Errors escaping the worker still end up in the result
                logger.error("Worker for {} failed", repository.fullName(), failure);
                run.recordError(repository.fullName(), FailureKind.INTERNAL, String.valueOf(failure));
                return null;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    // =========================================================================
    // Pull requests and reviews
    // =========================================================================

    /**
     * Never throws: every failure ends up in the run.
     */
    void syncOneRepository(SyncRun run, Repository repository, String token, SyncMode mode) {
        String resource = repository.fullName();
        long start = clock.millis();
        try {
            int processed = syncPullRequests(run, repository, token, mode);
            if (run.isAborted()) {
                return;
            }
            run.recordSynced(resource);
            logger.info("Synced {} pull requests of {} in {}ms", processed, resource, clock.millis() - start);
        } catch (UnauthorizedException e) {
            logger.error("Credential rejected while syncing {}", resource);
            run.abort(resource, e.kind(), e.getMessage());
        } catch (SourceException e) {
            logger.warn("Failed to sync {}: {}", resource, e.getMessage());
            run.recordError(resource, e.kind(), e.getMessage());
        } catch (DataAccessException e) {
            logger.error("Store failure while syncing {}", resource, e);
            run.recordError(resource, FailureKind.STORE, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure while syncing {}", resource, e);
            run.recordError(resource, FailureKind.INTERNAL, String.valueOf(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.abort(resource, FailureKind.TRANSIENT, "Interrupted");
        }
    }

    private int syncPullRequests(SyncRun run, Repository repository, String token, SyncMode mode)
            throws SourceException, InterruptedException {
        int processed = 0;
        String cursor = null;
        do {
            if (run.isAborted()) {
                return processed;
            }
            String pageCursor = cursor;
            Page<GitHubPullRequest> page = retryPolicy.execute(repository.fullName(),
                    () -> client.listPullRequests(token, repository.fullName(), pageCursor));

            for (GitHubPullRequest remote : page.items()) {
                String resource = repository.fullName() + "#" + remote.number();
                UpsertResult<PullRequest> result;
                try {
                    result = reconciler.upsertPullRequest(repository.id(), remote);
                } catch (InvalidRecordException e) {
                    run.recordError(resource, FailureKind.VALIDATION, e.getMessage());
                    continue;
                } catch (DataAccessException e) {
                    logger.warn("Could not store {}: {}", resource, e.getMessage());
                    run.recordError(resource, FailureKind.STORE, e.getMessage());
                    continue;
                }
                run.record(result.outcome());
                processed++;

                if (mode == SyncMode.INCREMENTAL && result.outcome() == UpsertOutcome.UNCHANGED) {
                    logger.debug("{} is up to date; stopping incremental sync of {}",
                            resource, repository.fullName());
                    return processed;
                }
                syncReviews(run, repository, token, result.record());
            }
            cursor = page.nextCursor();
        } while (cursor != null);
        return processed;
    }

    /**
     * Review failures are charged to the pull request, not the repository.
     * A rejected credential still propagates and aborts the run.
     */
    private void syncReviews(SyncRun run, Repository repository, String token, PullRequest pullRequest)
            throws UnauthorizedException, InterruptedException {
        String resource = repository.fullName() + "#" + pullRequest.number();
        String cursor = null;
        do {
            String pageCursor = cursor;
            Page<GitHubReview> page;
            try {
                page = retryPolicy.execute(resource,
                        () -> client.listReviews(token, repository.fullName(), pullRequest.number(), pageCursor));
            } catch (UnauthorizedException e) {
                throw e;
            } catch (SourceException e) {
                run.recordError(resource, e.kind(), e.getMessage());
                return;
            }

            for (GitHubReview remote : page.items()) {
                try {
                    reconciler.upsertReview(pullRequest.id(), remote)
                            .ifPresent(result -> run.record(result.outcome()));
                } catch (InvalidRecordException e) {
                    run.recordError(resource, FailureKind.VALIDATION, e.getMessage());
                } catch (DataAccessException e) {
                    logger.warn("Could not store review {} of {}: {}", remote.id(), resource, e.getMessage());
                    run.recordError(resource, FailureKind.STORE, e.getMessage());
                }
            }
            cursor = page.nextCursor();
        } while (cursor != null);
    }

    // =========================================================================
    // Run bookkeeping
    // =========================================================================

    private SyncResult withRunContext(SyncRun run, RunBody body) {
        MDC.put(MDC_RUN_ID, run.runId());
        try {
            return body.run();
        } catch (DataAccessException e) {
            // Store unreachable before any per-resource handling could apply.
            logger.error("Store failure during sync run {}", run.runId(), e);
            return failRun(run, "store", FailureKind.STORE, e.getMessage());
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    private SyncResult failRun(SyncRun run, String resource, FailureKind kind, String message) {
        logger.error("Sync run {} failed: {} [{}] {}", run.runId(), kind, resource, message);
        return run.fail(resource, kind, message);
    }

    private SyncResult finishRun(SyncRun run) {
        SyncResult result = run.finish();
        logSummary(result);
        return result;
    }

    private void logSummary(SyncResult result) {
        logger.info("=== Sync Summary ({}) ===", result.scope());
        logger.info("Status: {} in {}ms", result.status(), result.durationMs());
        logger.info("Synced: {} resources | new={}, updated={}, unchanged={}",
                result.synced().size(), result.newCount(), result.updatedCount(), result.unchangedCount());
        if (result.hasErrors()) {
            logger.warn("Sync completed with {} errors", result.errors().size());
            result.errors().forEach(error -> logger.warn("  FAILED: {} [{}] - {}",
                    error.resource(), error.kind(), error.message()));
        }
    }

    @FunctionalInterface
    private interface RunBody {
        SyncResult run();
    }
}
