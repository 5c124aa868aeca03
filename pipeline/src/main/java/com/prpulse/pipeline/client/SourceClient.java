package com.prpulse.pipeline.client;

import com.prpulse.pipeline.model.GitHubOrganization;
import com.prpulse.pipeline.model.GitHubPullRequest;
import com.prpulse.pipeline.model.GitHubRepository;
import com.prpulse.pipeline.model.GitHubReview;

/**
 * Read-only, page-at-a-time access to the remote source-control API.
 *
 * <p>Every call takes the credential to use and the cursor returned by the previous
 * page ({@code null} for the first page). Implementations hold no per-caller state
 * and must be safe to share between threads.</p>
 */
public interface SourceClient {

    Page<GitHubOrganization> listOrganizations(String token, String cursor) throws SourceException;

    Page<GitHubRepository> listRepositories(String token, String organizationLogin, String cursor)
            throws SourceException;

    /**
     * Pull requests in every state, most recently updated first.
     */
    Page<GitHubPullRequest> listPullRequests(String token, String repositoryFullName, String cursor)
            throws SourceException;

    Page<GitHubReview> listReviews(String token, String repositoryFullName, int number, String cursor)
            throws SourceException;
}
