package com.prpulse.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Data transfer object representing a GitHub pull request.
 * Maps from: /repos/{owner}/{repo}/pulls?state=all
 *
 * <p>The list endpoint omits the diff counters, so {@code additions},
 * {@code deletions} and {@code changedFiles} are frequently {@code null}.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubPullRequest(
        @JsonProperty("id") Long id,
        @JsonProperty("number") Integer number,
        @JsonProperty("title") String title,
        @JsonProperty("state") String state,
        @JsonProperty("user") GitHubUser user,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("closed_at") Instant closedAt,
        @JsonProperty("merged_at") Instant mergedAt,
        @JsonProperty("draft") Boolean draft,
        @JsonProperty("additions") Integer additions,
        @JsonProperty("deletions") Integer deletions,
        @JsonProperty("changed_files") Integer changedFiles
) {}
