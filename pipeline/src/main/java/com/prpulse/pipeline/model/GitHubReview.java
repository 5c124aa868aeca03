package com.prpulse.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Data transfer object representing a GitHub pull request review.
 * Maps from: /repos/{owner}/{repo}/pulls/{number}/reviews
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubReview(
        @JsonProperty("id") Long id,
        @JsonProperty("user") GitHubUser user,
        @JsonProperty("state") String state,
        @JsonProperty("submitted_at") Instant submittedAt
) {}
