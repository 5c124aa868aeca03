package com.prpulse.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The user object GitHub embeds in pull requests and reviews.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubUser(
        @JsonProperty("id") Long id,
        @JsonProperty("login") String login,
        @JsonProperty("avatar_url") String avatarUrl
) {}
