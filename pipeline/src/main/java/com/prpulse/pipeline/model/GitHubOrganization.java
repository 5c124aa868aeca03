package com.prpulse.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object representing a GitHub organization.
 * Maps from: /user/orgs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubOrganization(
        @JsonProperty("id") Long id,
        @JsonProperty("login") String login,
        @JsonProperty("name") String name,
        @JsonProperty("avatar_url") String avatarUrl
) {

    /**
     * /user/orgs carries no display name, so the login stands in for it.
     */
    public String displayName() {
        return name != null && !name.isBlank() ? name : login;
    }
}
