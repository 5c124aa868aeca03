package com.prpulse.pipeline.domain;

/**
 * A source-control organization. {@code installationId} is the authorization
 * handle used to obtain a sync credential; it is {@code null} until linked.
 */
public record Organization(
        long id,
        long externalId,
        String login,
        String name,
        String avatarUrl,
        String installationId
) {}
