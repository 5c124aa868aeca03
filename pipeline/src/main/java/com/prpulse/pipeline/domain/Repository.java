package com.prpulse.pipeline.domain;

public record Repository(
        long id,
        long externalId,
        long organizationId,
        String name,
        String fullName,
        boolean isPrivate,
        boolean tracked
) {}
