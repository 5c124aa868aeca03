package com.prpulse.pipeline.domain;

/**
 * A pull request category. Defaults have no owning organization and are shared.
 */
public record Category(
        long id,
        Long organizationId,
        String name,
        String description,
        String color,
        boolean isDefault
) {}
