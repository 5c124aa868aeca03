package com.prpulse.pipeline.domain;

/**
 * A person seen as author or reviewer. The id is the source's user id; every
 * other field may be {@code null} while the user is still a placeholder.
 */
public record User(
        String id,
        String name,
        String email,
        String image
) {}
