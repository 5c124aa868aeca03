package com.prpulse.pipeline.domain;

import java.time.Instant;

public record Review(
        long id,
        long externalId,
        long pullRequestId,
        String reviewerId,
        ReviewState state,
        Instant submittedAt
) {

    public Review withId(long newId) {
        return new Review(newId, externalId, pullRequestId, reviewerId, state, submittedAt);
    }
}
