package com.prpulse.pipeline.domain;

import java.util.Locale;
import java.util.Optional;

public enum ReviewState {
    APPROVED,
    CHANGES_REQUESTED,
    COMMENTED,
    DISMISSED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReviewState fromDb(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    /**
     * Maps a remote review state. {@code PENDING} reviews have not been submitted
     * and yield empty; anything unrecognised is treated as a comment.
     */
    public static Optional<ReviewState> fromRemote(String remoteState) {
        if (remoteState == null) {
            return Optional.of(COMMENTED);
        }
        String normalized = remoteState.trim().toUpperCase(Locale.ROOT);
        if ("PENDING".equals(normalized)) {
            return Optional.empty();
        }
        for (ReviewState state : values()) {
            if (state.name().equals(normalized)) {
                return Optional.of(state);
            }
        }
        return Optional.of(COMMENTED);
    }
}
