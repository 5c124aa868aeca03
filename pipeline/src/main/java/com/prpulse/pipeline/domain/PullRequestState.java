package com.prpulse.pipeline.domain;

import java.util.Locale;

public enum PullRequestState {
    OPEN,
    CLOSED,
    MERGED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PullRequestState fromDb(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    /**
     * GitHub reports merged pull requests as {@code closed}; a merge timestamp is
     * what tells them apart.
     */
    public static PullRequestState fromRemote(String remoteState, boolean hasMergedAt) {
        if (hasMergedAt) {
            return MERGED;
        }
        return "closed".equalsIgnoreCase(remoteState) ? CLOSED : OPEN;
    }
}
