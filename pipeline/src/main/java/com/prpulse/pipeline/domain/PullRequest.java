package com.prpulse.pipeline.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Local pull request record.
 *
 * <p>The first block of components is owned by sync and mirrors the remote source.
 * {@code categoryId}, {@code categoryConfidence}, {@code processingStatus} and
 * {@code processingError} belong to the categorization subsystem.</p>
 */
public record PullRequest(
        long id,
        long externalId,
        long repositoryId,
        int number,
        String title,
        String authorId,
        PullRequestState state,
        Instant createdAt,
        Instant updatedAt,
        Instant closedAt,
        Instant mergedAt,
        boolean draft,
        Integer additions,
        Integer deletions,
        Integer changedFiles,
        Long categoryId,
        Double categoryConfidence,
        String processingStatus,
        String processingError
) {

    public PullRequest withId(long newId) {
        return new PullRequest(newId, externalId, repositoryId, number, title, authorId, state,
                createdAt, updatedAt, closedAt, mergedAt, draft, additions, deletions, changedFiles,
                categoryId, categoryConfidence, processingStatus, processingError);
    }

    /**
     * Copies the sync-owned fields of {@code remote} onto this record, keeping
     * identity and everything owned by other subsystems.
     */
    public PullRequest withSyncFieldsOf(PullRequest remote) {
        return new PullRequest(id, externalId, repositoryId, remote.number, remote.title, remote.authorId,
                remote.state, remote.createdAt, remote.updatedAt, remote.closedAt, remote.mergedAt,
                remote.draft, remote.additions, remote.deletions, remote.changedFiles,
                categoryId, categoryConfidence, processingStatus, processingError);
    }

    public boolean sameSyncFieldsAs(PullRequest other) {
        return number == other.number
                && draft == other.draft
                && Objects.equals(title, other.title)
                && Objects.equals(authorId, other.authorId)
                && state == other.state
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(updatedAt, other.updatedAt)
                && Objects.equals(closedAt, other.closedAt)
                && Objects.equals(mergedAt, other.mergedAt)
                && Objects.equals(additions, other.additions)
                && Objects.equals(deletions, other.deletions)
                && Objects.equals(changedFiles, other.changedFiles);
    }
}
