package com.prpulse.pipeline.store;

import com.prpulse.pipeline.domain.PullRequest;
import com.prpulse.pipeline.domain.PullRequestState;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class PullRequestStore {

    private static final String COLUMNS = "id, external_id, repository_id, number, title, author_id, state, "
            + "created_at, updated_at, closed_at, merged_at, draft, additions, deletions, changed_files, "
            + "category_id, category_confidence, processing_status, processing_error";

    private static final RowMapper<PullRequest> ROW_MAPPER = (rs, rowNum) -> new PullRequest(
            rs.getLong("id"),
            rs.getLong("external_id"),
            rs.getLong("repository_id"),
            rs.getInt("number"),
            rs.getString("title"),
            rs.getString("author_id"),
            PullRequestState.fromDb(rs.getString("state")),
            Timestamps.fromDb(rs, "created_at"),
            Timestamps.fromDb(rs, "updated_at"),
            Timestamps.fromDb(rs, "closed_at"),
            Timestamps.fromDb(rs, "merged_at"),
            rs.getBoolean("draft"),
            rs.getObject("additions", Integer.class),
            rs.getObject("deletions", Integer.class),
            rs.getObject("changed_files", Integer.class),
            rs.getObject("category_id", Long.class),
            rs.getObject("category_confidence", Double.class),
            rs.getString("processing_status"),
            rs.getString("processing_error"));

    private final JdbcTemplate jdbc;

    public PullRequestStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<PullRequest> findById(long id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM pull_requests WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public Optional<PullRequest> findByExternalId(long externalId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM pull_requests WHERE external_id = ?", ROW_MAPPER, externalId)
                .stream().findFirst();
    }

    public Optional<PullRequest> findByRepositoryAndNumber(long repositoryId, int number) {
        return jdbc.query("SELECT " + COLUMNS + " FROM pull_requests WHERE repository_id = ? AND number = ?",
                ROW_MAPPER, repositoryId, number).stream().findFirst();
    }

    public List<PullRequest> findByRepository(long repositoryId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM pull_requests WHERE repository_id = ? ORDER BY number",
                ROW_MAPPER, repositoryId);
    }

    /**
     * Inserts the sync-owned columns of {@code pr}; the categorization columns start empty.
     *
     * @throws org.springframework.dao.DuplicateKeyException on a repeated external id
     *         or a repeated number within the repository
     */
    public PullRequest insert(PullRequest pr) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO pull_requests (external_id, repository_id, number, title, author_id, state, "
                            + "created_at, updated_at, closed_at, merged_at, draft, additions, deletions, changed_files) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    new String[]{"id"});
            ps.setLong(1, pr.externalId());
            ps.setLong(2, pr.repositoryId());
            ps.setInt(3, pr.number());
            ps.setString(4, pr.title());
            ps.setString(5, pr.authorId());
            ps.setString(6, pr.state().dbValue());
            ps.setObject(7, Timestamps.toDb(pr.createdAt()));
            ps.setObject(8, Timestamps.toDb(pr.updatedAt()));
            ps.setObject(9, Timestamps.toDb(pr.closedAt()));
            ps.setObject(10, Timestamps.toDb(pr.mergedAt()));
            ps.setBoolean(11, pr.draft());
            setNullableInt(ps, 12, pr.additions());
            setNullableInt(ps, 13, pr.deletions());
            setNullableInt(ps, 14, pr.changedFiles());
            return ps;
        }, keys);
        long id = Objects.requireNonNull(keys.getKey(), "generated id").longValue();
        return new PullRequest(id, pr.externalId(), pr.repositoryId(), pr.number(), pr.title(), pr.authorId(),
                pr.state(), pr.createdAt(), pr.updatedAt(), pr.closedAt(), pr.mergedAt(), pr.draft(),
                pr.additions(), pr.deletions(), pr.changedFiles(), null, null, null, null);
    }

    /**
     * Writes the sync-owned columns of {@code pr} to the row with its id.
     * Category and processing columns are never part of this statement.
     */
    public void updateSyncFields(PullRequest pr) {
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                    "UPDATE pull_requests SET number = ?, title = ?, author_id = ?, state = ?, created_at = ?, "
                            + "updated_at = ?, closed_at = ?, merged_at = ?, draft = ?, additions = ?, "
                            + "deletions = ?, changed_files = ? WHERE id = ?");
            ps.setInt(1, pr.number());
            ps.setString(2, pr.title());
            ps.setString(3, pr.authorId());
            ps.setString(4, pr.state().dbValue());
            ps.setObject(5, Timestamps.toDb(pr.createdAt()));
            ps.setObject(6, Timestamps.toDb(pr.updatedAt()));
            ps.setObject(7, Timestamps.toDb(pr.closedAt()));
            ps.setObject(8, Timestamps.toDb(pr.mergedAt()));
            ps.setBoolean(9, pr.draft());
            setNullableInt(ps, 10, pr.additions());
            setNullableInt(ps, 11, pr.deletions());
            setNullableInt(ps, 12, pr.changedFiles());
            ps.setLong(13, pr.id());
            return ps;
        });
    }

    // =========================================================================
    // Categorization subsystem write paths
    // =========================================================================

    public boolean assignCategory(long id, Long categoryId, Double confidence) {
        return jdbc.update("UPDATE pull_requests SET category_id = ?, category_confidence = ? WHERE id = ?",
                categoryId, confidence, id) > 0;
    }

    public boolean updateProcessingStatus(long id, String status, String error) {
        return jdbc.update("UPDATE pull_requests SET processing_status = ?, processing_error = ? WHERE id = ?",
                status, error, id) > 0;
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws java.sql.SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }
}
