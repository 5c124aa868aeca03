package com.prpulse.pipeline.store;

import com.prpulse.pipeline.domain.Review;
import com.prpulse.pipeline.domain.ReviewState;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class ReviewStore {

    private static final String COLUMNS = "id, external_id, pull_request_id, reviewer_id, state, submitted_at";

    private static final RowMapper<Review> ROW_MAPPER = (rs, rowNum) -> new Review(
            rs.getLong("id"),
            rs.getLong("external_id"),
            rs.getLong("pull_request_id"),
            rs.getString("reviewer_id"),
            ReviewState.fromDb(rs.getString("state")),
            Timestamps.fromDb(rs, "submitted_at"));

    private final JdbcTemplate jdbc;

    public ReviewStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Review ids are unique on the source, but the table carries no unique index
     * on them, so the oldest matching row wins.
     */
    public Optional<Review> findByExternalId(long externalId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM reviews WHERE external_id = ? ORDER BY id",
                ROW_MAPPER, externalId).stream().findFirst();
    }

    public List<Review> findByPullRequest(long pullRequestId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM reviews WHERE pull_request_id = ? ORDER BY submitted_at, id",
                ROW_MAPPER, pullRequestId);
    }

    public Review insert(Review review) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO reviews (external_id, pull_request_id, reviewer_id, state, submitted_at) "
                            + "VALUES (?, ?, ?, ?, ?)",
                    new String[]{"id"});
            ps.setLong(1, review.externalId());
            ps.setLong(2, review.pullRequestId());
            ps.setString(3, review.reviewerId());
            ps.setString(4, review.state().dbValue());
            ps.setObject(5, Timestamps.toDb(review.submittedAt()));
            return ps;
        }, keys);
        return review.withId(Objects.requireNonNull(keys.getKey(), "generated id").longValue());
    }

    public void updateSyncFields(Review review) {
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                    "UPDATE reviews SET reviewer_id = ?, state = ?, submitted_at = ? WHERE id = ?");
            ps.setString(1, review.reviewerId());
            ps.setString(2, review.state().dbValue());
            ps.setObject(3, Timestamps.toDb(review.submittedAt()));
            ps.setLong(4, review.id());
            return ps;
        });
    }
}
