package com.prpulse.pipeline.store;

import com.prpulse.pipeline.domain.Repository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class RepositoryStore {

    private static final String COLUMNS =
            "id, external_id, organization_id, name, full_name, is_private, is_tracked";

    private static final RowMapper<Repository> ROW_MAPPER = (rs, rowNum) -> new Repository(
            rs.getLong("id"),
            rs.getLong("external_id"),
            rs.getLong("organization_id"),
            rs.getString("name"),
            rs.getString("full_name"),
            rs.getBoolean("is_private"),
            rs.getBoolean("is_tracked"));

    private final JdbcTemplate jdbc;

    public RepositoryStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Repository> findById(long id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM repositories WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public Optional<Repository> findByExternalId(long externalId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM repositories WHERE external_id = ?", ROW_MAPPER, externalId)
                .stream().findFirst();
    }

    public List<Repository> findByOrganization(long organizationId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM repositories WHERE organization_id = ? ORDER BY full_name",
                ROW_MAPPER, organizationId);
    }

    public List<Repository> findTrackedByOrganization(long organizationId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM repositories "
                + "WHERE organization_id = ? AND is_tracked = TRUE ORDER BY full_name", ROW_MAPPER, organizationId);
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the external id is already stored
     */
    public Repository insert(long externalId, long organizationId, String name, String fullName,
                             boolean isPrivate, boolean tracked) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO repositories (external_id, organization_id, name, full_name, is_private, is_tracked) "
                            + "VALUES (?, ?, ?, ?, ?, ?)",
                    new String[]{"id"});
            ps.setLong(1, externalId);
            ps.setLong(2, organizationId);
            ps.setString(3, name);
            ps.setString(4, fullName);
            ps.setBoolean(5, isPrivate);
            ps.setBoolean(6, tracked);
            return ps;
        }, keys);
        long id = Objects.requireNonNull(keys.getKey(), "generated id").longValue();
        return new Repository(id, externalId, organizationId, name, fullName, isPrivate, tracked);
    }

    /**
     * Writes the sync-owned columns only; {@code is_tracked} is left alone.
     */
    public void updateSyncFields(long id, long organizationId, String name, String fullName, boolean isPrivate) {
        jdbc.update("UPDATE repositories SET organization_id = ?, name = ?, full_name = ?, is_private = ?, "
                + "updated_at = CURRENT_TIMESTAMP WHERE id = ?", organizationId, name, fullName, isPrivate, id);
    }

    /**
     * Settings write path for the tracking flag.
     *
     * @return {@code false} if no repository has that id
     */
    public boolean setTracked(long id, boolean tracked) {
        return jdbc.update("UPDATE repositories SET is_tracked = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                tracked, id) > 0;
    }
}
