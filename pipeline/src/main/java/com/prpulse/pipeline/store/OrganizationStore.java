package com.prpulse.pipeline.store;

import com.prpulse.pipeline.domain.Organization;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class OrganizationStore {

    private static final String COLUMNS = "id, external_id, login, name, avatar_url, installation_id";

    private static final RowMapper<Organization> ROW_MAPPER = (rs, rowNum) -> new Organization(
            rs.getLong("id"),
            rs.getLong("external_id"),
            rs.getString("login"),
            rs.getString("name"),
            rs.getString("avatar_url"),
            rs.getString("installation_id"));

    private final JdbcTemplate jdbc;

    public OrganizationStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Organization> findById(long id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM organizations WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public Optional<Organization> findByExternalId(long externalId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM organizations WHERE external_id = ?", ROW_MAPPER, externalId)
                .stream().findFirst();
    }

    public List<Organization> findAll() {
        return jdbc.query("SELECT " + COLUMNS + " FROM organizations ORDER BY id", ROW_MAPPER);
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the external id is already stored
     */
    public Organization insert(long externalId, String login, String name, String avatarUrl) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO organizations (external_id, login, name, avatar_url) VALUES (?, ?, ?, ?)",
                    new String[]{"id"});
            ps.setLong(1, externalId);
            ps.setString(2, login);
            ps.setString(3, name);
            ps.setString(4, avatarUrl);
            return ps;
        }, keys);
        long id = Objects.requireNonNull(keys.getKey(), "generated id").longValue();
        return new Organization(id, externalId, login, name, avatarUrl, null);
    }

    public void updateSyncFields(long id, String login, String name, String avatarUrl) {
        jdbc.update("UPDATE organizations SET login = ?, name = ?, avatar_url = ?, updated_at = CURRENT_TIMESTAMP "
                + "WHERE id = ?", login, name, avatarUrl, id);
    }

    /**
     * Records the installation handle for an organization. Never called by sync.
     */
    public boolean setInstallationId(long id, String installationId) {
        return jdbc.update("UPDATE organizations SET installation_id = ?, updated_at = CURRENT_TIMESTAMP "
                + "WHERE id = ?", installationId, id) > 0;
    }
}
