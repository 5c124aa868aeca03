package com.prpulse.pipeline.store;

import com.prpulse.pipeline.domain.Category;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

public class CategoryStore {

    private static final String COLUMNS = "id, organization_id, name, description, color, is_default";

    private static final RowMapper<Category> ROW_MAPPER = (rs, rowNum) -> new Category(
            rs.getLong("id"),
            rs.getObject("organization_id", Long.class),
            rs.getString("name"),
            rs.getString("description"),
            rs.getString("color"),
            rs.getBoolean("is_default"));

    private final JdbcTemplate jdbc;

    public CategoryStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Category> findById(long id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM categories WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public List<Category> findDefaults() {
        return jdbc.query("SELECT " + COLUMNS + " FROM categories WHERE is_default = TRUE ORDER BY id", ROW_MAPPER);
    }

    /**
     * Shared defaults first, then the organization's own categories by name.
     */
    public List<Category> findVisibleTo(long organizationId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM categories "
                        + "WHERE is_default = TRUE OR organization_id = ? "
                        + "ORDER BY CASE WHEN is_default THEN 0 ELSE 1 END, name, id",
                ROW_MAPPER, organizationId);
    }

    public boolean defaultExists(String name) {
        Integer count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM categories WHERE is_default = TRUE AND name_key = ?",
                Integer.class, nameKey(name));
        return count != null && count > 0;
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException when the same scope
     *         (the organization, or the shared defaults for a {@code null} organization)
     *         already has a category whose name matches case-insensitively
     */
    public Category insert(Long organizationId, String name, String description, String color, boolean isDefault) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO categories (organization_id, scope_key, name, name_key, description, color, "
                            + "is_default) VALUES (?, ?, ?, ?, ?, ?, ?)",
                    new String[]{"id"});
            if (organizationId == null) {
                ps.setNull(1, Types.BIGINT);
            } else {
                ps.setLong(1, organizationId);
            }
            ps.setLong(2, scopeKey(organizationId));
            ps.setString(3, name);
            ps.setString(4, nameKey(name));
            ps.setString(5, description);
            ps.setString(6, color);
            ps.setBoolean(7, isDefault);
            return ps;
        }, keys);
        long id = Objects.requireNonNull(keys.getKey(), "generated id").longValue();
        return new Category(id, organizationId, name, description, color, isDefault);
    }

    /**
     * Organization ids start at 1, so 0 is free for the shared defaults.
     */
    static long scopeKey(Long organizationId) {
        return organizationId != null ? organizationId : 0L;
    }

    static String nameKey(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
