package com.prpulse.pipeline.store;

import com.prpulse.pipeline.domain.User;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.Optional;

public class UserStore {

    private static final RowMapper<User> ROW_MAPPER = (rs, rowNum) -> new User(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("email"),
            rs.getString("image"));

    private final JdbcTemplate jdbc;

    public UserStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<User> findById(String id) {
        return jdbc.query("SELECT id, name, email, image FROM users WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    /**
     * Inserts a user row carrying nothing but the id.
     *
     * @return {@code true} if this call created the row, {@code false} if it already existed
     */
    public boolean insertPlaceholder(String id) {
        if (findById(id).isPresent()) {
            return false;
        }
        try {
            jdbc.update("INSERT INTO users (id) VALUES (?)", id);
            return true;
        } catch (DuplicateKeyException e) {
            // another sync created it first
            return false;
        }
    }

    /**
     * Fills {@code name} and {@code image} where they are still empty. Values set
     * by sign-in or earlier enrichment are kept.
     *
     * @return {@code true} if a column changed
     */
    public boolean fillProfile(String id, String name, String image) {
        Optional<User> existing = findById(id);
        if (existing.isEmpty()) {
            return false;
        }
        boolean fillName = existing.get().name() == null && name != null;
        boolean fillImage = existing.get().image() == null && image != null;
        if (!fillName && !fillImage) {
            return false;
        }
        return jdbc.update("UPDATE users SET name = COALESCE(name, ?), image = COALESCE(image, ?) WHERE id = ?",
                fillName ? name : null, fillImage ? image : null, id) > 0;
    }
}
