package com.jdc.recipe_manager.domain.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@Profile("mysql")
@RequiredArgsConstructor
@Slf4j
public class MySqlUserRecipeViewDao implements UserRecipeViewDao {

    private static final String INCREMENT_SQL = """
            UPDATE user_recipe_views
            SET view_count = view_count + 1, last_viewed = CURRENT_TIMESTAMP
            WHERE username = ? AND recipe_id = ?
            """;

    private final JdbcTemplate jdbc;

    @Override
    public void recordView(String username, Long recipeId) {
        int updated = jdbc.update(INCREMENT_SQL, username, recipeId);
        if (updated > 0) {
            return;
        }

        try {
            jdbc.update(
                    """
                    INSERT INTO user_recipe_views (username, recipe_id, view_count, last_viewed)
                    VALUES (?, ?, 1, CURRENT_TIMESTAMP)
                    """,
                    username, recipeId
            );
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent first view for user={}, recipeId={}; retrying as update", username, recipeId);
            jdbc.update(INCREMENT_SQL, username, recipeId);
        }
    }
}
