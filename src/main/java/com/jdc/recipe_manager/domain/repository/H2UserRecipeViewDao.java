package com.jdc.recipe_manager.domain.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@Profile("!mysql")
@RequiredArgsConstructor
@Slf4j
public class H2UserRecipeViewDao implements UserRecipeViewDao {

    private final JdbcTemplate jdbc;

    @Override
    public void recordView(String username, Long recipeId) {
        String sql = """
            MERGE INTO user_recipe_views t
            USING (SELECT CAST(? AS VARCHAR(50)) AS username, CAST(? AS BIGINT) AS recipe_id) s
            ON (t.username = s.username AND t.recipe_id = s.recipe_id)
            WHEN MATCHED THEN
                UPDATE SET t.view_count = t.view_count + 1, t.last_viewed = CURRENT_TIMESTAMP
            WHEN NOT MATCHED THEN
                INSERT (username, recipe_id, view_count, last_viewed) VALUES (?, ?, 1, CURRENT_TIMESTAMP)
            """;

        try {
            jdbc.update(sql, username, recipeId, username, recipeId);
        } catch (DuplicateKeyException e) {
            // a concurrent first view inserted the row between the match and the insert
            log.debug("Concurrent first view for user={}, recipeId={}; retrying as update", username, recipeId);
            jdbc.update(
                    "UPDATE user_recipe_views SET view_count = view_count + 1, last_viewed = CURRENT_TIMESTAMP WHERE username = ? AND recipe_id = ?",
                    username, recipeId
            );
        }
    }
}
