package com.jdc.recipe_manager.domain.repository;

/**
 * Per-user view counter upsert. Implementations must be safe under concurrent
 * first views of the same (username, recipe) pair.
 */
public interface UserRecipeViewDao {
    void recordView(String username, Long recipeId);
}
