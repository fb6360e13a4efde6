package com.jdc.recipe_manager.domain.repository;

import com.jdc.recipe_manager.domain.entity.RecipeCategory;
import com.jdc.recipe_manager.domain.entity.RecipeCategoryId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecipeCategoryRepository extends JpaRepository<RecipeCategory, RecipeCategoryId> {

    @Query("SELECT rc FROM RecipeCategory rc JOIN FETCH rc.category c WHERE rc.recipe.id = :recipeId ORDER BY c.name ASC")
    List<RecipeCategory> findWithCategoryByRecipeId(@Param("recipeId") Long recipeId);

    @Query("SELECT rc.category.id FROM RecipeCategory rc WHERE rc.recipe.id = :recipeId")
    List<Long> findCategoryIdsByRecipeId(@Param("recipeId") Long recipeId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RecipeCategory rc WHERE rc.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);
}
