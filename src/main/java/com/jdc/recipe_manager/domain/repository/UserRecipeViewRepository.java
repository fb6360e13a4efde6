package com.jdc.recipe_manager.domain.repository;

import com.jdc.recipe_manager.domain.entity.UserRecipeView;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRecipeViewRepository extends JpaRepository<UserRecipeView, Long> {

    Optional<UserRecipeView> findByUsernameAndRecipeId(String username, Long recipeId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM UserRecipeView v WHERE v.recipeId = :recipeId")
    int deleteByRecipeId(@Param("recipeId") Long recipeId);
}
