package com.jdc.recipe_manager.domain.repository;

import com.jdc.recipe_manager.domain.entity.RecipeEvent;
import com.jdc.recipe_manager.domain.type.RecipeEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface RecipeEventRepository extends JpaRepository<RecipeEvent, Long> {

    List<RecipeEvent> findByRecipeIdOrderByIdAsc(Long recipeId);

    long countByRecipeIdAndEventType(Long recipeId, RecipeEventType eventType);

    long countByEventTimeGreaterThanEqual(LocalDateTime since);
}
