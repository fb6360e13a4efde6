package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.domain.dto.category.CategoryDto;
import com.jdc.recipe_manager.domain.entity.Category;
import com.jdc.recipe_manager.domain.entity.Recipe;
import com.jdc.recipe_manager.domain.entity.RecipeCategory;
import com.jdc.recipe_manager.domain.repository.CategoryRepository;
import com.jdc.recipe_manager.domain.repository.RecipeCategoryRepository;
import com.jdc.recipe_manager.domain.repository.RecipeRepository;
import com.jdc.recipe_manager.mapper.CategoryMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Maintains recipe-category links together with each category's {@code recipe_count}.
 * Callers own the transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeCategoryService {

    private final RecipeCategoryRepository recipeCategoryRepository;
    private final CategoryRepository categoryRepository;
    private final RecipeRepository recipeRepository;

    /**
     * Links the recipe to every existing category in {@code categoryIds}.
     *
     * @return ids that were not linked (unknown, null or repeated)
     */
    public List<Long> attachAll(Recipe recipe, List<Long> categoryIds) {
        List<Long> skipped = new ArrayList<>();
        Set<Long> linked = link(recipe, categoryIds, skipped);

        if (!linked.isEmpty()) {
            categoryRepository.incrementRecipeCount(linked);
        }
        return skipped;
    }

    /**
     * Replaces the recipe's link set. Only the difference between the old and new set
     * touches the category counters.
     */
    public List<Long> replaceAll(Recipe recipe, List<Long> categoryIds) {
        Set<Long> previous = new HashSet<>(recipeCategoryRepository.findCategoryIdsByRecipeId(recipe.getId()));
        recipeCategoryRepository.deleteByRecipeId(recipe.getId());

        List<Long> skipped = new ArrayList<>();
        Set<Long> linked = link(recipe, categoryIds, skipped);

        Set<Long> removed = new HashSet<>(previous);
        removed.removeAll(linked);
        Set<Long> added = new HashSet<>(linked);
        added.removeAll(previous);

        if (!removed.isEmpty()) {
            categoryRepository.decrementRecipeCount(removed);
        }
        if (!added.isEmpty()) {
            categoryRepository.incrementRecipeCount(added);
        }
        return skipped;
    }

    /** The recipe leaves the active set; its links stay but stop counting. */
    public void releaseCounts(Long recipeId) {
        List<Long> categoryIds = recipeCategoryRepository.findCategoryIdsByRecipeId(recipeId);
        if (!categoryIds.isEmpty()) {
            categoryRepository.decrementRecipeCount(categoryIds);
        }
    }

    public List<CategoryDto> findCategories(Long recipeId) {
        return recipeCategoryRepository.findWithCategoryByRecipeId(recipeId).stream()
                .map(RecipeCategory::getCategory)
                .map(CategoryMapper::toDto)
                .toList();
    }

    private Set<Long> link(Recipe recipe, List<Long> categoryIds, List<Long> skipped) {
        Set<Long> linked = new LinkedHashSet<>();
        if (categoryIds == null) {
            return linked;
        }

        // bulk counter updates clear the persistence context, so the caller's instance may be detached
        Recipe managed = recipeRepository.getReferenceById(recipe.getId());
        for (Long categoryId : categoryIds) {
            if (categoryId == null || linked.contains(categoryId)) {
                log.warn("Skipping null or repeated category id {} for recipe {}", categoryId, recipe.getId());
                skipped.add(categoryId);
                continue;
            }

            Optional<Category> category = categoryRepository.findById(categoryId);
            if (category.isEmpty()) {
                log.warn("Category ID {} does not exist, skipping for recipe {}", categoryId, recipe.getId());
                skipped.add(categoryId);
                continue;
            }

            recipeCategoryRepository.save(RecipeCategory.of(managed, category.get()));
            linked.add(categoryId);
        }
        return linked;
    }
}
