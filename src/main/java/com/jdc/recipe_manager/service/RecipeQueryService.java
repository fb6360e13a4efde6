package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.config.RecipeManagerProperties;
import com.jdc.recipe_manager.domain.dto.recipe.RecipeSimpleDto;
import com.jdc.recipe_manager.domain.dto.recipe.UserRecipesDto;
import com.jdc.recipe_manager.domain.repository.RecipeRepository;
import com.jdc.recipe_manager.domain.type.RecipeStatus;
import com.jdc.recipe_manager.exception.ErrorCode;
import com.jdc.recipe_manager.exception.ValidationException;
import com.jdc.recipe_manager.mapper.RecipeMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

/**
 * Read-only listings over active recipes. Storage failures are logged and
 * reported as empty results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeQueryService {

    private final RecipeRepository recipeRepository;
    private final RecipeManagerProperties properties;

    public List<RecipeSimpleDto> listActiveRecipes() {
        return listActiveRecipes(properties.getRecipes().getDefaultLimit());
    }

    public List<RecipeSimpleDto> listActiveRecipes(int limit) {
        Pageable page = firstPage(limit);
        try {
            return RecipeMapper.toSimpleDtoList(recipeRepository.findLatestByStatus(RecipeStatus.ACTIVE, page));
        } catch (DataAccessException e) {
            log.error("Failed to list active recipes (limit={})", limit, e);
            return Collections.emptyList();
        }
    }

    public List<RecipeSimpleDto> recentRecipes() {
        return recentRecipes(properties.getRecipes().getListLimit());
    }

    public List<RecipeSimpleDto> recentRecipes(int limit) {
        return listActiveRecipes(limit);
    }

    public List<RecipeSimpleDto> mostViewedRecipes() {
        return mostViewedRecipes(properties.getRecipes().getListLimit());
    }

    public List<RecipeSimpleDto> mostViewedRecipes(int limit) {
        Pageable page = firstPage(limit);
        try {
            return RecipeMapper.toSimpleDtoList(recipeRepository.findMostViewedByStatus(RecipeStatus.ACTIVE, page));
        } catch (DataAccessException e) {
            log.error("Failed to list most viewed recipes (limit={})", limit, e);
            return Collections.emptyList();
        }
    }

    /**
     * @param categoryId {@code null} lists every active recipe
     */
    public List<RecipeSimpleDto> recipesByCategory(Long categoryId) {
        try {
            if (categoryId == null) {
                return RecipeMapper.toSimpleDtoList(
                        recipeRepository.findLatestByStatus(RecipeStatus.ACTIVE, Pageable.unpaged()));
            }
            return RecipeMapper.toSimpleDtoList(
                    recipeRepository.findByCategoryIdAndStatus(categoryId, RecipeStatus.ACTIVE));
        } catch (DataAccessException e) {
            log.error("Failed to list recipes for category {}", categoryId, e);
            return Collections.emptyList();
        }
    }

    public UserRecipesDto userRecipes(String username) {
        List<RecipeSimpleDto> recipes;
        try {
            recipes = RecipeMapper.toSimpleDtoList(
                    recipeRepository.findByAuthorAndStatus(username, RecipeStatus.ACTIVE));
        } catch (DataAccessException e) {
            log.error("Failed to list recipes of {}", username, e);
            recipes = Collections.emptyList();
        }

        long totalViews = recipes.stream().mapToLong(RecipeSimpleDto::getViews).sum();
        return UserRecipesDto.builder()
                .username(username)
                .recipes(recipes)
                .totalViews(totalViews)
                .build();
    }

    private Pageable firstPage(int limit) {
        if (limit <= 0) {
            throw new ValidationException(ErrorCode.INVALID_INPUT_VALUE, "Limit must be a positive number");
        }
        return PageRequest.of(0, limit);
    }
}
