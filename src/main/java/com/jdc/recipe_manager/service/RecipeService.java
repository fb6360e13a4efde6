package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.domain.dto.category.CategoryDto;
import com.jdc.recipe_manager.domain.dto.ingredient.RecipeIngredientDto;
import com.jdc.recipe_manager.domain.dto.ingredient.SkippedIngredientDto;
import com.jdc.recipe_manager.domain.dto.recipe.RecipeCreateRequestDto;
import com.jdc.recipe_manager.domain.dto.recipe.RecipeDetailDto;
import com.jdc.recipe_manager.domain.dto.recipe.RecipeSaveResultDto;
import com.jdc.recipe_manager.domain.dto.recipe.RecipeUpdateRequestDto;
import com.jdc.recipe_manager.domain.entity.Recipe;
import com.jdc.recipe_manager.domain.repository.RecipeRepository;
import com.jdc.recipe_manager.domain.repository.UserRecipeViewRepository;
import com.jdc.recipe_manager.domain.repository.UserRepository;
import com.jdc.recipe_manager.domain.type.RecipeEventType;
import com.jdc.recipe_manager.domain.type.RecipeStatus;
import com.jdc.recipe_manager.exception.CustomException;
import com.jdc.recipe_manager.exception.ErrorCode;
import com.jdc.recipe_manager.exception.StorageException;
import com.jdc.recipe_manager.exception.ValidationException;
import com.jdc.recipe_manager.mapper.RecipeMapper;
import com.jdc.recipe_manager.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeService {

    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;
    private final UserRecipeViewRepository userRecipeViewRepository;
    private final RecipeCategoryService recipeCategoryService;
    private final RecipeIngredientService recipeIngredientService;
    private final RecipeEventService recipeEventService;

    /**
     * Unknown category ids and invalid ingredient rows are skipped and reported in the
     * result. The whole create is rolled back when no ingredient survives.
     */
    @Transactional
    public RecipeSaveResultDto createRecipe(RecipeCreateRequestDto dto) {
        String title = InputValidator.validateRecipeTitle(dto.getTitle());
        String instructions = InputValidator.validateInstructions(dto.getInstructions());
        int prepTime = InputValidator.validatePrepTime(dto.getPrepTime());
        String author = getExistingUsernameOrThrow(dto.getAuthor());

        try {
            Recipe recipe = recipeRepository.save(RecipeMapper.toEntity(title, instructions, prepTime, author));
            Long recipeId = recipe.getId();

            userRepository.incrementRecipeCount(author);
            recipeEventService.append(recipeId, author, RecipeEventType.CREATE);

            List<Long> skippedCategoryIds = recipeCategoryService.attachAll(recipe, dto.getCategoryIds());

            List<SkippedIngredientDto> skippedIngredients = new ArrayList<>();
            int savedIngredients = recipeIngredientService.saveAll(recipe, dto.getIngredients(), skippedIngredients);
            if (savedIngredients == 0) {
                throw new ValidationException(ErrorCode.INGREDIENT_REQUIRED);
            }

            recipeRepository.flush();
            log.info("Recipe {} '{}' created by {} ({} ingredients, {} categories skipped)",
                    recipeId, title, author, savedIngredients, skippedCategoryIds.size());

            return RecipeSaveResultDto.builder()
                    .recipeId(recipeId)
                    .skippedCategoryIds(skippedCategoryIds)
                    .skippedIngredients(skippedIngredients)
                    .build();
        } catch (DataAccessException e) {
            log.error("Failed to create recipe '{}' by {}", title, author, e);
            throw new StorageException("Failed to create recipe: " + title, e);
        }
    }

    @Transactional
    public RecipeSaveResultDto updateRecipe(Long recipeId, RecipeUpdateRequestDto dto) {
        String title = InputValidator.validateRecipeTitle(dto.getTitle());
        String instructions = InputValidator.validateInstructions(dto.getInstructions());
        int prepTime = InputValidator.validatePrepTime(dto.getPrepTime());

        try {
            Recipe recipe = getActiveRecipeOrThrow(recipeId);
            recipe.update(title, instructions, prepTime);
            String editor = StringUtils.hasText(dto.getEditedBy()) ? dto.getEditedBy().trim() : recipe.getCreatedBy();

            List<Long> skippedCategoryIds = new ArrayList<>();
            if (dto.getCategoryIds() != null) {
                skippedCategoryIds = recipeCategoryService.replaceAll(recipe, dto.getCategoryIds());
            }

            List<SkippedIngredientDto> skippedIngredients = new ArrayList<>();
            if (dto.getIngredients() != null) {
                int savedIngredients = recipeIngredientService.replaceAll(recipe, dto.getIngredients(), skippedIngredients);
                if (savedIngredients == 0) {
                    throw new ValidationException(ErrorCode.INGREDIENT_REQUIRED);
                }
            }

            recipeEventService.append(recipeId, editor, RecipeEventType.EDIT);
            recipeRepository.flush();
            log.info("Recipe {} updated by {}", recipeId, editor);

            return RecipeSaveResultDto.builder()
                    .recipeId(recipeId)
                    .skippedCategoryIds(skippedCategoryIds)
                    .skippedIngredients(skippedIngredients)
                    .build();
        } catch (DataAccessException e) {
            log.error("Failed to update recipe {}", recipeId, e);
            throw new StorageException("Failed to update recipe: " + recipeId, e);
        }
    }

    /**
     * Hides the recipe from every read path. Rows, ingredients and category links stay
     * in storage; per-user view rows are removed.
     *
     * @return false when the recipe does not exist or is already deleted
     */
    @Transactional
    public boolean softDeleteRecipe(Long recipeId, String actingUsername) {
        try {
            Optional<Recipe> found = recipeRepository.findByIdAndStatus(recipeId, RecipeStatus.ACTIVE);
            if (found.isEmpty()) {
                log.warn("Recipe {} not found or already deleted", recipeId);
                return false;
            }
            String author = found.get().getCreatedBy();

            if (recipeRepository.updateStatus(recipeId, RecipeStatus.ACTIVE, RecipeStatus.DELETED) == 0) {
                log.warn("Recipe {} was deleted concurrently", recipeId);
                return false;
            }

            userRepository.decrementRecipeCount(author);
            recipeCategoryService.releaseCounts(recipeId);
            userRecipeViewRepository.deleteByRecipeId(recipeId);

            String actor = StringUtils.hasText(actingUsername) ? actingUsername.trim() : author;
            recipeEventService.append(recipeId, actor, RecipeEventType.DELETE);
            log.info("Recipe {} deleted by {}", recipeId, actor);
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to delete recipe {}", recipeId, e);
            throw new StorageException("Failed to delete recipe: " + recipeId, e);
        }
    }

    /**
     * Deleted recipes are not reachable here.
     */
    public Optional<RecipeDetailDto> getRecipe(Long recipeId) {
        try {
            Optional<Recipe> found = recipeRepository.findByIdAndStatus(recipeId, RecipeStatus.ACTIVE);
            if (found.isEmpty()) {
                return Optional.empty();
            }

            List<CategoryDto> categories = recipeCategoryService.findCategories(recipeId);
            List<RecipeIngredientDto> ingredients = recipeIngredientService.findByRecipeId(recipeId);
            return Optional.of(RecipeMapper.toDetailDto(found.get(), categories, ingredients));
        } catch (DataAccessException e) {
            log.error("Failed to load recipe {}", recipeId, e);
            return Optional.empty();
        }
    }

    private Recipe getActiveRecipeOrThrow(Long recipeId) {
        return recipeRepository.findByIdAndStatus(recipeId, RecipeStatus.ACTIVE)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND, "Recipe not found: " + recipeId));
    }

    private String getExistingUsernameOrThrow(String username) {
        String name = username == null ? "" : username.trim();
        if (name.isEmpty() || !userRepository.existsByUsername(name)) {
            throw new CustomException(ErrorCode.USER_NOT_FOUND, "User not found: " + name);
        }
        return name;
    }
}
