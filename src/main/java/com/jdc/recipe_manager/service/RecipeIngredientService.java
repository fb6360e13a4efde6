package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.domain.dto.ingredient.RecipeIngredientDto;
import com.jdc.recipe_manager.domain.dto.ingredient.RecipeIngredientRequestDto;
import com.jdc.recipe_manager.domain.dto.ingredient.SkippedIngredientDto;
import com.jdc.recipe_manager.domain.entity.Recipe;
import com.jdc.recipe_manager.domain.entity.RecipeIngredient;
import com.jdc.recipe_manager.domain.repository.RecipeIngredientRepository;
import com.jdc.recipe_manager.exception.ValidationException;
import com.jdc.recipe_manager.mapper.RecipeIngredientMapper;
import com.jdc.recipe_manager.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeIngredientService {

    private final RecipeIngredientRepository recipeIngredientRepository;

    /**
     * Validates each row on its own and stores the ones that pass. Rejected rows are
     * appended to {@code skipped}.
     *
     * @return number of ingredients stored
     */
    public int saveAll(Recipe recipe, List<RecipeIngredientRequestDto> dtos, List<SkippedIngredientDto> skipped) {
        if (dtos == null || dtos.isEmpty()) {
            return 0;
        }

        List<RecipeIngredient> toSave = new ArrayList<>();
        for (RecipeIngredientRequestDto dto : dtos) {
            try {
                RecipeIngredientRequestDto valid = dto == null
                        ? InputValidator.validateIngredient(null, null)
                        : InputValidator.validateIngredient(dto.getName(), dto.getQuantity());
                toSave.add(RecipeIngredientMapper.toEntity(valid, recipe));
            } catch (ValidationException e) {
                log.warn("Skipping ingredient '{}' for recipe {}: {}",
                        dto == null ? null : dto.getName(), recipe.getId(), e.getMessage());
                skipped.add(RecipeIngredientMapper.toSkipped(dto, e.getMessage()));
            }
        }

        recipeIngredientRepository.saveAll(toSave);
        return toSave.size();
    }

    public int replaceAll(Recipe recipe, List<RecipeIngredientRequestDto> dtos, List<SkippedIngredientDto> skipped) {
        recipeIngredientRepository.deleteByRecipeId(recipe.getId());
        return saveAll(recipe, dtos, skipped);
    }

    public List<RecipeIngredientDto> findByRecipeId(Long recipeId) {
        return RecipeIngredientMapper.toDtoList(recipeIngredientRepository.findByRecipeIdOrderByIdAsc(recipeId));
    }
}
