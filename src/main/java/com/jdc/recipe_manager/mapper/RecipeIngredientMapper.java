package com.jdc.recipe_manager.mapper;

import com.jdc.recipe_manager.domain.dto.ingredient.RecipeIngredientDto;
import com.jdc.recipe_manager.domain.dto.ingredient.RecipeIngredientRequestDto;
import com.jdc.recipe_manager.domain.dto.ingredient.SkippedIngredientDto;
import com.jdc.recipe_manager.domain.entity.Recipe;
import com.jdc.recipe_manager.domain.entity.RecipeIngredient;

import java.util.List;
import java.util.stream.Collectors;

public class RecipeIngredientMapper {

    /** Expects an already validated (trimmed) request. */
    public static RecipeIngredient toEntity(RecipeIngredientRequestDto dto, Recipe recipe) {
        return RecipeIngredient.builder()
                .recipe(recipe)
                .name(dto.getName())
                .quantity(dto.getQuantity())
                .build();
    }

    public static RecipeIngredientDto toDto(RecipeIngredient entity) {
        return RecipeIngredientDto.builder()
                .id(entity.getId())
                .name(entity.getName())
                .quantity(entity.getQuantity())
                .build();
    }

    public static List<RecipeIngredientDto> toDtoList(List<RecipeIngredient> entities) {
        return entities.stream()
                .map(RecipeIngredientMapper::toDto)
                .collect(Collectors.toList());
    }

    public static SkippedIngredientDto toSkipped(RecipeIngredientRequestDto dto, String reason) {
        return SkippedIngredientDto.builder()
                .name(dto == null ? null : dto.getName())
                .quantity(dto == null ? null : dto.getQuantity())
                .reason(reason)
                .build();
    }
}
