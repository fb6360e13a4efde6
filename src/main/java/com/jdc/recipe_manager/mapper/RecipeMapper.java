package com.jdc.recipe_manager.mapper;

import com.jdc.recipe_manager.domain.dto.category.CategoryDto;
import com.jdc.recipe_manager.domain.dto.ingredient.RecipeIngredientDto;
import com.jdc.recipe_manager.domain.dto.recipe.RecipeDetailDto;
import com.jdc.recipe_manager.domain.dto.recipe.RecipeSimpleDto;
import com.jdc.recipe_manager.domain.entity.Recipe;

import java.util.List;
import java.util.stream.Collectors;

public class RecipeMapper {

    public static Recipe toEntity(String title, String instructions, int prepTime, String author) {
        return Recipe.builder()
                .title(title)
                .instructions(instructions)
                .prepTime(prepTime)
                .createdBy(author)
                .build();
    }

    public static RecipeSimpleDto toSimpleDto(Recipe recipe) {
        return RecipeSimpleDto.builder()
                .id(recipe.getId())
                .title(recipe.getTitle())
                .instructions(recipe.getInstructions())
                .views(recipe.getViews())
                .createdBy(recipe.getCreatedBy())
                .createdAt(recipe.getCreatedAt())
                .prepTime(recipe.getPrepTime())
                .build();
    }

    public static List<RecipeSimpleDto> toSimpleDtoList(List<Recipe> recipes) {
        return recipes.stream()
                .map(RecipeMapper::toSimpleDto)
                .collect(Collectors.toList());
    }

    public static RecipeDetailDto toDetailDto(Recipe recipe,
                                              List<CategoryDto> categories,
                                              List<RecipeIngredientDto> ingredients) {
        return RecipeDetailDto.builder()
                .id(recipe.getId())
                .title(recipe.getTitle())
                .instructions(recipe.getInstructions())
                .prepTime(recipe.getPrepTime())
                .views(recipe.getViews())
                .createdBy(recipe.getCreatedBy())
                .createdAt(recipe.getCreatedAt())
                .updatedAt(recipe.getUpdatedAt())
                .categories(categories)
                .ingredients(ingredients)
                .build();
    }
}
