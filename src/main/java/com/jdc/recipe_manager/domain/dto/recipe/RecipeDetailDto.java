package com.jdc.recipe_manager.domain.dto.recipe;

import com.jdc.recipe_manager.domain.dto.category.CategoryDto;
import com.jdc.recipe_manager.domain.dto.ingredient.RecipeIngredientDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeDetailDto {
    private Long id;
    private String title;
    private String instructions;
    private Integer prepTime;
    private Long views;
    private String createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private List<CategoryDto> categories;
    private List<RecipeIngredientDto> ingredients;
}
