package com.jdc.recipe_manager.domain.dto.recipe;

import com.jdc.recipe_manager.domain.dto.ingredient.RecipeIngredientRequestDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeCreateRequestDto {

    private String title;
    private String instructions;

    /** Raw minutes as entered; parsed and range-checked on save. */
    private String prepTime;

    private String author;
    private List<Long> categoryIds;
    private List<RecipeIngredientRequestDto> ingredients;
}
