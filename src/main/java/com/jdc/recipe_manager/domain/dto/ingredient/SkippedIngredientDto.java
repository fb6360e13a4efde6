package com.jdc.recipe_manager.domain.dto.ingredient;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * An ingredient row that failed validation and was left out of the recipe.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkippedIngredientDto {
    private String name;
    private String quantity;
    private String reason;
}
