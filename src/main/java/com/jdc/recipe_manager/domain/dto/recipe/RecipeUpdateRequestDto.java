package com.jdc.recipe_manager.domain.dto.recipe;

import com.jdc.recipe_manager.domain.dto.ingredient.RecipeIngredientRequestDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * {@code categoryIds} and {@code ingredients} replace the stored sets wholesale when
 * present (an empty list clears the categories); {@code null} leaves them untouched.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeUpdateRequestDto {

    private String title;
    private String instructions;
    private String prepTime;

    /** Recorded on the edit event; the author is used when blank. */
    private String editedBy;

    private List<Long> categoryIds;
    private List<RecipeIngredientRequestDto> ingredients;
}
