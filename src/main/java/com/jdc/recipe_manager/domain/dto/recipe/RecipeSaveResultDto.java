package com.jdc.recipe_manager.domain.dto.recipe;

import com.jdc.recipe_manager.domain.dto.ingredient.SkippedIngredientDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeSaveResultDto {

    private Long recipeId;

    @Builder.Default
    private List<Long> skippedCategoryIds = new ArrayList<>();

    @Builder.Default
    private List<SkippedIngredientDto> skippedIngredients = new ArrayList<>();

    public boolean hasSkippedItems() {
        return !skippedCategoryIds.isEmpty() || !skippedIngredients.isEmpty();
    }
}
