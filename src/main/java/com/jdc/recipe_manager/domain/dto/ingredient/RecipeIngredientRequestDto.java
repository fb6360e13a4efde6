package com.jdc.recipe_manager.domain.dto.ingredient;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeIngredientRequestDto {

    private String name;

    /** Free text such as "2 cups"; may be empty. */
    private String quantity;

    public static RecipeIngredientRequestDto of(String name, String quantity) {
        return new RecipeIngredientRequestDto(name, quantity);
    }
}
