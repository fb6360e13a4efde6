package com.jdc.recipe_manager.domain.dto.ingredient;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeIngredientDto {
    private Long id;
    private String name;
    private String quantity;
}
