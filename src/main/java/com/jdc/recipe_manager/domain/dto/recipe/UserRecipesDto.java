package com.jdc.recipe_manager.domain.dto.recipe;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRecipesDto {
    private String username;
    private List<RecipeSimpleDto> recipes;
    private long totalViews;
}
