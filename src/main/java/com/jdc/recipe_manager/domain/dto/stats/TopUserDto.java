package com.jdc.recipe_manager.domain.dto.stats;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class TopUserDto {
    private String username;
    private Long recipeCount;
    private Long totalViews;
}
