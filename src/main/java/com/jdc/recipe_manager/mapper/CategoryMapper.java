package com.jdc.recipe_manager.mapper;

import com.jdc.recipe_manager.domain.dto.category.CategoryDto;
import com.jdc.recipe_manager.domain.entity.Category;

public class CategoryMapper {

    public static CategoryDto toDto(Category category) {
        if (category == null) return null;
        return CategoryDto.builder()
                .id(category.getId())
                .name(category.getName())
                .recipeCount(category.getRecipeCount())
                .build();
    }
}
