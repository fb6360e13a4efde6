package com.jdc.recipe_manager.domain.dto.recipe;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeSimpleDto {
    private Long id;
    private String title;
    private String instructions;
    private Long views;
    private String createdBy;
    private LocalDateTime createdAt;
    private Integer prepTime;
}
