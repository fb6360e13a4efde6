package com.jdc.recipe_manager.domain.dto.event;

import com.jdc.recipe_manager.domain.type.RecipeEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeEventDto {
    private Long id;
    private Long recipeId;
    private String username;
    private RecipeEventType eventType;
    private LocalDateTime eventTime;
}
