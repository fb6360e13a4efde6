package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.domain.dto.event.RecipeEventDto;
import com.jdc.recipe_manager.domain.entity.RecipeEvent;
import com.jdc.recipe_manager.domain.repository.RecipeEventRepository;
import com.jdc.recipe_manager.domain.type.RecipeEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeEventService {

    private final RecipeEventRepository recipeEventRepository;

    @Transactional
    public void append(Long recipeId, String username, RecipeEventType type) {
        RecipeEvent event = RecipeEvent.builder()
                .recipeId(recipeId)
                .username(username)
                .eventType(type)
                .build();

        recipeEventRepository.save(event);
    }

    /** Audit trail of a recipe, oldest first. */
    public List<RecipeEventDto> history(Long recipeId) {
        try {
            return recipeEventRepository.findByRecipeIdOrderByIdAsc(recipeId).stream()
                    .map(e -> RecipeEventDto.builder()
                            .id(e.getId())
                            .recipeId(e.getRecipeId())
                            .username(e.getUsername())
                            .eventType(e.getEventType())
                            .eventTime(e.getEventTime())
                            .build())
                    .toList();
        } catch (DataAccessException e) {
            log.error("Failed to load events for recipe {}", recipeId, e);
            return Collections.emptyList();
        }
    }
}
