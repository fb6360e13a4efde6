package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.domain.repository.RecipeRepository;
import com.jdc.recipe_manager.domain.repository.UserRecipeViewDao;
import com.jdc.recipe_manager.domain.type.RecipeEventType;
import com.jdc.recipe_manager.domain.type.RecipeStatus;
import com.jdc.recipe_manager.exception.StorageException;
import com.jdc.recipe_manager.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeViewService {

    private final RecipeRepository recipeRepository;
    private final UserRecipeViewDao userRecipeViewDao;
    private final RecipeEventService recipeEventService;

    /**
     * Bumps the global and per-user counters and logs a view event.
     *
     * @return false when the recipe is missing or deleted; nothing is written then
     */
    @Transactional
    public boolean recordView(Long recipeId, String username) {
        String viewer = InputValidator.validateUsername(username);

        try {
            int updated = recipeRepository.incrementViews(recipeId, RecipeStatus.ACTIVE);
            if (updated == 0) {
                log.warn("View on missing or deleted recipe {} by {}", recipeId, viewer);
                return false;
            }

            userRecipeViewDao.recordView(viewer, recipeId);
            recipeEventService.append(recipeId, viewer, RecipeEventType.VIEW);
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to record view of recipe {} by {}", recipeId, viewer, e);
            throw new StorageException("Failed to record view: " + recipeId, e);
        }
    }
}
