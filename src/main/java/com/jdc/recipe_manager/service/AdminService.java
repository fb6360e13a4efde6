package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.config.RecipeManagerProperties;
import com.jdc.recipe_manager.domain.dto.stats.SystemStatsDto;
import com.jdc.recipe_manager.domain.dto.user.UserResponseDto;
import com.jdc.recipe_manager.domain.entity.Recipe;
import com.jdc.recipe_manager.domain.repository.CategoryRepository;
import com.jdc.recipe_manager.domain.repository.RecipeEventRepository;
import com.jdc.recipe_manager.domain.repository.RecipeRepository;
import com.jdc.recipe_manager.domain.repository.UserRepository;
import com.jdc.recipe_manager.domain.type.RecipeStatus;
import com.jdc.recipe_manager.exception.CustomException;
import com.jdc.recipe_manager.exception.ErrorCode;
import com.jdc.recipe_manager.exception.StorageException;
import com.jdc.recipe_manager.mapper.UserMapper;
import com.jdc.recipe_manager.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService {

    private final UserRepository userRepository;
    private final RecipeRepository recipeRepository;
    private final CategoryRepository categoryRepository;
    private final RecipeEventRepository recipeEventRepository;
    private final RecipeService recipeService;
    private final RecipeManagerProperties properties;

    public SystemStatsDto systemStats() {
        RecipeManagerProperties.Stats stats = properties.getStats();
        LocalDateTime since = LocalDateTime.now().minusDays(stats.getRecentDays());

        try {
            Long totalViews = recipeRepository.sumViewsByStatus(RecipeStatus.ACTIVE);
            return SystemStatsDto.builder()
                    .totalUsers(userRepository.count())
                    .totalRecipes(recipeRepository.countByStatus(RecipeStatus.ACTIVE))
                    .totalCategories(categoryRepository.count())
                    .totalViews(totalViews == null ? 0L : totalViews)
                    .recentEvents(recipeEventRepository.countByEventTimeGreaterThanEqual(since))
                    .recentRecipes(recipeRepository.countByStatusAndCreatedAtGreaterThanEqual(RecipeStatus.ACTIVE, since))
                    .topUsers(recipeRepository.findTopAuthors(RecipeStatus.ACTIVE, PageRequest.of(0, stats.getTopUsers())))
                    .build();
        } catch (DataAccessException e) {
            log.error("Failed to compute system statistics", e);
            return SystemStatsDto.empty();
        }
    }

    /** Newest accounts first. */
    public List<UserResponseDto> listAllUsers() {
        try {
            return userRepository.findAllNewestFirst().stream()
                    .map(UserMapper::toResponseDto)
                    .toList();
        } catch (DataAccessException e) {
            log.error("Failed to list users", e);
            return Collections.emptyList();
        }
    }

    /**
     * Case-insensitive username prefix search ordered by username. A blank query
     * falls back to {@link #listAllUsers()} and its newest-first order.
     */
    public List<UserResponseDto> searchUsers(String query) {
        if (!StringUtils.hasText(query)) {
            return listAllUsers();
        }

        String pattern = escapeLike(query.trim().toLowerCase(Locale.ROOT)) + "%";
        try {
            return userRepository.searchByUsernamePattern(pattern).stream()
                    .map(UserMapper::toResponseDto)
                    .toList();
        } catch (DataAccessException e) {
            log.error("Failed to search users for '{}'", query, e);
            return Collections.emptyList();
        }
    }

    /**
     * Soft-deletes every active recipe of the user, then removes the account. Irreversible.
     *
     * @return number of recipes soft-deleted
     */
    @Transactional
    public int deleteUser(String rawUsername, String rawActingUsername) {
        String username = InputValidator.validateUsername(rawUsername);
        String actingUsername = InputValidator.validateUsername(rawActingUsername);
        if (username.equals(actingUsername)) {
            throw new CustomException(ErrorCode.CANNOT_DELETE_SELF);
        }
        if (!userRepository.existsByUsername(username)) {
            throw new CustomException(ErrorCode.USER_NOT_FOUND, "User not found: " + username);
        }

        try {
            List<Recipe> recipes = recipeRepository.findByAuthorAndStatus(username, RecipeStatus.ACTIVE);
            int deleted = 0;
            for (Recipe recipe : recipes) {
                if (recipeService.softDeleteRecipe(recipe.getId(), actingUsername)) {
                    deleted++;
                }
            }

            userRepository.deleteByUsername(username);
            log.info("User {} deleted by {} ({} recipes soft-deleted)", username, actingUsername, deleted);
            return deleted;
        } catch (DataAccessException e) {
            log.error("Failed to delete user {}", username, e);
            throw new StorageException("Failed to delete user: " + username, e);
        }
    }

    private static String escapeLike(String value) {
        return value.replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
    }
}
