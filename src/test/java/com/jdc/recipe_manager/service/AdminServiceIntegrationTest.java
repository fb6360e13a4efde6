package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.domain.dto.ingredient.RecipeIngredientRequestDto;
import com.jdc.recipe_manager.domain.dto.recipe.RecipeCreateRequestDto;
import com.jdc.recipe_manager.domain.dto.stats.SystemStatsDto;
import com.jdc.recipe_manager.domain.dto.stats.TopUserDto;
import com.jdc.recipe_manager.domain.dto.user.UserResponseDto;
import com.jdc.recipe_manager.domain.repository.CategoryRepository;
import com.jdc.recipe_manager.domain.type.Role;
import com.jdc.recipe_manager.exception.CustomException;
import com.jdc.recipe_manager.exception.ErrorCode;
import com.jdc.recipe_manager.exception.ValidationException;
import com.jdc.recipe_manager.testsupport.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AdminServiceIntegrationTest extends IntegrationTestSupport {

    @Autowired AdminService adminService;
    @Autowired CredentialService credentialService;
    @Autowired CategoryService categoryService;
    @Autowired RecipeService recipeService;
    @Autowired RecipeViewService recipeViewService;
    @Autowired CategoryRepository categoryRepository;

    private Long createRecipe(String author, String title, List<Long> categoryIds) {
        return recipeService.createRecipe(RecipeCreateRequestDto.builder()
                .title(title)
                .instructions("Cook it.")
                .prepTime("10")
                .author(author)
                .categoryIds(categoryIds)
                .ingredients(List.of(RecipeIngredientRequestDto.of("water", "1 l")))
                .build()).getRecipeId();
    }

    @Test
    @DisplayName("searchUsers: prefix match is case-insensitive and ordered by username")
    void searchUsers_prefix() {
        credentialService.register("Andy", "secret1");
        credentialService.register("anna", "secret1");
        credentialService.register("bob", "secret1");
        credentialService.register("angel", "secret1");

        List<UserResponseDto> result = adminService.searchUsers("an");

        assertThat(result).extracting(UserResponseDto::getUsername).containsExactly("Andy", "angel", "anna");
    }

    @Test
    @DisplayName("searchUsers: a blank query lists every user newest first")
    void searchUsers_blank() {
        credentialService.register("first_user", "secret1");
        credentialService.register("second_user", "secret1");
        credentialService.register("third_user", "secret1");

        assertThat(adminService.searchUsers("  ")).extracting(UserResponseDto::getUsername)
                .containsExactly("third_user", "second_user", "first_user");
        assertThat(adminService.listAllUsers()).extracting(UserResponseDto::getUsername)
                .containsExactly("third_user", "second_user", "first_user");
    }

    @Test
    @DisplayName("searchUsers: underscore in the query is matched literally")
    void searchUsers_underscoreIsLiteral() {
        credentialService.register("a_cook", "secret1");
        credentialService.register("abcook", "secret1");

        assertThat(adminService.searchUsers("a_")).extracting(UserResponseDto::getUsername)
                .containsExactly("a_cook");
    }

    @Test
    @DisplayName("systemStats: totals cover active recipes only and rank authors by recipe count")
    void systemStats() {
        credentialService.register("alice", "secret1");
        credentialService.register("bob", "secret1");
        categoryService.addCategory("Soup");

        Long a1 = createRecipe("alice", "A1", List.of());
        createRecipe("alice", "A2", List.of());
        Long b1 = createRecipe("bob", "B1", List.of());
        Long b2 = createRecipe("bob", "B2", List.of());
        recipeViewService.recordView(a1, "carol");
        recipeViewService.recordView(b1, "carol");
        recipeViewService.recordView(b1, "carol");
        recipeService.softDeleteRecipe(b2, "bob");

        SystemStatsDto stats = adminService.systemStats();

        assertEquals(2, stats.getTotalUsers());
        assertEquals(3, stats.getTotalRecipes());
        assertEquals(1, stats.getTotalCategories());
        assertEquals(3, stats.getTotalViews());
        assertEquals(3, stats.getRecentRecipes());
        // 4 creates + 3 views + 1 delete
        assertEquals(8, stats.getRecentEvents());
        assertThat(stats.getTopUsers()).extracting(TopUserDto::getUsername).containsExactly("alice", "bob");
        assertThat(stats.getTopUsers()).extracting(TopUserDto::getRecipeCount).containsExactly(2L, 1L);
        assertThat(stats.getTopUsers()).extracting(TopUserDto::getTotalViews).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("deleteUser: soft-deletes the user's recipes, then removes the account")
    void deleteUser_cascade() {
        credentialService.register("alice", "secret1");
        credentialService.registerAdmin("admin1", "adminpw1", "test-admin-passphrase");
        Long soupId = categoryService.addCategory("Soup");
        Long r1 = createRecipe("alice", "Soup 1", List.of(soupId));
        Long r2 = createRecipe("alice", "Soup 2", List.of(soupId));

        int deleted = adminService.deleteUser("alice", "admin1");

        assertEquals(2, deleted);
        assertThat(credentialService.getUser("alice")).isEmpty();
        assertThat(recipeService.getRecipe(r1)).isEmpty();
        assertThat(recipeService.getRecipe(r2)).isEmpty();
        assertEquals(0, categoryRepository.findById(soupId).orElseThrow().getRecipeCount());
        assertEquals(2, countRows("SELECT COUNT(*) FROM recipes WHERE created_by = 'alice' AND status = 'DELETED'"));
        assertEquals(2, countRows("SELECT COUNT(*) FROM recipe_events WHERE event_type = 'DELETE' AND username = 'admin1'"));
        assertEquals(Role.ADMIN, credentialService.getUser("admin1").orElseThrow().getRole());
    }

    @Test
    @DisplayName("deleteUser: self-deletion and unknown users are refused")
    void deleteUser_refused() {
        credentialService.registerAdmin("admin1", "adminpw1", "test-admin-passphrase");

        CustomException self = assertThrows(CustomException.class, () -> adminService.deleteUser("admin1", "admin1"));
        assertEquals(ErrorCode.CANNOT_DELETE_SELF, self.getErrorCode());

        CustomException missing = assertThrows(CustomException.class, () -> adminService.deleteUser("ghost", "admin1"));
        assertEquals(ErrorCode.USER_NOT_FOUND, missing.getErrorCode());

        assertThat(credentialService.getUser("admin1")).isPresent();
    }

    @Test
    @DisplayName("deleteUser: names are trimmed and validated before the self-deletion check")
    void deleteUser_normalizesNames() {
        credentialService.registerAdmin("admin1", "adminpw1", "test-admin-passphrase");

        CustomException padded = assertThrows(CustomException.class, () -> adminService.deleteUser(" admin1 ", "admin1"));
        assertEquals(ErrorCode.CANNOT_DELETE_SELF, padded.getErrorCode());

        ValidationException blankActor = assertThrows(ValidationException.class, () -> adminService.deleteUser("admin1", "  "));
        assertEquals(ErrorCode.INVALID_USERNAME, blankActor.getErrorCode());

        assertThat(credentialService.getUser("admin1")).isPresent();
    }

    @Test
    @DisplayName("registerAdmin: a wrong passphrase creates no account")
    void registerAdmin_wrongPassphrase() {
        assertThrows(ValidationException.class,
                () -> credentialService.registerAdmin("boss", "adminpw1", "nope"));

        assertThat(credentialService.getUser("boss")).isEmpty();
    }
}
