package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.domain.entity.Category;
import com.jdc.recipe_manager.domain.entity.Recipe;
import com.jdc.recipe_manager.domain.entity.RecipeCategory;
import com.jdc.recipe_manager.domain.repository.CategoryRepository;
import com.jdc.recipe_manager.domain.repository.RecipeCategoryRepository;
import com.jdc.recipe_manager.domain.repository.RecipeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecipeCategoryServiceTest {

    @Mock
    private RecipeCategoryRepository recipeCategoryRepository;

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private RecipeRepository recipeRepository;

    @InjectMocks
    private RecipeCategoryService recipeCategoryService;

    private Recipe recipe;
    private Recipe managedRecipe;

    @BeforeEach
    void setUp() {
        recipe = Recipe.builder().id(1L).title("Stew").instructions("Simmer.").prepTime(60).createdBy("alice").build();
        managedRecipe = Recipe.builder().id(1L).title("Stew").instructions("Simmer.").prepTime(60).createdBy("alice").build();
        lenient().when(recipeRepository.getReferenceById(1L)).thenReturn(managedRecipe);
    }

    private Category category(Long id, String name) {
        return Category.builder().id(id).name(name).build();
    }

    @SuppressWarnings("unchecked")
    private static ArgumentCaptor<Collection<Long>> idsCaptor() {
        return ArgumentCaptor.forClass(Collection.class);
    }

    @Test
    @DisplayName("attachAll: unknown, repeated and null ids are skipped; only linked ids are counted")
    void attachAll_skipsBadIds() {
        when(categoryRepository.findById(1L)).thenReturn(Optional.of(category(1L, "Dinner")));
        when(categoryRepository.findById(99L)).thenReturn(Optional.empty());

        List<Long> skipped = recipeCategoryService.attachAll(recipe, Arrays.asList(1L, 99L, 1L, null));

        assertThat(skipped).containsExactly(99L, 1L, null);
        verify(recipeCategoryRepository, times(1)).save(any(RecipeCategory.class));

        ArgumentCaptor<Collection<Long>> captor = idsCaptor();
        verify(categoryRepository).incrementRecipeCount(captor.capture());
        assertThat(captor.getValue()).containsExactly(1L);
    }

    @Test
    @DisplayName("attachAll: nothing linked means no counter update")
    void attachAll_nothingLinked() {
        when(categoryRepository.findById(42L)).thenReturn(Optional.empty());

        List<Long> skipped = recipeCategoryService.attachAll(recipe, List.of(42L));

        assertThat(skipped).containsExactly(42L);
        verify(categoryRepository, never()).incrementRecipeCount(any());
    }

    @Test
    @DisplayName("replaceAll: only removed links are decremented and only added links incremented")
    void replaceAll_adjustsDifference() {
        when(recipeCategoryRepository.findCategoryIdsByRecipeId(1L)).thenReturn(List.of(1L, 2L));
        when(categoryRepository.findById(2L)).thenReturn(Optional.of(category(2L, "Lunch")));
        when(categoryRepository.findById(3L)).thenReturn(Optional.of(category(3L, "Soup")));

        List<Long> skipped = recipeCategoryService.replaceAll(recipe, List.of(2L, 3L));

        assertThat(skipped).isEmpty();
        verify(recipeCategoryRepository).deleteByRecipeId(1L);
        verify(recipeCategoryRepository, times(2)).save(any(RecipeCategory.class));

        ArgumentCaptor<Collection<Long>> removed = idsCaptor();
        verify(categoryRepository).decrementRecipeCount(removed.capture());
        assertThat(removed.getValue()).containsExactly(1L);

        ArgumentCaptor<Collection<Long>> added = idsCaptor();
        verify(categoryRepository).incrementRecipeCount(added.capture());
        assertThat(added.getValue()).containsExactly(3L);
    }

    @Test
    @DisplayName("replaceAll: an empty list clears every link and releases every count")
    void replaceAll_emptyClearsAll() {
        when(recipeCategoryRepository.findCategoryIdsByRecipeId(1L)).thenReturn(List.of(4L));

        recipeCategoryService.replaceAll(recipe, List.of());

        verify(recipeCategoryRepository).deleteByRecipeId(1L);
        verify(recipeCategoryRepository, never()).save(any());
        ArgumentCaptor<Collection<Long>> removed = idsCaptor();
        verify(categoryRepository).decrementRecipeCount(removed.capture());
        assertThat(removed.getValue()).containsExactly(4L);
        verify(categoryRepository, never()).incrementRecipeCount(any());
    }

    @Test
    @DisplayName("attachAll: links point at the repository's reference, not the caller's instance")
    void attachAll_usesManagedReference() {
        when(categoryRepository.findById(1L)).thenReturn(Optional.of(category(1L, "Dinner")));

        recipeCategoryService.attachAll(recipe, List.of(1L));

        ArgumentCaptor<RecipeCategory> captor = ArgumentCaptor.forClass(RecipeCategory.class);
        verify(recipeCategoryRepository).save(captor.capture());
        assertThat(captor.getValue().getRecipe()).isSameAs(managedRecipe);
        assertThat(captor.getValue().getId().getRecipeId()).isEqualTo(1L);
        assertThat(captor.getValue().getId().getCategoryId()).isEqualTo(1L);
    }
}
