package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.domain.dto.category.CategoryDto;
import com.jdc.recipe_manager.domain.entity.Category;
import com.jdc.recipe_manager.domain.repository.CategoryRepository;
import com.jdc.recipe_manager.exception.StorageException;
import com.jdc.recipe_manager.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CategoryServiceTest {

    @Mock
    private CategoryRepository categoryRepository;

    @InjectMocks
    private CategoryService categoryService;

    @Test
    @DisplayName("addCategory: an existing name returns the existing id without inserting")
    void addCategory_existing() {
        Category dessert = Category.builder().id(7L).name("Dessert").build();
        when(categoryRepository.findByName("Dessert")).thenReturn(Optional.of(dessert));

        Long id = categoryService.addCategory("  Dessert ");

        assertEquals(7L, id);
        verify(categoryRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("addCategory: a new name is inserted trimmed with a zero count")
    void addCategory_new() {
        when(categoryRepository.findByName("Soup")).thenReturn(Optional.empty());
        when(categoryRepository.saveAndFlush(any(Category.class)))
                .thenReturn(Category.builder().id(3L).name("Soup").build());

        Long id = categoryService.addCategory("Soup ");

        assertEquals(3L, id);
        ArgumentCaptor<Category> captor = ArgumentCaptor.forClass(Category.class);
        verify(categoryRepository).saveAndFlush(captor.capture());
        assertEquals("Soup", captor.getValue().getName());
        assertEquals(0, captor.getValue().getRecipeCount());
    }

    @Test
    @DisplayName("addCategory: losing an insert race returns the id of the row that won")
    void addCategory_lostRace() {
        when(categoryRepository.findByName("Soup"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(Category.builder().id(5L).name("Soup").build()));
        when(categoryRepository.saveAndFlush(any(Category.class)))
                .thenThrow(new DataIntegrityViolationException("uk_categories_name"));

        Long id = categoryService.addCategory("Soup");

        assertEquals(5L, id);
        verify(categoryRepository, times(2)).findByName("Soup");
    }

    @Test
    @DisplayName("addCategory: a failed insert with no row to fall back on is a storage error")
    void addCategory_insertFailsWithoutWinner() {
        when(categoryRepository.findByName("Soup")).thenReturn(Optional.empty());
        when(categoryRepository.saveAndFlush(any(Category.class)))
                .thenThrow(new DataAccessResourceFailureException("connection lost"));

        assertThrows(StorageException.class, () -> categoryService.addCategory("Soup"));
    }

    @Test
    @DisplayName("addCategory: a blank name is rejected before touching storage")
    void addCategory_blank() {
        assertThrows(ValidationException.class, () -> categoryService.addCategory("  "));
        verifyNoInteractions(categoryRepository);
    }

    @Test
    @DisplayName("listCategories: storage failure degrades to an empty list")
    void listCategories_storageFailure() {
        when(categoryRepository.findAllByOrderByNameAsc())
                .thenThrow(new DataAccessResourceFailureException("connection lost"));

        List<CategoryDto> result = categoryService.listCategories();

        assertThat(result).isEmpty();
    }
}
