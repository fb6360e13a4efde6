package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.domain.dto.category.CategoryDto;
import com.jdc.recipe_manager.domain.entity.Category;
import com.jdc.recipe_manager.domain.repository.CategoryRepository;
import com.jdc.recipe_manager.exception.StorageException;
import com.jdc.recipe_manager.mapper.CategoryMapper;
import com.jdc.recipe_manager.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryService {

    private final CategoryRepository categoryRepository;

    /**
     * Returns the id of the category with this name, creating it when absent.
     * <p>
     * Runs without an enclosing transaction: when a concurrent caller inserts the same
     * name first, the failed insert rolls back on its own and the winner's row is read back.
     */
    public Long addCategory(String name) {
        String normalized = InputValidator.validateCategoryName(name);

        try {
            Optional<Category> existing = categoryRepository.findByName(normalized);
            if (existing.isPresent()) {
                log.info("Category '{}' already exists (id={})", normalized, existing.get().getId());
                return existing.get().getId();
            }

            try {
                Category saved = categoryRepository.saveAndFlush(Category.builder()
                        .name(normalized)
                        .build());
                log.info("Category '{}' created (id={})", normalized, saved.getId());
                return saved.getId();
            } catch (DataAccessException e) {
                // a losing concurrent insert surfaces as a key violation or a lock failure
                Category winner = categoryRepository.findByName(normalized)
                        .orElseThrow(() -> new StorageException("Failed to add category: " + normalized, e));
                log.info("Category '{}' created concurrently (id={})", normalized, winner.getId());
                return winner.getId();
            }
        } catch (DataAccessException e) {
            log.error("Failed to add category '{}'", normalized, e);
            throw new StorageException("Failed to add category: " + normalized, e);
        }
    }

    public List<CategoryDto> listCategories() {
        try {
            return categoryRepository.findAllByOrderByNameAsc().stream()
                    .map(CategoryMapper::toDto)
                    .toList();
        } catch (DataAccessException e) {
            log.error("Failed to list categories", e);
            return Collections.emptyList();
        }
    }
}
