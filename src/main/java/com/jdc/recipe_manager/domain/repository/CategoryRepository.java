package com.jdc.recipe_manager.domain.repository;

import com.jdc.recipe_manager.domain.entity.Category;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CategoryRepository extends JpaRepository<Category, Long> {

    Optional<Category> findByName(String name);

    List<Category> findAllByOrderByNameAsc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Category c SET c.recipeCount = c.recipeCount + 1 WHERE c.id IN :ids")
    int incrementRecipeCount(@Param("ids") Collection<Long> ids);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Category c SET c.recipeCount = c.recipeCount - 1 WHERE c.id IN :ids AND c.recipeCount > 0")
    int decrementRecipeCount(@Param("ids") Collection<Long> ids);
}
