package com.jdc.recipe_manager.domain.repository;

import com.jdc.recipe_manager.domain.dto.stats.TopUserDto;
import com.jdc.recipe_manager.domain.entity.Recipe;
import com.jdc.recipe_manager.domain.type.RecipeStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface RecipeRepository extends JpaRepository<Recipe, Long> {

    Optional<Recipe> findByIdAndStatus(Long id, RecipeStatus status);

    @Query("SELECT r FROM Recipe r WHERE r.status = :status ORDER BY r.createdAt DESC, r.id DESC")
    List<Recipe> findLatestByStatus(@Param("status") RecipeStatus status, Pageable pageable);

    @Query("SELECT r FROM Recipe r WHERE r.status = :status ORDER BY r.views DESC, r.id DESC")
    List<Recipe> findMostViewedByStatus(@Param("status") RecipeStatus status, Pageable pageable);

    @Query("""
            SELECT r FROM RecipeCategory rc JOIN rc.recipe r
            WHERE rc.category.id = :categoryId AND r.status = :status
            ORDER BY r.createdAt DESC, r.id DESC
            """)
    List<Recipe> findByCategoryIdAndStatus(@Param("categoryId") Long categoryId,
                                           @Param("status") RecipeStatus status);

    @Query("SELECT r FROM Recipe r WHERE r.createdBy = :username AND r.status = :status ORDER BY r.createdAt DESC, r.id DESC")
    List<Recipe> findByAuthorAndStatus(@Param("username") String username, @Param("status") RecipeStatus status);

    long countByStatus(RecipeStatus status);

    long countByStatusAndCreatedAtGreaterThanEqual(RecipeStatus status, LocalDateTime since);

    @Query("SELECT SUM(r.views) FROM Recipe r WHERE r.status = :status")
    Long sumViewsByStatus(@Param("status") RecipeStatus status);

    @Query("""
            SELECT new com.jdc.recipe_manager.domain.dto.stats.TopUserDto(r.createdBy, COUNT(r), SUM(r.views))
            FROM Recipe r
            WHERE r.status = :status
            GROUP BY r.createdBy
            ORDER BY COUNT(r) DESC, r.createdBy ASC
            """)
    List<TopUserDto> findTopAuthors(@Param("status") RecipeStatus status, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Recipe r SET r.views = r.views + 1 WHERE r.id = :id AND r.status = :status")
    int incrementViews(@Param("id") Long id, @Param("status") RecipeStatus status);

    /**
     * Conditional status flip. Returns 0 when the recipe is missing or already in {@code to}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Recipe r SET r.status = :to WHERE r.id = :id AND r.status = :from")
    int updateStatus(@Param("id") Long id, @Param("from") RecipeStatus from, @Param("to") RecipeStatus to);
}
