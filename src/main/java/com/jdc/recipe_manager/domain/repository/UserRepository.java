package com.jdc.recipe_manager.domain.repository;

import com.jdc.recipe_manager.domain.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByUsername(String username);

    boolean existsByUsername(String username);

    @Query("SELECT u FROM User u ORDER BY u.createdAt DESC, u.id DESC")
    List<User> findAllNewestFirst();

    /**
     * @param pattern lower-cased LIKE pattern with {@code !} as the escape character
     */
    @Query("SELECT u FROM User u WHERE LOWER(u.username) LIKE :pattern ESCAPE '!' ORDER BY u.username ASC")
    List<User> searchByUsernamePattern(@Param("pattern") String pattern);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.recipeCount = u.recipeCount + 1 WHERE u.username = :username")
    int incrementRecipeCount(@Param("username") String username);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.recipeCount = u.recipeCount - 1 WHERE u.username = :username AND u.recipeCount > 0")
    int decrementRecipeCount(@Param("username") String username);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM User u WHERE u.username = :username")
    int deleteByUsername(@Param("username") String username);
}
