package com.jdc.recipe_manager.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Read model for per-user view counts. Rows are written by
 * {@link com.jdc.recipe_manager.domain.repository.UserRecipeViewDao}.
 */
@Entity
@Table(name = "user_recipe_views", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"username", "recipe_id"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class UserRecipeView {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String username;

    @Column(name = "recipe_id", nullable = false)
    private Long recipeId;

    @Column(name = "view_count", nullable = false)
    private Integer viewCount;

    @Column(name = "last_viewed", nullable = false)
    private LocalDateTime lastViewed;
}
