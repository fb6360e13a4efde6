package com.jdc.recipe_manager.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

/**
 * Recipe-category link keyed by both ids. Implements {@link Persistable} so a new link is
 * inserted directly instead of being merged against a pre-assigned key.
 */
@Entity
@Table(name = "recipe_categories")
@Getter
@ToString(exclude = {"recipe", "category"})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RecipeCategory implements Persistable<RecipeCategoryId> {

    @EmbeddedId
    private RecipeCategoryId id;

    @MapsId("recipeId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "recipe_id")
    private Recipe recipe;

    @MapsId("categoryId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id")
    private Category category;

    @Transient
    @Builder.Default
    private boolean newLink = true;

    public static RecipeCategory of(Recipe recipe, Category category) {
        return RecipeCategory.builder()
                .id(new RecipeCategoryId(recipe.getId(), category.getId()))
                .recipe(recipe)
                .category(category)
                .build();
    }

    @Override
    public boolean isNew() {
        return newLink;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.newLink = false;
    }
}
