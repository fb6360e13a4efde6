package com.jdc.recipe_manager.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.io.Serializable;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@EqualsAndHashCode
public class RecipeCategoryId implements Serializable {

    @Column(name = "recipe_id")
    private Long recipeId;

    @Column(name = "category_id")
    private Long categoryId;
}
