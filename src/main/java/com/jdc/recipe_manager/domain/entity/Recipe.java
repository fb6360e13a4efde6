package com.jdc.recipe_manager.domain.entity;

import com.jdc.recipe_manager.domain.entity.common.BaseTimeEntity;
import com.jdc.recipe_manager.domain.type.RecipeStatus;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "recipes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Recipe extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 65535)
    private String instructions;

    @Column(name = "prep_time", nullable = false)
    private Integer prepTime;

    @Column(nullable = false)
    @Builder.Default
    private Long views = 0L;

    /** Author username. Not a foreign key so recipes outlive their author. */
    @Column(name = "created_by", nullable = false, length = 50)
    private String createdBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private RecipeStatus status = RecipeStatus.ACTIVE;

    public void update(String title, String instructions, Integer prepTime) {
        this.title = title;
        this.instructions = instructions;
        this.prepTime = prepTime;
    }
}
