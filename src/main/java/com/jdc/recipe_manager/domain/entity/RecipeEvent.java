package com.jdc.recipe_manager.domain.entity;

import com.jdc.recipe_manager.domain.type.RecipeEventType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Append-only audit row. {@code recipeId} is a plain column so the row survives
 * removal of the recipe (the foreign key nulls it out).
 */
@Entity
@Table(name = "recipe_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RecipeEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "recipe_id")
    private Long recipeId;

    @Column(nullable = false, length = 50)
    private String username;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 20)
    private RecipeEventType eventType;

    @CreationTimestamp
    @Column(name = "event_time", nullable = false, updatable = false)
    private LocalDateTime eventTime;
}
