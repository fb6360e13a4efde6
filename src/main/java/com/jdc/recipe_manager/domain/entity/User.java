package com.jdc.recipe_manager.domain.entity;

import com.jdc.recipe_manager.domain.entity.common.BaseTimeEntity;
import com.jdc.recipe_manager.domain.type.Role;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class User extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Role role = Role.USER;

    @Column(name = "last_login")
    private LocalDateTime lastLogin;

    /** Active recipes authored by this user; maintained by bulk updates only. */
    @Column(name = "recipe_count", nullable = false)
    @Builder.Default
    private Integer recipeCount = 0;

    public void recordLogin(LocalDateTime loginTime) {
        this.lastLogin = loginTime;
    }
}
