package com.jdc.recipe_manager.domain.dto.user;

import com.jdc.recipe_manager.domain.type.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponseDto {
    private Long id;
    private String username;
    private Role role;
    private LocalDateTime createdAt;
    private LocalDateTime lastLogin;
    private Integer recipeCount;
}
