package com.jdc.recipe_manager.mapper;

import com.jdc.recipe_manager.domain.dto.user.UserResponseDto;
import com.jdc.recipe_manager.domain.entity.User;
import com.jdc.recipe_manager.domain.type.Role;

public class UserMapper {

    public static User toEntity(String username, String passwordHash, Role role) {
        return User.builder()
                .username(username)
                .passwordHash(passwordHash)
                .role(role)
                .build();
    }

    // password hash stays inside the store
    public static UserResponseDto toResponseDto(User user) {
        if (user == null) return null;
        return UserResponseDto.builder()
                .id(user.getId())
                .username(user.getUsername())
                .role(user.getRole())
                .createdAt(user.getCreatedAt())
                .lastLogin(user.getLastLogin())
                .recipeCount(user.getRecipeCount())
                .build();
    }
}
