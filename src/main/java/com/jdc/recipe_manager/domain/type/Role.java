package com.jdc.recipe_manager.domain.type;

public enum Role {
    USER, ADMIN
}
