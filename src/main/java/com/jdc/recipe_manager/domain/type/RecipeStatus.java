package com.jdc.recipe_manager.domain.type;

public enum RecipeStatus {
    ACTIVE, DELETED
}
