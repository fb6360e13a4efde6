package com.jdc.recipe_manager.domain.type;

public enum RecipeEventType {
    VIEW, EDIT, DELETE, CREATE
}
