package com.jdc.recipe_manager.exception;

import lombok.Getter;

@Getter
public enum ErrorCode {

    // --- User (100) ---
    USER_NOT_FOUND("101", "User not found."),
    DUPLICATE_USERNAME("102", "Username already exists"),
    INVALID_USERNAME("103", "Invalid username."),
    INVALID_PASSWORD("104", "Invalid password."),
    INVALID_ADMIN_PASSPHRASE("105", "Invalid admin passphrase."),
    ADMIN_REGISTRATION_DISABLED("106", "Admin registration is disabled."),
    CANNOT_DELETE_SELF("107", "You cannot delete your own account."),

    // --- Recipe (200) ---
    RECIPE_NOT_FOUND("201", "Recipe not found."),
    INVALID_RECIPE_TITLE("202", "Invalid recipe title."),
    INVALID_INSTRUCTIONS("203", "Invalid instructions."),
    INVALID_PREP_TIME("204", "Invalid preparation time."),

    // --- Category (300) ---
    INVALID_CATEGORY_NAME("301", "Invalid category name."),

    // --- Ingredient (400) ---
    INVALID_INGREDIENT("401", "Invalid ingredient."),
    INGREDIENT_REQUIRED("402", "At least one valid ingredient is required."),

    // --- Common (900) ---
    INVALID_INPUT_VALUE("901", "Invalid input value."),
    DATABASE_ERROR("902", "Database operation failed."),
    SCHEMA_INITIALIZATION_FAILED("903", "Database schema initialization failed."),
    ;

    private final String code;
    private final String message;

    ErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }
}
