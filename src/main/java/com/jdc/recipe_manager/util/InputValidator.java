package com.jdc.recipe_manager.util;

import com.jdc.recipe_manager.domain.dto.ingredient.RecipeIngredientRequestDto;
import com.jdc.recipe_manager.exception.ErrorCode;
import com.jdc.recipe_manager.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Pure input checks. Each method returns the normalized (trimmed) value or throws
 * {@link ValidationException} carrying the reason. Nothing here touches storage.
 */
public final class InputValidator {

    public static final int USERNAME_MIN = 3;
    public static final int USERNAME_MAX = 50;
    public static final int PASSWORD_MIN = 6;
    public static final int PASSWORD_MAX = 100;
    public static final int TITLE_MAX = 200;
    public static final int INSTRUCTIONS_MAX = 65_535;
    public static final int PREP_TIME_MAX = 1440;
    public static final int INGREDIENT_NAME_MAX = 100;
    public static final int QUANTITY_MAX = 50;
    public static final int CATEGORY_NAME_MAX = 100;

    private static final Pattern USERNAME_CHARS = Pattern.compile("^[A-Za-z0-9_-]+$");

    private InputValidator() {
    }

    public static String validateUsername(String username) {
        if (username == null || username.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_USERNAME, "Username cannot be empty");
        }
        String trimmed = username.trim();
        if (trimmed.length() < USERNAME_MIN) {
            throw new ValidationException(ErrorCode.INVALID_USERNAME, "Username must be at least 3 characters long");
        }
        if (trimmed.length() > USERNAME_MAX) {
            throw new ValidationException(ErrorCode.INVALID_USERNAME, "Username cannot exceed 50 characters");
        }
        if (!USERNAME_CHARS.matcher(trimmed).matches()) {
            throw new ValidationException(ErrorCode.INVALID_USERNAME,
                    "Username can only contain letters, numbers, underscores, and hyphens");
        }
        return trimmed;
    }

    /** Passwords are checked as typed; surrounding whitespace is significant. */
    public static String validatePassword(String password) {
        if (password == null || password.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_PASSWORD, "Password cannot be empty");
        }
        if (password.length() < PASSWORD_MIN) {
            throw new ValidationException(ErrorCode.INVALID_PASSWORD, "Password must be at least 6 characters long");
        }
        if (password.length() > PASSWORD_MAX) {
            throw new ValidationException(ErrorCode.INVALID_PASSWORD, "Password cannot exceed 100 characters");
        }
        return password;
    }

    public static String validateRecipeTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_RECIPE_TITLE, "Recipe title cannot be empty");
        }
        String trimmed = title.trim();
        if (trimmed.length() > TITLE_MAX) {
            throw new ValidationException(ErrorCode.INVALID_RECIPE_TITLE, "Recipe title cannot exceed 200 characters");
        }
        return trimmed;
    }

    public static String validateInstructions(String instructions) {
        if (instructions == null || instructions.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_INSTRUCTIONS, "Instructions cannot be empty");
        }
        String trimmed = instructions.trim();
        if (trimmed.length() > INSTRUCTIONS_MAX) {
            throw new ValidationException(ErrorCode.INVALID_INSTRUCTIONS,
                    "Instructions are too long (maximum 65,535 characters)");
        }
        return trimmed;
    }

    public static int validatePrepTime(String prepTime) {
        if (prepTime == null || prepTime.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_PREP_TIME, "Preparation time cannot be empty");
        }
        int minutes;
        try {
            minutes = Integer.parseInt(prepTime.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(ErrorCode.INVALID_PREP_TIME, "Preparation time must be a valid number");
        }
        if (minutes <= 0) {
            throw new ValidationException(ErrorCode.INVALID_PREP_TIME, "Preparation time must be a positive number");
        }
        if (minutes > PREP_TIME_MAX) {
            throw new ValidationException(ErrorCode.INVALID_PREP_TIME,
                    "Preparation time cannot exceed 24 hours (1440 minutes)");
        }
        return minutes;
    }

    /**
     * A missing quantity is stored as an empty string.
     */
    public static RecipeIngredientRequestDto validateIngredient(String name, String quantity) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_INGREDIENT, "Ingredient name cannot be empty");
        }
        String trimmedName = name.trim();
        if (trimmedName.length() > INGREDIENT_NAME_MAX) {
            throw new ValidationException(ErrorCode.INVALID_INGREDIENT,
                    "Ingredient name is too long (maximum 100 characters)");
        }
        String trimmedQuantity = quantity == null ? "" : quantity.trim();
        if (trimmedQuantity.length() > QUANTITY_MAX) {
            throw new ValidationException(ErrorCode.INVALID_INGREDIENT,
                    "Quantity description is too long (maximum 50 characters)");
        }
        return RecipeIngredientRequestDto.of(trimmedName, trimmedQuantity);
    }

    public static String validateCategoryName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_CATEGORY_NAME, "Category name cannot be empty");
        }
        String trimmed = name.trim();
        if (trimmed.length() > CATEGORY_NAME_MAX) {
            throw new ValidationException(ErrorCode.INVALID_CATEGORY_NAME,
                    "Category name is too long (maximum 100 characters)");
        }
        return trimmed;
    }
}
