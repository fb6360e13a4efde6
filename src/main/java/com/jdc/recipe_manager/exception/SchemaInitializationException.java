package com.jdc.recipe_manager.exception;

/**
 * Raised when the schema cannot be created or verified. Startup must not continue.
 */
public class SchemaInitializationException extends CustomException {

    public SchemaInitializationException(String message) {
        super(ErrorCode.SCHEMA_INITIALIZATION_FAILED, message);
    }

    public SchemaInitializationException(String message, Throwable cause) {
        super(ErrorCode.SCHEMA_INITIALIZATION_FAILED, message, cause);
    }
}
