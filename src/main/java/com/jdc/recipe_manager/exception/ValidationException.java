package com.jdc.recipe_manager.exception;

/**
 * Rejected input. The message is the human-readable reason shown to the caller.
 */
public class ValidationException extends CustomException {

    public ValidationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
