package com.jdc.recipe_manager.exception;

public class StorageException extends CustomException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.DATABASE_ERROR, message, cause);
    }
}
