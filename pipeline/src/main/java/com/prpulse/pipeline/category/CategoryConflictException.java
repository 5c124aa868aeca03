package com.prpulse.pipeline.category;

/**
 * Thrown when an organization already has a custom category with the same name,
 * compared case-insensitively.
 */
public class CategoryConflictException extends RuntimeException {

    public CategoryConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
