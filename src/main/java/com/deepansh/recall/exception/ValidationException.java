package com.deepansh.recall.exception;

/**
 * Malformed candidate fact or category. Rejected without mutation, never retried.
 */
public class ValidationException extends MemoryException {

    public ValidationException(String message) {
        super(message);
    }
}
