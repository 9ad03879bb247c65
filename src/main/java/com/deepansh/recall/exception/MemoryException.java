package com.deepansh.recall.exception;

/**
 * Root of the memory engine's error taxonomy.
 * Unchecked: callers on the request path degrade instead of declaring these.
 */
public class MemoryException extends RuntimeException {

    public MemoryException(String message) {
        super(message);
    }

    public MemoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
