package com.deepansh.recall.exception;

/**
 * Lost a race on a per-user buffer or a per-fact-triple write.
 * Retried immediately a bounded number of times.
 */
public class ConcurrencyConflictException extends MemoryException {

    public ConcurrencyConflictException(String message) {
        super(message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
