package com.deepansh.recall.exception;

/**
 * An external collaborator (summarizer, embedder, extractor, store) is unavailable
 * or returned something unusable. Retried with bounded attempts.
 */
public class TransientDependencyException extends MemoryException {

    public TransientDependencyException(String message) {
        super(message);
    }

    public TransientDependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
