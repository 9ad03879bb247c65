package com.deepansh.recall.retrieval;

/**
 * Whether stage 2 contributed to a bundle, and if not, why.
 */
public enum SemanticStatus {
    OK,
    SKIPPED_ERROR,
    SKIPPED_TIMEOUT,
    DISABLED
}
