package com.deepansh.recall.exception;

/**
 * Invalid thresholds or sizes. Raised at startup only.
 */
public class ConfigurationException extends MemoryException {

    public ConfigurationException(String message) {
        super(message);
    }
}
