package com.lorastudio.exception;

/**
 * A batch or preview request cannot be turned into a runnable job, for example
 * a concurrency outside 1-8 or a provider without the settings it needs.
 */
public class InvalidBatchConfigurationException extends IllegalArgumentException {

    public InvalidBatchConfigurationException(String message) {
        super(message);
    }
}
