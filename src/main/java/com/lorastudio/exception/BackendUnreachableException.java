package com.lorastudio.exception;

/**
 * The inference server could not be reached, or the provider process could
 * not be started.
 */
public class BackendUnreachableException extends CaptionBackendException {

    public BackendUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
