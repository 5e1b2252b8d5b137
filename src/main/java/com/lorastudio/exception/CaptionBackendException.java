package com.lorastudio.exception;

/**
 * Raised inside a backend adapter when a caption cannot be produced. Adapters
 * convert it into a failed {@link com.lorastudio.model.CaptionResult}; it
 * never escapes the adapter boundary.
 */
public class CaptionBackendException extends Exception {

    public CaptionBackendException(String message) {
        super(message);
    }

    public CaptionBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
