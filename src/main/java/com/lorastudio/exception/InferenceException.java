package com.lorastudio.exception;

/**
 * The provider answered but produced no usable caption: an error status, a
 * malformed response, or a non-zero script exit.
 */
public class InferenceException extends CaptionBackendException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
