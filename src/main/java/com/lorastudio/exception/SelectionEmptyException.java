package com.lorastudio.exception;

/**
 * The selection resolved to zero images, so no run was started.
 */
public class SelectionEmptyException extends RuntimeException {

    public static final String DEFAULT_MESSAGE =
            "No images to caption. Select images, check All, or pick Good/Bad/Needs Edit.";

    public SelectionEmptyException() {
        super(DEFAULT_MESSAGE);
    }
}
