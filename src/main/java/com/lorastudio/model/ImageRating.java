package com.lorastudio.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Review status a user gives an image. Stored in the project's ratings file
 * under the lower-case wire value.
 */
public enum ImageRating {
    NONE("none"),
    GOOD("good"),
    BAD("bad"),
    NEEDS_EDIT("needs_edit");

    private final String value;

    ImageRating(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a wire value; anything unrecognised is treated as unrated.
     */
    @JsonCreator
    public static ImageRating fromValue(String value) {
        if (value == null) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ImageRating rating : values()) {
            if (rating.value.equals(normalized)) {
                return rating;
            }
        }
        return NONE;
    }
}
