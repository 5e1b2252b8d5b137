package com.lorastudio.prompt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Requested caption length, rendered as a one-sentence hint.
 */
public enum CaptionLength {
    VERY_SHORT("very_short", "very short"),
    SHORT("short", "short"),
    MEDIUM_LENGTH("medium_length", "medium-length"),
    LONG("long", "long"),
    VERY_LONG("very_long", "very long");

    private final String value;
    private final String phrase;

    CaptionLength(String value, String phrase) {
        this.value = value;
        this.phrase = phrase;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getHint() {
        return "Write a " + phrase + " caption.";
    }

    @JsonCreator
    public static CaptionLength fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (CaptionLength length : values()) {
            if (length.value.equals(normalized)) {
                return length;
            }
        }
        throw new IllegalArgumentException("Unknown caption length: " + value);
    }
}
