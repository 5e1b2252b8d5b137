package com.lorastudio.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The captioning providers the service can dispatch to.
 */
public enum ProviderType {
    LM_STUDIO("lm_studio", true),
    OLLAMA("ollama", true),
    WD14("wd14", false),
    JOYCAPTION("joycaption", true),
    HYBRID("hybrid", false);

    private final String value;
    private final boolean nativeBatch;

    ProviderType(String value, boolean nativeBatch) {
        this.value = value;
        this.nativeBatch = nativeBatch;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * True when the provider's adapter accepts a whole chunk in one call.
     */
    public boolean isNativeBatch() {
        return nativeBatch;
    }

    @JsonCreator
    public static ProviderType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.value.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown caption provider: " + value);
    }
}
