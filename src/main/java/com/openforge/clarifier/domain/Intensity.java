package com.openforge.clarifier.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Questioning style.
 *   BASIC: gentle, single-focus questions
 *   DEEP : rigorous, multi-angle questions (default)
 */
public enum Intensity {

    BASIC("basic"),
    DEEP("deep");

    public static final Intensity DEFAULT = DEEP;

    private final String value;

    Intensity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Intensity fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Intensity must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Intensity intensity : values()) {
            if (intensity.value.equals(normalized)) {
                return intensity;
            }
        }
        throw new IllegalArgumentException("Invalid intensity: " + value + ". Must be one of: basic, deep");
    }
}
