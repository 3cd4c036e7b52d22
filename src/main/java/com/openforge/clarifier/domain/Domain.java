package com.openforge.clarifier.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Topic category of a session. Selects the questioning persona and the kind
 * of artifact produced at the end.
 */
public enum Domain {

    BUSINESS("business", "business ideas"),
    PRODUCT("product", "feature specifications"),
    CREATIVE("creative", "story outlines"),
    RESEARCH("research", "research proposal"),
    CODING("coding", "technical specification");

    private final String value;
    private final String artifact;

    Domain(String value, String artifact) {
        this.value = value;
        this.artifact = artifact;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Human-readable name of what generation produces for this domain. */
    public String artifact() {
        return artifact;
    }

    @JsonCreator
    public static Domain fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Domain must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Domain domain : values()) {
            if (domain.value.equals(normalized)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Invalid domain: %s. Must be one of: %s"
                .formatted(value, Arrays.stream(values()).map(Domain::value).collect(Collectors.joining(", "))));
    }
}
