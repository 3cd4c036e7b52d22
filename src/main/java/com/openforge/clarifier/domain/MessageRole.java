package com.openforge.clarifier.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageRole {

    USER,
    ASSISTANT;

    /** Role name on the OpenAI-compatible wire ("user" / "assistant"). */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
