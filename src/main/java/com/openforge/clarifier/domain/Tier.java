package com.openforge.clarifier.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Usage quota class of a user.
 */
public enum Tier {

    FREE,
    PRO;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of a stored tier. Legacy "premium" rows map to PRO;
     * anything unknown or missing falls back to FREE.
     */
    public static Tier normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return FREE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "pro", "premium" -> PRO;
            default -> FREE;
        };
    }
}
