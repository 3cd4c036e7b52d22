package com.openforge.clarifier.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Session phase. Declaration order is the only legal direction of travel:
 * QUESTIONING → GENERATING → COMPLETED, one step at a time.
 */
public enum SessionStatus {

    QUESTIONING,
    GENERATING,
    COMPLETED;

    /** True if {@code next} is exactly one step forward from this status. */
    public boolean canAdvanceTo(SessionStatus next) {
        return next != null && next.ordinal() == ordinal() + 1;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
