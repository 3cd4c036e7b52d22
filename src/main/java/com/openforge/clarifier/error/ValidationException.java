package com.openforge.clarifier.error;

/**
 * Input failed a shape, size or enum check. Never retried.
 */
public class ValidationException extends ClarifierException {

    private final String field;

    public ValidationException(String field, String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = field;
    }

    /** Name of the offending input field, e.g. "brief" or "userMessage". */
    public String field() {
        return field;
    }
}
