package com.openforge.clarifier.error;

/**
 * Classified failure of a chat request. The {@link ErrorCode} decides the HTTP
 * status and message; {@code details} is optional diagnostic text.
 */
public class ClarifierException extends RuntimeException {

    private final ErrorCode code;
    private final String details;

    public ClarifierException(ErrorCode code) {
        this(code, null, null);
    }

    public ClarifierException(ErrorCode code, String details) {
        this(code, details, null);
    }

    public ClarifierException(ErrorCode code, String details, Throwable cause) {
        super(details == null ? code.message() : code.message() + ": " + details, cause);
        this.code = code;
        this.details = details;
    }

    public ErrorCode code() {
        return code;
    }

    public String details() {
        return details;
    }
}
