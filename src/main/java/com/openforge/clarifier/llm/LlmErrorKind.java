package com.openforge.clarifier.llm;

/**
 * Classification of a provider failure, decided from the HTTP status or the
 * transport exception type.
 *
 *   retryable: a repeat of the same call may succeed
 *   fatal    : no further call (same or other model) should be made
 */
public enum LlmErrorKind {

    MISSING_API_KEY(false, true),
    AUTHENTICATION(false, true),
    RATE_LIMITED(false, true),
    QUOTA_EXCEEDED(false, true),
    INTERRUPTED(false, true),
    TIMEOUT(true, false),
    NETWORK(true, false),
    SERVICE_UNAVAILABLE(true, false),
    SERVER_ERROR(true, false),
    EMPTY_RESPONSE(true, false),
    BAD_REQUEST(false, false),
    INVALID_RESPONSE(false, false);

    private final boolean retryable;
    private final boolean fatal;

    LlmErrorKind(boolean retryable, boolean fatal) {
        this.retryable = retryable;
        this.fatal = fatal;
    }

    public boolean retryable() {
        return retryable;
    }

    public boolean fatal() {
        return fatal;
    }

    public static LlmErrorKind fromHttpStatus(int status) {
        return switch (status) {
            case 401, 403 -> AUTHENTICATION;
            case 402 -> QUOTA_EXCEEDED;
            case 408, 504 -> TIMEOUT;
            case 429 -> RATE_LIMITED;
            case 503 -> SERVICE_UNAVAILABLE;
            default -> status >= 500 ? SERVER_ERROR : BAD_REQUEST;
        };
    }
}
