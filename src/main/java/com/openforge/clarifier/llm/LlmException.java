package com.openforge.clarifier.llm;

/**
 * Provider call failure tagged with its {@link LlmErrorKind}. Retry policies
 * decide on the kind, never on the message text.
 */
public class LlmException extends RuntimeException {

    private final LlmErrorKind kind;
    private final int httpStatus;

    public LlmException(LlmErrorKind kind, String message) {
        this(kind, message, -1, null);
    }

    public LlmException(LlmErrorKind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    public LlmException(LlmErrorKind kind, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public LlmErrorKind kind() {
        return kind;
    }

    /** HTTP status reported by the provider, or -1 for transport-level failures. */
    public int httpStatus() {
        return httpStatus;
    }

    public boolean retryable() {
        return kind.retryable();
    }
}
