package com.openforge.clarifier.error;

import com.openforge.clarifier.llm.LlmErrorKind;
import org.springframework.http.HttpStatus;

/**
 * Wire-level error codes. Each carries its HTTP status and a distinct
 * user-facing message so callers can render guidance without parsing text.
 */
public enum ErrorCode {

    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Invalid request data"),
    DOMAIN_REQUIRED(HttpStatus.BAD_REQUEST, "Domain is required for new sessions"),
    MIN_QUESTIONS_NOT_MET(HttpStatus.BAD_REQUEST, "Insufficient questions answered to generate"),
    SESSION_COMPLETED(HttpStatus.BAD_REQUEST, "Session is already completed"),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "Authentication required"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Session not found"),
    GENERATION_TIMEOUT(HttpStatus.REQUEST_TIMEOUT, "Generation took too long, please try again"),
    GENERATION_IN_PROGRESS(HttpStatus.CONFLICT, "Generation is already in progress for this session"),
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded"),
    RATE_LIMIT_ERROR(HttpStatus.TOO_MANY_REQUESTS, "The AI service is rate limiting requests, please wait and retry"),
    MISSING_API_KEY(HttpStatus.INTERNAL_SERVER_ERROR, "AI service is not configured"),
    AUTH_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "AI service rejected the configured credentials"),
    SYNTHESIS_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to synthesize the conversation brief"),
    GENERATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to generate output"),
    SESSION_CREATE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to create session"),
    MESSAGE_SAVE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to save message"),
    HISTORY_RETRIEVAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to retrieve conversation history"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

    private final HttpStatus status;
    private final String message;

    ErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus status() {
        return status;
    }

    public String message() {
        return message;
    }

    /**
     * Code reported for a model call that failed for good.
     *
     * @param otherwise code for kinds without a dedicated mapping
     */
    public static ErrorCode forLlmFailure(LlmErrorKind kind, ErrorCode otherwise) {
        return switch (kind) {
            case MISSING_API_KEY -> MISSING_API_KEY;
            case AUTHENTICATION -> AUTH_ERROR;
            case RATE_LIMITED, QUOTA_EXCEEDED -> RATE_LIMIT_ERROR;
            case TIMEOUT -> GENERATION_TIMEOUT;
            default -> otherwise;
        };
    }
}
