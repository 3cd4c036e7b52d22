package com.openforge.clarifier.error;

import com.openforge.clarifier.chat.dto.ErrorResponse;
import com.openforge.clarifier.llm.LlmException;
import com.openforge.clarifier.ratelimit.RateLimitProperties;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps every failure of the chat API onto {@link ErrorResponse} with the
 * status of its {@link ErrorCode}. Details reach the body only for client
 * errors that did not come from a model call; server errors, model failures
 * and unclassified exceptions are reported by code and message alone.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final int MAX_DETAIL_CHARS = 300;

    private final RateLimitProperties rateLimitProperties;

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException ex, HttpServletRequest request) {
        log.warn("[Api] path={} code={} tier={} limit={}",
                request.getRequestURI(), ex.code(), ex.result().tier().value(), ex.result().limit());
        HttpHeaders headers = new HttpHeaders();
        ex.result().headers(rateLimitProperties.retryAfterSeconds()).forEach(headers::set);
        return ResponseEntity.status(ex.code().status())
                .headers(headers)
                .body(ErrorResponse.rateLimited(ex.result()));
    }

    @ExceptionHandler(ClarifierException.class)
    public ResponseEntity<ErrorResponse> handleClarifier(ClarifierException ex, HttpServletRequest request) {
        if (ex.code().status().is5xxServerError()) {
            log.error("[Api] path={} code={} details={}", request.getRequestURI(), ex.code(), ex.details(), ex);
        } else {
            log.warn("[Api] path={} code={} details={}", request.getRequestURI(), ex.code(), ex.details());
        }
        return respond(ex.code(), exposesDetails(ex) ? truncate(ex.details()) : null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        log.warn("[Api] path={} code={} details={}", request.getRequestURI(), ErrorCode.VALIDATION_ERROR, details);
        return respond(ErrorCode.VALIDATION_ERROR, details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        Throwable cause = ex.getMostSpecificCause();
        String details = truncate(cause.getMessage());
        log.warn("[Api] path={} code={} details={}", request.getRequestURI(), ErrorCode.VALIDATION_ERROR, details);
        return respond(ErrorCode.VALIDATION_ERROR, details);
    }

    /** Lost the race to claim a session for generation. */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException ex,
                                                              HttpServletRequest request) {
        log.warn("[Api] path={} code={} error={}",
                request.getRequestURI(), ErrorCode.GENERATION_IN_PROGRESS, ex.getMessage());
        return respond(ErrorCode.GENERATION_IN_PROGRESS, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("[Api] path={} code={} type={} error={}", request.getRequestURI(), ErrorCode.INTERNAL_ERROR,
                ex.getClass().getSimpleName(), truncate(ex.getMessage()), ex);
        return respond(ErrorCode.INTERNAL_ERROR, null);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static ResponseEntity<ErrorResponse> respond(ErrorCode code, String details) {
        return ResponseEntity.status(code.status()).body(ErrorResponse.of(code, details));
    }

    /** Model failures carry the provider's response body in their details. */
    static boolean exposesDetails(ClarifierException ex) {
        return !ex.code().status().is5xxServerError() && !(ex.getCause() instanceof LlmException);
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_DETAIL_CHARS) {
            return text;
        }
        return text.substring(0, MAX_DETAIL_CHARS);
    }
}
