package com.openforge.clarifier.error;

import com.openforge.clarifier.ratelimit.RateLimitResult;

/**
 * A new session was refused because the caller's quota is used up.
 */
public class RateLimitExceededException extends ClarifierException {

    private final RateLimitResult result;

    public RateLimitExceededException(RateLimitResult result) {
        super(ErrorCode.RATE_LIMIT_EXCEEDED,
                "%d of %d sessions used".formatted(result.limit() - result.remaining(), result.limit()));
        this.result = result;
    }

    public RateLimitResult result() {
        return result;
    }
}
