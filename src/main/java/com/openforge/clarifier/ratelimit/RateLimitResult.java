package com.openforge.clarifier.ratelimit;

import com.openforge.clarifier.domain.Tier;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a quota check.
 */
public record RateLimitResult(
        boolean allowed,
        int remaining,
        int limit,
        Tier tier
) {

    public static RateLimitResult evaluate(int usageCount, int limit, Tier tier) {
        return new RateLimitResult(usageCount < limit, Math.max(0, limit - usageCount), limit, tier);
    }

    /** Returned whenever the store cannot be trusted: deny, nothing left, no quota. */
    public static RateLimitResult conservativeDeny() {
        return new RateLimitResult(false, 0, 0, Tier.FREE);
    }

    /**
     * Quota headers for a 429 response. Session quotas never reset, so
     * Retry-After is a fixed long interval.
     */
    public Map<String, String> headers(long retryAfterSeconds) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-RateLimit-Limit", String.valueOf(limit));
        headers.put("X-RateLimit-Remaining", String.valueOf(remaining));
        headers.put("X-RateLimit-Tier", tier.value());
        headers.put("Retry-After", String.valueOf(retryAfterSeconds));
        return headers;
    }
}
