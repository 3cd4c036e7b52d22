package com.openforge.clarifier.ratelimit;

import com.openforge.clarifier.domain.UsageProfile;

/**
 * Result of {@link RateLimiter#incrementUsage}: exactly one of the two fields is set.
 */
public record UsageIncrement(UsageProfile updatedProfile, Exception error) {

    public static UsageIncrement of(UsageProfile profile) {
        return new UsageIncrement(profile, null);
    }

    public static UsageIncrement failed(Exception error) {
        return new UsageIncrement(null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
