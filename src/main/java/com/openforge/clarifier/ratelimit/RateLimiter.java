package com.openforge.clarifier.ratelimit;

import com.openforge.clarifier.domain.Tier;
import com.openforge.clarifier.domain.UsageProfile;
import com.openforge.clarifier.repository.UsageProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Tier-based session quota.
 *
 *   checkRateLimit : gate for creating a new session; never throws, denies on doubt
 *   incrementUsage : called once per completed generation; atomic at the store layer
 *
 * Profiles are created lazily. Two requests racing to create the same profile
 * are resolved by the unique constraint on user_id: the loser re-reads (check)
 * or falls back to the atomic update (increment).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiter {

    private final UsageProfileRepository profileRepository;
    private final RateLimitProperties    properties;

    /**
     * A user without a profile gets a fresh free-tier one.
     */
    public RateLimitResult checkRateLimit(String userId) {
        if (userId == null || userId.isBlank()) {
            log.warn("[RateLimit] Rejecting check for empty userId");
            return RateLimitResult.conservativeDeny();
        }
        try {
            UsageProfile profile = profileRepository.findByUserId(userId)
                    .orElseGet(() -> createProfile(userId));

            Tier tier  = profile.effectiveTier();
            int  usage = profile.getUsageCount() == null ? 0 : profile.getUsageCount();
            RateLimitResult result = RateLimitResult.evaluate(usage, properties.limitFor(tier), tier);

            log.debug("[RateLimit] userId={} tier={} usage={} limit={} allowed={}",
                    userId, tier.value(), usage, result.limit(), result.allowed());
            return result;
        } catch (RuntimeException e) {
            log.error("[RateLimit] Check failed for userId={}, denying: {}", userId, e.getMessage(), e);
            return RateLimitResult.conservativeDeny();
        }
    }

    /**
     * Adds one completed session to the user's counter.
     * Errors are returned, not thrown, so callers can treat the increment as best-effort.
     */
    public UsageIncrement incrementUsage(String userId) {
        if (userId == null || userId.isBlank()) {
            return UsageIncrement.failed(new IllegalArgumentException("Invalid userId provided"));
        }
        try {
            if (profileRepository.incrementUsageCount(userId) == 0) {
                try {
                    profileRepository.saveAndFlush(UsageProfile.initial(userId, Tier.FREE, 1));
                } catch (DataIntegrityViolationException race) {
                    log.debug("[RateLimit] Profile for userId={} created concurrently, incrementing instead", userId);
                    profileRepository.incrementUsageCount(userId);
                }
            }
            Optional<UsageProfile> updated = profileRepository.findByUserId(userId);
            if (updated.isEmpty()) {
                return UsageIncrement.failed(new IllegalStateException("Profile not found after increment: " + userId));
            }
            log.info("[RateLimit] userId={} usage now {}", userId, updated.get().getUsageCount());
            return UsageIncrement.of(updated.get());
        } catch (RuntimeException e) {
            log.error("[RateLimit] Usage increment failed for userId={}: {}", userId, e.getMessage());
            return UsageIncrement.failed(e);
        }
    }

    private UsageProfile createProfile(String userId) {
        try {
            UsageProfile created = profileRepository.saveAndFlush(UsageProfile.initial(userId, Tier.FREE, 0));
            log.info("[RateLimit] Created free-tier usage profile for userId={}", userId);
            return created;
        } catch (DataIntegrityViolationException race) {
            return profileRepository.findByUserId(userId).orElseThrow(() -> race);
        }
    }
}
