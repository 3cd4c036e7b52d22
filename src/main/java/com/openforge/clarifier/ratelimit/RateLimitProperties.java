package com.openforge.clarifier.ratelimit;

import com.openforge.clarifier.domain.Tier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tier quota table, read from application.yml under "clarifier.rate-limit":
 *
 * clarifier:
 *   rate-limit:
 *     tiers:
 *       free: 10
 *       pro: 999999
 *     retry-after-seconds: 86400
 */
@ConfigurationProperties(prefix = "clarifier.rate-limit")
public record RateLimitProperties(
        Map<Tier, Integer> tiers,
        @DefaultValue("86400") long retryAfterSeconds
) {

    public static final int DEFAULT_FREE_SESSIONS = 10;
    public static final int DEFAULT_PRO_SESSIONS = 999_999;

    public RateLimitProperties {
        Map<Tier, Integer> table = new EnumMap<>(Tier.class);
        table.put(Tier.FREE, DEFAULT_FREE_SESSIONS);
        table.put(Tier.PRO, DEFAULT_PRO_SESSIONS);
        if (tiers != null) {
            table.putAll(tiers);
        }
        tiers = Map.copyOf(table);
    }

    public static RateLimitProperties defaults() {
        return new RateLimitProperties(null, 86_400);
    }

    /** Session quota for a tier; tiers missing from the table get the free quota. */
    public int limitFor(Tier tier) {
        Integer limit = tier == null ? null : tiers.get(tier);
        return limit != null ? limit : tiers.get(Tier.FREE);
    }
}
