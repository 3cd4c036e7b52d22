package com.openforge.clarifier.config;

import com.openforge.clarifier.llm.LlmErrorKind;
import com.openforge.clarifier.llm.LlmException;
import com.openforge.clarifier.llm.LlmProperties;
import com.openforge.clarifier.llm.LlmProperties.CallProfile;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named retry instance per kind of model call:
 *   • "conversationLlm" : any transient failure, short capped back-off
 *   • "synthesisLlm"    : timeouts, network, 429 and 503
 *   • "generationLlm"   : timeouts, network and 503; other failures move to the fallback model
 *
 * Attempt counts and back-off come from the matching clarifier.llm.* profile.
 */
@Configuration
public class Resilience4jConfig {

    public static final String CONVERSATION = "conversationLlm";
    public static final String SYNTHESIS    = "synthesisLlm";
    public static final String GENERATION   = "generationLlm";

    static final Set<LlmErrorKind> SYNTHESIS_RETRYABLE = EnumSet.of(
            LlmErrorKind.TIMEOUT, LlmErrorKind.NETWORK,
            LlmErrorKind.RATE_LIMITED, LlmErrorKind.SERVICE_UNAVAILABLE);

    static final Set<LlmErrorKind> GENERATION_RETRYABLE = EnumSet.of(
            LlmErrorKind.TIMEOUT, LlmErrorKind.NETWORK, LlmErrorKind.SERVICE_UNAVAILABLE);

    // ── Registry ─────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry(LlmProperties properties) {
        RetryRegistry registry = RetryRegistry.ofDefaults();
        registry.retry(CONVERSATION, retryConfig(properties.conversation(), LlmErrorKind::retryable));
        registry.retry(SYNTHESIS,    retryConfig(properties.synthesis(),    SYNTHESIS_RETRYABLE::contains));
        registry.retry(GENERATION,   retryConfig(properties.generation(),   GENERATION_RETRYABLE::contains));
        return registry;
    }

    @Bean
    public Retry conversationLlmRetry(RetryRegistry registry) {
        return registry.retry(CONVERSATION);
    }

    @Bean
    public Retry synthesisLlmRetry(RetryRegistry registry) {
        return registry.retry(SYNTHESIS);
    }

    @Bean
    public Retry generationLlmRetry(RetryRegistry registry) {
        return registry.retry(GENERATION);
    }

    // ── Factories ────────────────────────────────────────────────────────────

    /**
     * Builds a retry config from a call profile. Only {@link LlmException}s whose
     * kind passes {@code retryOn} are retried; anything else propagates at once.
     */
    private static RetryConfig retryConfig(CallProfile profile, Predicate<LlmErrorKind> retryOn) {
        if (profile == null) {
            throw new IllegalStateException("LLM call profile is not configured");
        }
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, profile.maxAttempts()))
                .intervalFunction(backoff(profile))
                .retryOnException(e -> e instanceof LlmException le && retryOn.test(le.kind()))
                .failAfterMaxAttempts(false)
                .build();
    }

    private static IntervalFunction backoff(CallProfile profile) {
        Duration initial = profile.initialBackoff() == null ? Duration.ofSeconds(1) : profile.initialBackoff();
        if (initial.isZero() || initial.isNegative()) {
            // resilience4j rejects a zero interval; 1 ms is effectively immediate
            initial = Duration.ofMillis(1);
        }
        double multiplier = profile.backoffMultiplier() < 1.0 ? 1.0 : profile.backoffMultiplier();
        if (profile.maxBackoff() == null) {
            return IntervalFunction.ofExponentialBackoff(initial, multiplier);
        }
        return IntervalFunction.ofExponentialBackoff(initial, multiplier, profile.maxBackoff());
    }
}
