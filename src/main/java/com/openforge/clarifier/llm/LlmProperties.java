package com.openforge.clarifier.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Externalised LLM provider configuration.
 *
 * Reads from application.yml under the "clarifier.llm" prefix:
 *
 * clarifier:
 *   llm:
 *     base-url: https://openrouter.ai/api/v1
 *     api-key: ${OPENROUTER_API_KEY:}
 *     conversation:
 *       model: google/gemini-2.5-flash
 *       temperature: 0.7
 *       max-tokens: 500
 *       timeout: 8s
 *       max-attempts: 2
 *       initial-backoff: 1s
 *       backoff-multiplier: 2
 *       max-backoff: 3s
 *     synthesis:   { model: ..., temperature: 0.3, timeout: 6s, max-attempts: 3 }
 *     generation:  { model: ..., fallback-model: openai/gpt-4o, timeout: 20s, max-attempts: 2 }
 */
@ConfigurationProperties(prefix = "clarifier.llm")
public record LlmProperties(
        @DefaultValue("https://openrouter.ai/api/v1") String baseUrl,
        String apiKey,
        CallProfile conversation,
        CallProfile synthesis,
        CallProfile generation
) {

    /**
     * Model, sampling and retry settings for one kind of call.
     *
     * @param fallbackModel only used by generation; null elsewhere
     * @param maxBackoff    cap on the exponential wait; null means uncapped
     */
    public record CallProfile(
            String model,
            String fallbackModel,
            @DefaultValue("0.7") double temperature,
            Integer maxTokens,
            @DefaultValue("10s") Duration timeout,
            @DefaultValue("2") int maxAttempts,
            @DefaultValue("1s") Duration initialBackoff,
            @DefaultValue("2") double backoffMultiplier,
            Duration maxBackoff
    ) {

        /** Longest a retried call can take: every attempt timing out plus the waits between them. */
        public Duration worstCase() {
            int attempts = Math.max(1, maxAttempts);
            Duration total = (timeout == null ? Duration.ZERO : timeout).multipliedBy(attempts);
            double wait = initialBackoff == null ? 1000 : initialBackoff.toMillis();
            for (int i = 1; i < attempts; i++) {
                long step = maxBackoff == null ? (long) wait : Math.min((long) wait, maxBackoff.toMillis());
                total = total.plusMillis(step);
                wait *= Math.max(1.0, backoffMultiplier);
            }
            return total;
        }

        boolean hasDistinctFallback() {
            return fallbackModel != null && !fallbackModel.isBlank() && !fallbackModel.equals(model);
        }
    }

    /** Worst case for one synthesis followed by the whole generation model chain. */
    public Duration generationBudget() {
        int models = generation.hasDistinctFallback() ? 2 : 1;
        return synthesis.worstCase().plus(generation.worstCase().multipliedBy(models));
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
