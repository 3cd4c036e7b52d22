package com.openforge.clarifier.support;

import com.openforge.clarifier.config.Resilience4jConfig;
import com.openforge.clarifier.llm.LlmProperties;
import io.github.resilience4j.retry.Retry;

/**
 * Named retries built by the production registry, for components constructed
 * by hand in unit tests.
 */
public final class TestRetries {

    private TestRetries() {
    }

    public static Retry conversation(LlmProperties properties) {
        return new Resilience4jConfig().retryRegistry(properties).retry(Resilience4jConfig.CONVERSATION);
    }

    public static Retry synthesis(LlmProperties properties) {
        return new Resilience4jConfig().retryRegistry(properties).retry(Resilience4jConfig.SYNTHESIS);
    }

    public static Retry generation(LlmProperties properties) {
        return new Resilience4jConfig().retryRegistry(properties).retry(Resilience4jConfig.GENERATION);
    }
}
