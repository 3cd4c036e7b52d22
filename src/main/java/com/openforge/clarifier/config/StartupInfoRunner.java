package com.openforge.clarifier.config;

import com.openforge.clarifier.domain.Tier;
import com.openforge.clarifier.llm.LlmProperties;
import com.openforge.clarifier.llm.LlmProperties.CallProfile;
import com.openforge.clarifier.ratelimit.RateLimitProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Logs a startup summary once the context is ready: database reachability,
 * the model behind each call profile, the masked API key and the tier quotas.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource          dataSource;
    private final LlmProperties       llmProperties;
    private final RateLimitProperties rateLimitProperties;
    private final Environment         env;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Clarifier  -  Startup Summary               ║
                ╠══════════════════════════════════════════════════════════╣
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ║    Database       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM ({})  key={}
                ║    Conversation   : {}
                ║    Synthesis      : {}
                ║    Generation     : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Quotas           : free={}  pro={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),
                probeDatabase(),
                llmProperties.baseUrl(),
                maskKey(llmProperties.apiKey()),
                describe(llmProperties.conversation()),
                describe(llmProperties.synthesis()),
                describe(llmProperties.generation()),
                rateLimitProperties.limitFor(Tier.FREE),
                rateLimitProperties.limitFor(Tier.PRO));

        if (!llmProperties.hasApiKey()) {
            log.warn("[Startup] No LLM API key configured; turns will fall back and generation will fail");
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String product = conn.getMetaData().getDatabaseProductName();
            return "✔ " + product + "  url=" + url.replaceAll("password=[^&;]*", "password=***");
        } catch (SQLException e) {
            log.warn("[Startup] Database probe failed: {}", e.getMessage());
            return "✘ FAILED: " + e.getMessage();
        }
    }

    private static String describe(CallProfile profile) {
        if (profile == null) return "(not configured)";
        String fallback = profile.fallbackModel() == null ? "" : " → " + profile.fallbackModel();
        return "%s%s  timeout=%s  attempts=%d".formatted(
                profile.model(), fallback, profile.timeout(), profile.maxAttempts());
    }

    /** First 6 chars + "..." + last 4; "(not set)" when blank. */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
