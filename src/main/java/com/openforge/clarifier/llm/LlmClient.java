package com.openforge.clarifier.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.clarifier.llm.model.ChatRequest;
import com.openforge.clarifier.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Stateless HTTP client for an OpenAI-compatible /chat/completions endpoint
 * (OpenRouter by default).
 *
 * Every call is a single blocking attempt. Failures are thrown as
 * {@link LlmException} classified by HTTP status or transport exception type;
 * retry and fallback decisions belong to the callers.
 *
 * The API key is checked before anything touches the network, so a missing
 * key surfaces as {@link LlmErrorKind#MISSING_API_KEY} rather than as a 401.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmClient implements LlmProvider {

    private static final int MAX_ERROR_BODY_CHARS = 2048;

    private final HttpClient    httpClient;
    private final ObjectMapper  objectMapper;
    private final LlmProperties properties;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.properties   = properties;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public String complete(ChatRequest request, Duration timeout) {
        String content = chat(request, timeout).firstContent();
        if (content == null || content.isBlank()) {
            throw new LlmException(LlmErrorKind.EMPTY_RESPONSE,
                    "Model [%s] returned an empty response".formatted(request.model()));
        }
        return content.trim();
    }

    /**
     * Blocking (non-streaming) chat completion.
     */
    public ChatResponse chat(ChatRequest request, Duration timeout) {
        if (!properties.hasApiKey()) {
            throw new LlmException(LlmErrorKind.MISSING_API_KEY,
                    "LLM API key is not configured (clarifier.llm.api-key / OPENROUTER_API_KEY)");
        }
        if (request == null || request.model() == null || request.model().isBlank()) {
            throw new LlmException(LlmErrorKind.BAD_REQUEST, "ChatRequest must name a model");
        }

        String requestBody = serialize(request);
        log.debug("[LlmClient] → chat model={} messages={} body-length={}",
                request.model(), request.messages() == null ? 0 : request.messages().size(), requestBody.length());

        HttpResponse<String> httpResponse = sendBlocking(buildHttpRequest(requestBody, timeout), request.model());
        return parseFullResponse(httpResponse, request.model());
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(URI.create(properties.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + properties.apiKey())
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpResponse<String> sendBlocking(HttpRequest request, String model) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new LlmException(LlmErrorKind.TIMEOUT,
                    "Timed out after %s calling model [%s]".formatted(request.timeout().orElse(null), model), e);
        } catch (IOException e) {
            throw new LlmException(LlmErrorKind.NETWORK,
                    "Network error calling model [%s]: %s".formatted(model, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException(LlmErrorKind.INTERRUPTED,
                    "Interrupted while calling model [%s]".formatted(model), e);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response, String model) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient] ← HTTP {} model={} body-length={}", status, model,
                body == null ? 0 : body.length());

        if (status < 200 || status >= 300) {
            LlmErrorKind kind = LlmErrorKind.fromHttpStatus(status);
            throw new LlmException(kind,
                    "Model [%s] returned HTTP %d: %s".formatted(model, status, snippet(body)), status, null);
        }

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(LlmErrorKind.INVALID_RESPONSE,
                    "Failed to parse response from model [%s]: %s".formatted(model, snippet(body)), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new LlmException(LlmErrorKind.BAD_REQUEST, "Failed to serialize request", e);
        }
    }

    private static String snippet(String body) {
        if (body == null) return "";
        return body.length() <= MAX_ERROR_BODY_CHARS ? body : body.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }
}
