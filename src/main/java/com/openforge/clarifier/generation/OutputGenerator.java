package com.openforge.clarifier.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.clarifier.domain.Domain;
import com.openforge.clarifier.error.ValidationException;
import com.openforge.clarifier.llm.LlmErrorKind;
import com.openforge.clarifier.llm.LlmException;
import com.openforge.clarifier.llm.LlmProperties;
import com.openforge.clarifier.llm.LlmProperties.CallProfile;
import com.openforge.clarifier.llm.LlmProvider;
import com.openforge.clarifier.llm.model.ChatRequest;
import com.openforge.clarifier.llm.model.Message;
import com.openforge.clarifier.prompt.PromptCatalog;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands a brief into the domain's final artifact.
 *
 * Call graph:
 *
 *   generate(domain, brief)
 *     └─ "generationLlm" retry
 *           └─ llmProvider.complete(primary model)
 *                 ↓ (retry budget spent, or a non-retryable, non-fatal failure)
 *     └─ "generationLlm" retry
 *           └─ llmProvider.complete(fallback model)
 *
 * A fatal kind (rate limit, quota, credentials) stops the whole chain at once
 * so no further billed call is made.
 *
 * The reply is then parsed: a ```json fenced block first, the whole reply
 * second. Parsing never fails the call; an unparseable reply leaves
 * {@link GenerationResult#structured()} empty.
 */
@Slf4j
@Service
public class OutputGenerator {

    public static final int MIN_BRIEF_WORDS = 50;

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private final LlmProvider   llmProvider;
    private final PromptCatalog promptCatalog;
    private final ObjectMapper  objectMapper;
    private final CallProfile   profile;
    private final Retry         retry;

    public OutputGenerator(LlmProvider llmProvider,
                           PromptCatalog promptCatalog,
                           ObjectMapper objectMapper,
                           LlmProperties llmProperties,
                           @Qualifier("generationLlmRetry") Retry retry) {
        this.llmProvider   = llmProvider;
        this.promptCatalog = promptCatalog;
        this.objectMapper  = objectMapper;
        this.profile       = llmProperties.generation();
        this.retry         = retry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * @throws ValidationException brief shorter than {@value #MIN_BRIEF_WORDS} words, or no domain
     * @throws GenerationException every model failed, or one failed fatally
     */
    public GenerationResult generate(Domain domain, String brief) {
        validate(domain, brief);

        List<Message> messages = List.of(
                Message.system(PromptCatalog.GENERATION_SYSTEM_PROMPT),
                Message.user(promptCatalog.generationPrompt(domain, brief.trim())));

        LlmException last = null;
        long start = System.currentTimeMillis();
        for (String model : modelChain()) {
            ChatRequest request = ChatRequest.of(model, messages, profile.temperature(), profile.maxTokens());
            try {
                String raw = callWithRetry(request, domain);
                GenerationResult result = new GenerationResult(raw, parseStructured(raw), countWords(raw), model);
                log.info("[Generation] domain={} model={} words={} structured={} duration={}ms",
                        domain.value(), model, result.wordCount(), result.structured().isPresent(),
                        System.currentTimeMillis() - start);
                return result;
            } catch (LlmException e) {
                last = e;
                if (e.kind().fatal()) {
                    log.error("[Generation] domain={} model={} fatal failure kind={}, aborting chain: {}",
                            domain.value(), model, e.kind(), e.getMessage());
                    throw new GenerationException(e.kind(), e.getMessage(), e);
                }
                log.warn("[Generation] domain={} model={} exhausted kind={}, trying next model",
                        domain.value(), model, e.kind());
            }
        }

        LlmErrorKind kind = last == null ? LlmErrorKind.BAD_REQUEST : last.kind();
        log.error("[Generation] domain={} all models failed kind={} duration={}ms",
                domain.value(), kind, System.currentTimeMillis() - start);
        throw new GenerationException(kind,
                "All models failed: %s".formatted(last == null ? "no model configured" : last.getMessage()), last);
    }

    /** Whitespace-delimited token count; 0 for null or blank text. */
    public static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private String callWithRetry(ChatRequest request, Domain domain) {
        AtomicInteger attempts = new AtomicInteger();
        return Retry.decorateSupplier(retry, () -> {
            int n = attempts.incrementAndGet();
            try {
                return llmProvider.complete(request, profile.timeout());
            } catch (LlmException e) {
                log.warn("[Generation] domain={} model={} attempt={} failed kind={}: {}",
                        domain.value(), request.model(), n, e.kind(), e.getMessage());
                throw e;
            }
        }).get();
    }

    private List<String> modelChain() {
        List<String> chain = new ArrayList<>(2);
        if (profile.model() != null && !profile.model().isBlank()) {
            chain.add(profile.model());
        }
        String fallback = profile.fallbackModel();
        if (fallback != null && !fallback.isBlank() && !chain.contains(fallback)) {
            chain.add(fallback);
        }
        return chain;
    }

    private static void validate(Domain domain, String brief) {
        if (domain == null) {
            throw new ValidationException("domain", "Domain is required");
        }
        if (brief == null || brief.isBlank()) {
            throw new ValidationException("brief", "Brief must be a non-empty string");
        }
        int words = countWords(brief);
        if (words < MIN_BRIEF_WORDS) {
            throw new ValidationException("brief",
                    "Brief is too short (%d words). Expected at least %d words for quality generation."
                            .formatted(words, MIN_BRIEF_WORDS));
        }
    }

    /** Fenced block first, then the whole reply; only objects and arrays count. */
    Optional<JsonNode> parseStructured(String raw) {
        Matcher matcher = FENCED_BLOCK.matcher(raw);
        String candidate = matcher.find() ? matcher.group(1).trim() : raw.trim();
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node != null && (node.isObject() || node.isArray())) {
                return Optional.of(node);
            }
        } catch (JsonProcessingException e) {
            log.debug("[Generation] Reply is not JSON, keeping raw text: {}", e.getOriginalMessage());
        }
        return Optional.empty();
    }
}
