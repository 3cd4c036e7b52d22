package com.openforge.clarifier.conversation;

import com.openforge.clarifier.domain.Domain;
import com.openforge.clarifier.domain.Intensity;
import com.openforge.clarifier.domain.MessageRole;
import com.openforge.clarifier.error.ClarifierException;
import com.openforge.clarifier.error.ErrorCode;
import com.openforge.clarifier.error.ValidationException;
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
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs one questioning turn against the model.
 *
 * Flow:
 *   1. VALIDATE : domain, message size, history shape; fails before any network call
 *   2. SANITIZE : strip NUL bytes and surrounding whitespace from every body
 *   3. TRIM     : keep the last {@value #MAX_HISTORY_MESSAGES} history entries
 *   4. ASSEMBLE : [system persona, ...history..., user message]
 *   5. CALL     : "conversationLlm" retry; fatal kinds surface as typed errors,
 *                  anything else that outlives the retry budget becomes the domain fallback
 *   6. CLASSIFY : termination hint from the {@link TerminationPolicy}
 *
 * Trimming only affects what is sent; the stored transcript is untouched.
 */
@Slf4j
@Service
public class TurnProcessor {

    public static final int MAX_HISTORY_MESSAGES = 10;
    public static final int MAX_USER_MESSAGE_CHARS = 5000;

    private final LlmProvider       llmProvider;
    private final PromptCatalog     promptCatalog;
    private final TerminationPolicy terminationPolicy;
    private final CallProfile       profile;
    private final Retry             retry;

    public TurnProcessor(LlmProvider llmProvider,
                         PromptCatalog promptCatalog,
                         TerminationPolicy terminationPolicy,
                         LlmProperties llmProperties,
                         @Qualifier("conversationLlmRetry") Retry retry) {
        this.llmProvider       = llmProvider;
        this.promptCatalog     = promptCatalog;
        this.terminationPolicy = terminationPolicy;
        this.profile           = llmProperties.conversation();
        this.retry             = retry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * @param history     prior transcript, oldest first, without {@code userMessage}
     * @param intensity   null means {@link Intensity#DEFAULT}
     * @throws ValidationException bad input, before any model call
     * @throws ClarifierException  MISSING_API_KEY, AUTH_ERROR or RATE_LIMIT_ERROR from the provider
     */
    public TurnResult processTurn(Domain domain,
                                  List<ConversationMessage> history,
                                  String userMessage,
                                  Intensity intensity) {
        String cleanMessage = validate(domain, history, userMessage);
        List<ConversationMessage> recent = trimHistory(history);

        List<Message> messages = new ArrayList<>(recent.size() + 2);
        messages.add(Message.system(promptCatalog.systemPrompt(domain, intensity)));
        for (ConversationMessage entry : recent) {
            String content = sanitize(entry.content());
            messages.add(entry.role() == MessageRole.USER ? Message.user(content) : Message.assistant(content));
        }
        messages.add(Message.user(cleanMessage));

        log.debug("[Turn] domain={} intensity={} history={}/{} messages={}",
                domain.value(), intensity, recent.size(), history.size(), messages.size());

        ChatRequest request = ChatRequest.of(profile.model(), messages, profile.temperature(), profile.maxTokens());
        long start = System.currentTimeMillis();
        try {
            String reply = Retry.decorateSupplier(retry, attempt(request, domain)).get();
            boolean ready = terminationPolicy.suggestsReadiness(reply);
            log.info("[Turn] domain={} reply-length={} suggestedTermination={} duration={}ms",
                    domain.value(), reply.length(), ready, System.currentTimeMillis() - start);
            return TurnResult.answered(reply, ready);
        } catch (LlmException e) {
            if (e.kind().fatal()) {
                log.error("[Turn] domain={} fatal provider failure kind={}: {}",
                        domain.value(), e.kind(), e.getMessage());
                throw new ClarifierException(ErrorCode.forLlmFailure(e.kind(), ErrorCode.INTERNAL_ERROR),
                        e.getMessage(), e);
            }
            log.error("[Turn] domain={} giving up after retries kind={} duration={}ms, using fallback reply",
                    domain.value(), e.kind(), System.currentTimeMillis() - start);
            return TurnResult.fallback(promptCatalog.fallbackReply(domain));
        }
    }

    /**
     * Size check for a user message, usable before anything is persisted.
     *
     * @return the sanitized message
     * @throws ValidationException empty after sanitizing, or longer than {@value #MAX_USER_MESSAGE_CHARS} chars
     */
    public String validateUserMessage(String userMessage) {
        String clean = userMessage == null ? "" : sanitize(userMessage);
        if (clean.isEmpty()) {
            throw new ValidationException("userMessage", "User message cannot be empty");
        }
        if (clean.length() > MAX_USER_MESSAGE_CHARS) {
            throw new ValidationException("userMessage",
                    "User message exceeds maximum length of %d characters".formatted(MAX_USER_MESSAGE_CHARS));
        }
        return clean;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Supplier<String> attempt(ChatRequest request, Domain domain) {
        AtomicInteger attempts = new AtomicInteger();
        return () -> {
            int n = attempts.incrementAndGet();
            try {
                return llmProvider.complete(request, profile.timeout());
            } catch (LlmException e) {
                log.warn("[Turn] domain={} attempt={} failed kind={} retryable={}: {}",
                        domain.value(), n, e.kind(), e.retryable(), e.getMessage());
                throw e;
            }
        };
    }

    private String validate(Domain domain, List<ConversationMessage> history, String userMessage) {
        if (domain == null) {
            throw new ValidationException("domain", "Domain is required");
        }
        if (history == null) {
            throw new ValidationException("history", "History must be a list");
        }
        for (int i = 0; i < history.size(); i++) {
            ConversationMessage entry = history.get(i);
            if (entry == null || entry.role() == null || entry.content() == null) {
                throw new ValidationException("history",
                        "History entry %d must have a role (user|assistant) and string content".formatted(i));
            }
        }
        return validateUserMessage(userMessage);
    }

    static List<ConversationMessage> trimHistory(List<ConversationMessage> history) {
        if (history.size() <= MAX_HISTORY_MESSAGES) {
            return history;
        }
        return history.subList(history.size() - MAX_HISTORY_MESSAGES, history.size());
    }

    static String sanitize(String text) {
        return text.replace("\0", "").trim();
    }
}
