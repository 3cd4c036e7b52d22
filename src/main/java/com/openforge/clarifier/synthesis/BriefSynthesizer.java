package com.openforge.clarifier.synthesis;

import com.openforge.clarifier.conversation.ConversationMessage;
import com.openforge.clarifier.domain.Domain;
import com.openforge.clarifier.domain.MessageRole;
import com.openforge.clarifier.error.ValidationException;
import com.openforge.clarifier.generation.OutputGenerator;
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

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Condenses a whole transcript into the brief that drives generation.
 *
 * One model call through the "synthesisLlm" retry. There is no fallback text:
 * when the retry budget runs out, or the provider fails with a kind that is
 * not retried, a {@link SynthesisException} is thrown.
 */
@Slf4j
@Service
public class BriefSynthesizer {

    public static final int MAX_HISTORY_ENTRIES = 50;
    static final String EMPTY_HISTORY = "(No conversation history)";

    private final LlmProvider   llmProvider;
    private final PromptCatalog promptCatalog;
    private final CallProfile   profile;
    private final Retry         retry;

    public BriefSynthesizer(LlmProvider llmProvider,
                            PromptCatalog promptCatalog,
                            LlmProperties llmProperties,
                            @Qualifier("synthesisLlmRetry") Retry retry) {
        this.llmProvider   = llmProvider;
        this.promptCatalog = promptCatalog;
        this.profile       = llmProperties.synthesis();
        this.retry         = retry;
    }

    /**
     * @param history full transcript, oldest first; may be empty
     * @return the brief text, never blank
     * @throws SynthesisException the provider could not produce a brief
     */
    public String synthesize(Domain domain, List<ConversationMessage> history) {
        if (domain == null) {
            throw new ValidationException("domain", "Domain is required");
        }
        List<ConversationMessage> entries = history == null ? List.of() : history;
        String prompt = promptCatalog.synthesisPrompt(domain, formatHistory(entries));

        ChatRequest request = ChatRequest.of(profile.model(),
                List.of(Message.system(PromptCatalog.SYNTHESIS_SYSTEM_PROMPT), Message.user(prompt)),
                profile.temperature(), profile.maxTokens());

        AtomicInteger attempts = new AtomicInteger();
        long start = System.currentTimeMillis();
        try {
            String brief = Retry.decorateSupplier(retry, () -> {
                int n = attempts.incrementAndGet();
                try {
                    return llmProvider.complete(request, profile.timeout());
                } catch (LlmException e) {
                    log.warn("[Synthesis] domain={} attempt={} failed kind={}: {}",
                            domain.value(), n, e.kind(), e.getMessage());
                    throw e;
                }
            }).get();
            log.info("[Synthesis] domain={} entries={} words={} attempts={} duration={}ms",
                    domain.value(), entries.size(), OutputGenerator.countWords(brief),
                    attempts.get(), System.currentTimeMillis() - start);
            return brief;
        } catch (LlmException e) {
            log.error("[Synthesis] domain={} failed after {} attempt(s) kind={}: {}",
                    domain.value(), attempts.get(), e.kind(), e.getMessage());
            throw new SynthesisException(e.kind(),
                    "Synthesis failed after %d attempt(s): %s".formatted(attempts.get(), e.getMessage()), e);
        }
    }

    /**
     * "User: …" / "Assistant: …" blocks separated by a blank line, limited to the
     * most recent {@value #MAX_HISTORY_ENTRIES} entries.
     */
    static String formatHistory(List<ConversationMessage> history) {
        if (history.isEmpty()) {
            return EMPTY_HISTORY;
        }
        List<ConversationMessage> recent = history.size() > MAX_HISTORY_ENTRIES
                ? history.subList(history.size() - MAX_HISTORY_ENTRIES, history.size())
                : history;
        return recent.stream()
                .map(m -> (m.role() == MessageRole.USER ? "User: " : "Assistant: ") + m.content())
                .collect(Collectors.joining("\n\n"));
    }
}
