package com.openforge.clarifier.llm;

import com.openforge.clarifier.llm.model.ChatRequest;

import java.time.Duration;

/**
 * Boundary to the language model: role-tagged messages in, generated text out.
 */
public interface LlmProvider {

    /**
     * One completion attempt. No retries happen at this level.
     *
     * @param request model identifier plus messages and sampling options
     * @param timeout budget for this single attempt
     * @return the trimmed, non-blank reply text
     * @throws LlmException classified failure, including blank replies ({@link LlmErrorKind#EMPTY_RESPONSE})
     */
    String complete(ChatRequest request, Duration timeout);
}
