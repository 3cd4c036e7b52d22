package com.openforge.clarifier.generation;

import com.openforge.clarifier.error.ClarifierException;
import com.openforge.clarifier.error.ErrorCode;
import com.openforge.clarifier.llm.LlmErrorKind;

/**
 * Every model in the fallback chain failed, or one failed fatally.
 */
public class GenerationException extends ClarifierException {

    private final LlmErrorKind kind;

    public GenerationException(LlmErrorKind kind, String details, Throwable cause) {
        super(ErrorCode.forLlmFailure(kind, ErrorCode.GENERATION_FAILED), details, cause);
        this.kind = kind;
    }

    public LlmErrorKind kind() {
        return kind;
    }
}
