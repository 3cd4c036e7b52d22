package com.openforge.clarifier.synthesis;

import com.openforge.clarifier.error.ClarifierException;
import com.openforge.clarifier.error.ErrorCode;
import com.openforge.clarifier.llm.LlmErrorKind;

/**
 * The brief could not be produced. Generation must not continue without one.
 */
public class SynthesisException extends ClarifierException {

    private final LlmErrorKind kind;

    public SynthesisException(LlmErrorKind kind, String details, Throwable cause) {
        super(ErrorCode.forLlmFailure(kind, ErrorCode.SYNTHESIS_FAILED), details, cause);
        this.kind = kind;
    }

    /** Classification of the last provider failure. */
    public LlmErrorKind kind() {
        return kind;
    }
}
