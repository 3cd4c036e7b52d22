package com.openforge.clarifier.llm;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LlmErrorKindTest {

    @Test
    void shouldClassifyHttpStatuses() {
        assertThat(LlmErrorKind.fromHttpStatus(401)).isEqualTo(LlmErrorKind.AUTHENTICATION);
        assertThat(LlmErrorKind.fromHttpStatus(403)).isEqualTo(LlmErrorKind.AUTHENTICATION);
        assertThat(LlmErrorKind.fromHttpStatus(402)).isEqualTo(LlmErrorKind.QUOTA_EXCEEDED);
        assertThat(LlmErrorKind.fromHttpStatus(429)).isEqualTo(LlmErrorKind.RATE_LIMITED);
        assertThat(LlmErrorKind.fromHttpStatus(408)).isEqualTo(LlmErrorKind.TIMEOUT);
        assertThat(LlmErrorKind.fromHttpStatus(504)).isEqualTo(LlmErrorKind.TIMEOUT);
        assertThat(LlmErrorKind.fromHttpStatus(503)).isEqualTo(LlmErrorKind.SERVICE_UNAVAILABLE);
        assertThat(LlmErrorKind.fromHttpStatus(500)).isEqualTo(LlmErrorKind.SERVER_ERROR);
        assertThat(LlmErrorKind.fromHttpStatus(400)).isEqualTo(LlmErrorKind.BAD_REQUEST);
    }

    @Test
    void shouldNeverBeBothRetryableAndFatal() {
        for (LlmErrorKind kind : LlmErrorKind.values()) {
            assertThat(kind.retryable() && kind.fatal()).as(kind.name()).isFalse();
        }
        assertThat(LlmErrorKind.RATE_LIMITED.fatal()).isTrue();
        assertThat(LlmErrorKind.EMPTY_RESPONSE.retryable()).isTrue();
    }
}
