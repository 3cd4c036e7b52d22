package com.openforge.clarifier.synthesis;

import com.openforge.clarifier.conversation.ConversationMessage;
import com.openforge.clarifier.domain.Domain;
import com.openforge.clarifier.error.ErrorCode;
import com.openforge.clarifier.llm.LlmErrorKind;
import com.openforge.clarifier.llm.LlmProperties;
import com.openforge.clarifier.llm.model.Message;
import com.openforge.clarifier.prompt.PromptCatalog;
import com.openforge.clarifier.support.ScriptedLlmProvider;
import com.openforge.clarifier.support.TestLlmProperties;
import com.openforge.clarifier.support.TestRetries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BriefSynthesizerTest {

    private ScriptedLlmProvider provider;
    private BriefSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        LlmProperties properties = TestLlmProperties.create();
        provider = new ScriptedLlmProvider();
        synthesizer = new BriefSynthesizer(provider, new PromptCatalog(), properties,
                TestRetries.synthesis(properties));
    }

    @Test
    void shouldFormatTranscriptAsUserAndAssistantBlocks() {
        provider.reply("## Core goal\nA bike sharing service.");
        List<ConversationMessage> history = List.of(
                ConversationMessage.assistant("What problem are you solving?"),
                ConversationMessage.user("Short urban trips"));

        String brief = synthesizer.synthesize(Domain.BUSINESS, history);

        assertThat(brief).startsWith("## Core goal");
        List<Message> sent = provider.lastRequest().messages();
        assertThat(sent.get(0).content()).isEqualTo(PromptCatalog.SYNTHESIS_SYSTEM_PROMPT);
        assertThat(sent.get(1).content())
                .contains("discussed their business idea")
                .contains("Assistant: What problem are you solving?\n\nUser: Short urban trips")
                .endsWith("BRIEF:");
        assertThat(provider.lastRequest().model()).isEqualTo(TestLlmProperties.SYNTHESIS_MODEL);
    }

    @Test
    void shouldAcceptEmptyHistory() {
        provider.reply("A best-effort brief.");

        synthesizer.synthesize(Domain.RESEARCH, List.of());

        assertThat(provider.lastRequest().messages().get(1).content()).contains("(No conversation history)");
    }

    @Test
    void shouldKeepOnlyTheFiftyMostRecentEntries() {
        List<ConversationMessage> history = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            history.add(ConversationMessage.user("[e" + i + "]"));
        }

        String formatted = BriefSynthesizer.formatHistory(history);

        assertThat(formatted).doesNotContain("[e9]").contains("[e10]").contains("[e59]");
        assertThat(formatted.split("\n\n")).hasSize(BriefSynthesizer.MAX_HISTORY_ENTRIES);
    }

    @Test
    void shouldRetryTransientFailuresIncludingRateLimit() {
        provider.fail(LlmErrorKind.TIMEOUT).fail(LlmErrorKind.RATE_LIMITED).reply("Brief text");

        String brief = synthesizer.synthesize(Domain.PRODUCT, List.of(ConversationMessage.user("x")));

        assertThat(brief).isEqualTo("Brief text");
        assertThat(provider.calls()).isEqualTo(3);
    }

    @Test
    void shouldFailAfterThreeUnavailableAttempts() {
        provider.fail(LlmErrorKind.SERVICE_UNAVAILABLE);

        assertThatThrownBy(() -> synthesizer.synthesize(Domain.PRODUCT, List.of()))
                .isInstanceOf(SynthesisException.class)
                .satisfies(e -> {
                    SynthesisException se = (SynthesisException) e;
                    assertThat(se.code()).isEqualTo(ErrorCode.SYNTHESIS_FAILED);
                    assertThat(se.kind()).isEqualTo(LlmErrorKind.SERVICE_UNAVAILABLE);
                });
        assertThat(provider.calls()).isEqualTo(3);
    }

    @Test
    void shouldNotRetryOtherErrors() {
        provider.fail(LlmErrorKind.SERVER_ERROR);

        assertThatThrownBy(() -> synthesizer.synthesize(Domain.CODING, List.of()))
                .isInstanceOf(SynthesisException.class);
        assertThat(provider.calls()).isEqualTo(1);
    }

    @Test
    void shouldReportCredentialAndTimeoutFailuresWithDedicatedCodes() {
        provider.fail(LlmErrorKind.AUTHENTICATION);
        assertThatThrownBy(() -> synthesizer.synthesize(Domain.CODING, List.of()))
                .extracting(e -> ((SynthesisException) e).code())
                .isEqualTo(ErrorCode.AUTH_ERROR);

        LlmProperties properties = TestLlmProperties.create();
        ScriptedLlmProvider slow = new ScriptedLlmProvider().fail(LlmErrorKind.TIMEOUT);
        BriefSynthesizer other = new BriefSynthesizer(slow, new PromptCatalog(), properties,
                TestRetries.synthesis(properties));
        assertThatThrownBy(() -> other.synthesize(Domain.CODING, List.of()))
                .extracting(e -> ((SynthesisException) e).code())
                .isEqualTo(ErrorCode.GENERATION_TIMEOUT);
        assertThat(slow.calls()).isEqualTo(3);
    }
}
