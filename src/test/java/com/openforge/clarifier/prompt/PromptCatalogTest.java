package com.openforge.clarifier.prompt;

import com.openforge.clarifier.domain.Domain;
import com.openforge.clarifier.domain.Intensity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class PromptCatalogTest {

    private final PromptCatalog catalog = new PromptCatalog();

    @ParameterizedTest
    @EnumSource(Domain.class)
    void shouldHaveDistinctPersonasForBothIntensities(Domain domain) {
        String basic = catalog.systemPrompt(domain, Intensity.BASIC);
        String deep  = catalog.systemPrompt(domain, Intensity.DEEP);

        assertThat(basic).isNotBlank().contains("ONE");
        assertThat(deep).isNotBlank().isNotEqualTo(basic);
        assertThat(catalog.systemPrompt(domain, null)).isEqualTo(deep);
    }

    @ParameterizedTest
    @EnumSource(Domain.class)
    void shouldHaveFallbackAndGenerationInstructions(Domain domain) {
        assertThat(catalog.fallbackReply(domain)).endsWith("?");
        assertThat(catalog.generationPrompt(domain, "THE BRIEF"))
                .contains("THE BRIEF")
                .contains(domain.artifact())
                .contains("```json");
    }

    @Test
    void shouldEmbedDomainAndTranscriptInSynthesisPrompt() {
        String prompt = catalog.synthesisPrompt(Domain.RESEARCH, "User: hi");

        assertThat(prompt)
                .contains("discussed their research idea")
                .contains("(200-300 words)")
                .contains("CONVERSATION:\nUser: hi\n\nBRIEF:");
    }

    @Test
    void shouldUseGenericFallbackWithoutDomain() {
        assertThat(catalog.fallbackReply(null)).isNotBlank();
    }
}
