package com.openforge.clarifier.conversation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive phrase match over the reply text.
 */
@Component
public class KeywordTerminationPolicy implements TerminationPolicy {

    static final List<String> READINESS_PHRASES = List.of(
            "enough information",
            "ready to generate",
            "shall we proceed",
            "ready to proceed",
            "good understanding",
            "clear picture",
            "generate your",
            "move forward with generating"
    );

    @Override
    public boolean suggestsReadiness(String assistantReply) {
        if (assistantReply == null || assistantReply.isBlank()) {
            return false;
        }
        String text = assistantReply.toLowerCase(Locale.ROOT);
        return READINESS_PHRASES.stream().anyMatch(text::contains);
    }
}
