package com.openforge.clarifier.conversation;

import com.openforge.clarifier.domain.MessageRole;
import com.openforge.clarifier.domain.SessionMessage;

/**
 * Role-tagged transcript entry as seen by the model-facing components.
 */
public record ConversationMessage(MessageRole role, String content) {

    public static ConversationMessage user(String content) {
        return new ConversationMessage(MessageRole.USER, content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(MessageRole.ASSISTANT, content);
    }

    public static ConversationMessage from(SessionMessage message) {
        return new ConversationMessage(message.getRole(), message.getContent());
    }
}
