package com.openforge.clarifier.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * One entry of a session transcript. Append-only: rows are never updated or
 * deleted during a session's lifecycle, and the identity column gives the
 * creation order.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "session_messages",
    indexes = @Index(name = "idx_session_messages_session", columnList = "session_id, id")
)
public class SessionMessage extends BaseEntity {

    @Column(name = "session_id", nullable = false, length = 64, updatable = false)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16, updatable = false)
    private MessageRole role;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT", updatable = false)
    private String content;

    /** Intensity an assistant question was asked with; null for user messages and summaries. */
    @Enumerated(EnumType.STRING)
    @Column(name = "question_type", length = 16, updatable = false)
    private Intensity questionType;

    public static SessionMessage user(String sessionId, String content) {
        return SessionMessage.builder()
                .sessionId(sessionId)
                .role(MessageRole.USER)
                .content(content)
                .build();
    }

    public static SessionMessage assistant(String sessionId, String content, Intensity questionType) {
        return SessionMessage.builder()
                .sessionId(sessionId)
                .role(MessageRole.ASSISTANT)
                .content(content)
                .questionType(questionType)
                .build();
    }
}
