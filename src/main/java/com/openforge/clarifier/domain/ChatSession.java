package com.openforge.clarifier.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One guided Q&A session, from the first question to the generated artifact.
 *
 * Key design notes:
 *
 *  status      : only moves forward (see {@link SessionStatus}); use
 *                 {@link #advanceTo} instead of setting it directly.
 *
 *  finalBrief  : populated once the session reaches GENERATING.
 *
 *  finalOutput : JSON text of the generated artifact (object, or a JSON string
 *                 when the model reply could not be parsed). Populated together
 *                 with the COMPLETED transition.
 *
 *  generationAttempts: incremented on every claim of the generation phase so
 *                 that a retry after a failed generation also bumps the
 *                 optimistic-lock version.
 *
 *  generationStartedAt: when the current generation claim was taken; null once
 *                 a failed attempt has released it. A GENERATING session with
 *                 a recent value is still being worked on.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "chat_sessions",
    uniqueConstraints = @UniqueConstraint(name = "uq_chat_session_id", columnNames = "session_id"),
    indexes = @Index(name = "idx_chat_sessions_user_status", columnList = "user_id, status")
)
public class ChatSession extends BaseEntity {

    /** External UUID handed to the caller. */
    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "domain", nullable = false, length = 32, updatable = false)
    private Domain domain;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "intensity", nullable = false, length = 16)
    private Intensity intensity = Intensity.DEFAULT;

    @Builder.Default
    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private SessionStatus status = SessionStatus.QUESTIONING;

    @Column(name = "final_brief", columnDefinition = "TEXT")
    private String finalBrief;

    @Column(name = "final_output", columnDefinition = "TEXT")
    private String finalOutput;

    @Builder.Default
    @Column(name = "generation_attempts", nullable = false)
    private Integer generationAttempts = 0;

    @Column(name = "generation_started_at")
    private LocalDateTime generationStartedAt;

    /**
     * Moves the session one step forward.
     *
     * @throws IllegalStateException on a backward, repeated or skipping transition
     */
    public void advanceTo(SessionStatus next) {
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException("Illegal session transition %s -> %s for session %s"
                    .formatted(status, next, sessionId));
        }
        this.status = next;
    }

    /**
     * True while a generation claim taken after {@code cutoff} is held. A claim
     * that was released, or is older than the cutoff, may be taken over.
     */
    public boolean isGenerationClaimedAfter(LocalDateTime cutoff) {
        return status == SessionStatus.GENERATING
                && generationStartedAt != null
                && generationStartedAt.isAfter(cutoff);
    }

    public boolean isCompleted() {
        return status == SessionStatus.COMPLETED;
    }
}
