package com.openforge.clarifier.repository;

import com.openforge.clarifier.domain.ChatSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ChatSessionRepository extends JpaRepository<ChatSession, Long> {

    /** Ownership-scoped lookup: a session belonging to another user is indistinguishable from a missing one. */
    Optional<ChatSession> findBySessionIdAndUserId(String sessionId, String userId);
}
