package com.openforge.clarifier.repository;

import com.openforge.clarifier.domain.SessionMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SessionMessageRepository extends JpaRepository<SessionMessage, Long> {

    /** Full transcript in creation order. */
    List<SessionMessage> findBySessionIdOrderByIdAsc(String sessionId);
}
