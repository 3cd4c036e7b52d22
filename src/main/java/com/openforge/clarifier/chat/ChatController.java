package com.openforge.clarifier.chat;

import com.openforge.clarifier.chat.dto.ChatTurnRequest;
import com.openforge.clarifier.chat.dto.ChatTurnResponse;
import com.openforge.clarifier.error.ClarifierException;
import com.openforge.clarifier.error.ErrorCode;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Single conversational endpoint.
 *
 *   POST /api/chat: start a session, answer a question, or trigger generation
 *
 * The caller's user id is the principal set by JwtAuthFilter.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ChatOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<ChatTurnResponse> chat(@Valid @RequestBody ChatTurnRequest request) {
        return ResponseEntity.ok(orchestrator.handle(currentUserId(), request));
    }

    private static String currentUserId() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && !(auth instanceof AnonymousAuthenticationToken)
                && auth.getPrincipal() instanceof String id && !id.isBlank()) {
            return id;
        }
        throw new ClarifierException(ErrorCode.UNAUTHENTICATED);
    }
}
