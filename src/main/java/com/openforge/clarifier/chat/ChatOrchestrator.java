package com.openforge.clarifier.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.openforge.clarifier.chat.dto.ChatTurnRequest;
import com.openforge.clarifier.chat.dto.ChatTurnResponse;
import com.openforge.clarifier.chat.dto.FinalOutput;
import com.openforge.clarifier.conversation.ConversationMessage;
import com.openforge.clarifier.conversation.TurnProcessor;
import com.openforge.clarifier.conversation.TurnResult;
import com.openforge.clarifier.domain.ChatSession;
import com.openforge.clarifier.domain.Domain;
import com.openforge.clarifier.domain.Intensity;
import com.openforge.clarifier.domain.MessageRole;
import com.openforge.clarifier.domain.SessionMessage;
import com.openforge.clarifier.domain.SessionStatus;
import com.openforge.clarifier.error.ClarifierException;
import com.openforge.clarifier.error.ErrorCode;
import com.openforge.clarifier.error.RateLimitExceededException;
import com.openforge.clarifier.generation.GenerationResult;
import com.openforge.clarifier.generation.OutputGenerator;
import com.openforge.clarifier.llm.LlmProperties;
import com.openforge.clarifier.ratelimit.RateLimitResult;
import com.openforge.clarifier.ratelimit.RateLimiter;
import com.openforge.clarifier.ratelimit.UsageIncrement;
import com.openforge.clarifier.repository.ChatSessionRepository;
import com.openforge.clarifier.repository.SessionMessageRepository;
import com.openforge.clarifier.synthesis.BriefSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Owns the session lifecycle and sequences the components for one request.
 *
 * Request shape:
 *   1. RESOLVE  : new session (domain required, quota checked, row created)
 *                  or existing session (owned by the caller, not completed)
 *   2. BRANCH   : generateNow?
 *        no  → append user message, run one questioning turn, append the reply
 *        yes → require {@value #MIN_QUESTIONS} questions, claim the session
 *              (QUESTIONING → GENERATING), synthesize the brief, generate the
 *              artifact, complete the session, count the usage, append a summary
 *
 * There is no surrounding transaction: each store call commits on its own, so
 * a failure leaves exactly what was already written. The claim is flushed
 * under the session's optimistic-lock version; of two racing generation
 * requests only one can win it, and a claim still within its lease refuses
 * every later generateNow. A failed synthesis or generation releases the
 * claim so the session can be generated again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatOrchestrator {

    public static final int MIN_QUESTIONS = 3;

    /** Slack on top of the model-call budget for the store writes around it. */
    private static final Duration CLAIM_GRACE = Duration.ofSeconds(30);

    private final ChatSessionRepository    sessionRepository;
    private final SessionMessageRepository messageRepository;
    private final RateLimiter              rateLimiter;
    private final TurnProcessor            turnProcessor;
    private final BriefSynthesizer         briefSynthesizer;
    private final OutputGenerator          outputGenerator;
    private final ObjectMapper             objectMapper;
    private final LlmProperties            llmProperties;

    // ── Public API ───────────────────────────────────────────────────────────

    public ChatTurnResponse handle(String userId, ChatTurnRequest request) {
        if (userId == null || userId.isBlank()) {
            throw new ClarifierException(ErrorCode.UNAUTHENTICATED);
        }

        ChatSession session = request.isNewSession()
                ? openSession(userId, request)
                : loadSession(userId, request.sessionId());

        return request.wantsGeneration()
                ? generate(userId, session, request.message())
                : converse(session, request.message(), request.intensity());
    }

    // ── Session resolution ───────────────────────────────────────────────────

    private ChatSession openSession(String userId, ChatTurnRequest request) {
        if (request.domain() == null) {
            throw new ClarifierException(ErrorCode.DOMAIN_REQUIRED);
        }
        if (request.wantsGeneration()) {
            // a brand-new session has asked nothing yet
            throw new ClarifierException(ErrorCode.MIN_QUESTIONS_NOT_MET,
                    "0 of %d questions answered".formatted(MIN_QUESTIONS));
        }
        turnProcessor.validateUserMessage(request.message());
        RateLimitResult quota = rateLimiter.checkRateLimit(userId);
        if (!quota.allowed()) {
            log.info("[Chat] userId={} denied new session tier={} limit={}",
                    userId, quota.tier().value(), quota.limit());
            throw new RateLimitExceededException(quota);
        }

        ChatSession session = ChatSession.builder()
                .sessionId(UUID.randomUUID().toString())
                .userId(userId)
                .domain(request.domain())
                .intensity(request.intensity() == null ? Intensity.DEFAULT : request.intensity())
                .build();
        try {
            session = sessionRepository.save(session);
        } catch (DataAccessException e) {
            throw new ClarifierException(ErrorCode.SESSION_CREATE_FAILED, e.getMessage(), e);
        }
        log.info("[Chat] userId={} created session={} domain={} intensity={} remaining={}",
                userId, session.getSessionId(), session.getDomain().value(),
                session.getIntensity().value(), quota.remaining() - 1);
        return session;
    }

    private ChatSession loadSession(String userId, String sessionId) {
        ChatSession session = sessionRepository.findBySessionIdAndUserId(sessionId, userId)
                .orElseThrow(() -> new ClarifierException(ErrorCode.NOT_FOUND, sessionId));
        if (session.isCompleted()) {
            throw new ClarifierException(ErrorCode.SESSION_COMPLETED, sessionId);
        }
        return session;
    }

    // ── Questioning ──────────────────────────────────────────────────────────

    private ChatTurnResponse converse(ChatSession session, String message, Intensity requested) {
        if (session.getStatus() == SessionStatus.GENERATING) {
            throw new ClarifierException(ErrorCode.GENERATION_IN_PROGRESS, session.getSessionId());
        }
        String text = turnProcessor.validateUserMessage(message);

        if (requested != null && requested != session.getIntensity()) {
            session.setIntensity(requested);
            session = sessionRepository.save(session);
        }
        Intensity intensity = session.getIntensity();
        String    sessionId = session.getSessionId();
        Domain    domain    = session.getDomain();

        append(SessionMessage.user(sessionId, text));
        List<SessionMessage> transcript = loadTranscript(sessionId);

        // everything before the message just appended
        List<ConversationMessage> prior = transcript.subList(0, Math.max(0, transcript.size() - 1)).stream()
                .map(ConversationMessage::from)
                .toList();

        TurnResult turn = turnProcessor.processTurn(domain, prior, text, intensity);
        append(SessionMessage.assistant(sessionId, turn.reply(), intensity));

        int questionCount = countQuestions(transcript) + 1;
        log.info("[Chat] session={} domain={} questions={} fallback={} suggestedTermination={}",
                sessionId, domain.value(), questionCount, turn.fallbackUsed(), turn.suggestedTermination());

        return ChatTurnResponse.questioning(sessionId, turn.reply(), questionCount,
                questionCount >= MIN_QUESTIONS, turn.suggestedTermination());
    }

    // ── Generation ───────────────────────────────────────────────────────────

    private ChatTurnResponse generate(String userId, ChatSession session, String message) {
        String sessionId = session.getSessionId();
        Domain domain    = session.getDomain();
        String text      = turnProcessor.validateUserMessage(message);

        int questionCount = countQuestions(loadTranscript(sessionId));
        if (questionCount < MIN_QUESTIONS) {
            throw new ClarifierException(ErrorCode.MIN_QUESTIONS_NOT_MET,
                    "%d of %d questions answered".formatted(questionCount, MIN_QUESTIONS));
        }

        session = claim(session);

        String brief;
        GenerationResult result;
        try {
            append(SessionMessage.user(sessionId, text));

            List<ConversationMessage> history = loadTranscript(sessionId).stream()
                    .map(ConversationMessage::from)
                    .toList();

            brief = briefSynthesizer.synthesize(domain, history);
            session.setFinalBrief(brief);
            session = sessionRepository.save(session);

            result = outputGenerator.generate(domain, brief);
            JsonNode artifact = result.structured().orElse(TextNode.valueOf(result.rawOutput()));

            session.setFinalOutput(toJson(artifact));
            session.advanceTo(SessionStatus.COMPLETED);
            session = sessionRepository.saveAndFlush(session);
        } catch (RuntimeException e) {
            release(session, e);
            throw e;
        }

        UsageIncrement usage = rateLimiter.incrementUsage(userId);
        if (!usage.succeeded()) {
            log.warn("[Chat] session={} usage increment failed for userId={}: {}",
                    sessionId, userId, usage.error().getMessage());
        }

        String summary = "Great! I've generated your %s based on our conversation. Here are the results."
                .formatted(domain.artifact());
        append(SessionMessage.assistant(sessionId, summary, null));

        log.info("[Chat] session={} domain={} completed model={} words={} structured={} attempts={}",
                sessionId, domain.value(), result.model(), result.wordCount(),
                result.structured().isPresent(), session.getGenerationAttempts());

        Object generatedIdeas = result.structured().<Object>map(node -> node).orElse(result.rawOutput());
        return ChatTurnResponse.completed(sessionId, summary, questionCount,
                new FinalOutput(brief, generatedIdeas));
    }

    /**
     * Moves the session into GENERATING and flushes it, so a stale version
     * fails here rather than after the model calls. A session already in
     * GENERATING is taken over only when its claim was released by a failed
     * attempt or is older than the generation budget.
     */
    private ChatSession claim(ChatSession session) {
        LocalDateTime now = LocalDateTime.now();
        if (session.isGenerationClaimedAfter(now.minus(claimLease()))) {
            log.warn("[Chat] session={} generation still running since {}",
                    session.getSessionId(), session.getGenerationStartedAt());
            throw new ClarifierException(ErrorCode.GENERATION_IN_PROGRESS, session.getSessionId());
        }
        if (session.getStatus() == SessionStatus.QUESTIONING) {
            session.advanceTo(SessionStatus.GENERATING);
        }
        session.setGenerationStartedAt(now);
        session.setGenerationAttempts(session.getGenerationAttempts() + 1);
        try {
            ChatSession claimed = sessionRepository.saveAndFlush(session);
            log.info("[Chat] session={} claimed for generation attempt={}",
                    claimed.getSessionId(), claimed.getGenerationAttempts());
            return claimed;
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("[Chat] session={} generation already claimed by another request", session.getSessionId());
            throw new ClarifierException(ErrorCode.GENERATION_IN_PROGRESS, session.getSessionId(), e);
        }
    }

    /**
     * Gives up the claim after a failed attempt so the next generateNow can
     * take it at once. If this write fails too, the claim lapses with the lease.
     */
    private void release(ChatSession session, RuntimeException failure) {
        if (session.getStatus() != SessionStatus.GENERATING) {
            // failed while writing the completed state; that write must not be replayed here
            return;
        }
        session.setGenerationStartedAt(null);
        try {
            sessionRepository.save(session);
            log.info("[Chat] session={} released generation claim after {}",
                    session.getSessionId(), failure.getClass().getSimpleName());
        } catch (DataAccessException e) {
            log.warn("[Chat] session={} could not release generation claim: {}",
                    session.getSessionId(), e.getMessage());
            failure.addSuppressed(e);
        }
    }

    private Duration claimLease() {
        return llmProperties.generationBudget().plus(CLAIM_GRACE);
    }

    // ── Store helpers ────────────────────────────────────────────────────────

    private void append(SessionMessage message) {
        try {
            messageRepository.save(message);
        } catch (DataAccessException e) {
            throw new ClarifierException(ErrorCode.MESSAGE_SAVE_FAILED, e.getMessage(), e);
        }
    }

    private List<SessionMessage> loadTranscript(String sessionId) {
        try {
            return messageRepository.findBySessionIdOrderByIdAsc(sessionId);
        } catch (DataAccessException e) {
            throw new ClarifierException(ErrorCode.HISTORY_RETRIEVAL_ERROR, e.getMessage(), e);
        }
    }

    /**
     * Every assistant message counts as a question asked. Informational replies
     * and fallback sentences are counted too; the completion summary is never
     * seen here because the session is closed by then.
     */
    static int countQuestions(List<SessionMessage> transcript) {
        return (int) transcript.stream().filter(m -> m.getRole() == MessageRole.ASSISTANT).count();
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ClarifierException(ErrorCode.GENERATION_FAILED, "Could not serialize output", e);
        }
    }
}
