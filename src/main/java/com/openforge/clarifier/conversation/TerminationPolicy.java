package com.openforge.clarifier.conversation;

/**
 * Decides whether an assistant reply hints that enough context has been
 * gathered to move on to generation. Advisory only: a positive answer never
 * changes session state.
 */
public interface TerminationPolicy {

    boolean suggestsReadiness(String assistantReply);
}
