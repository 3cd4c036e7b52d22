package com.openforge.clarifier.conversation;

/**
 * Outcome of one questioning turn.
 *
 * @param reply                text to show the user; never blank
 * @param suggestedTermination the reply hints that generation could start
 * @param fallbackUsed         the model could not be reached and {@code reply} is the static fallback
 */
public record TurnResult(String reply, boolean suggestedTermination, boolean fallbackUsed) {

    public static TurnResult answered(String reply, boolean suggestedTermination) {
        return new TurnResult(reply, suggestedTermination, false);
    }

    public static TurnResult fallback(String reply) {
        return new TurnResult(reply, false, true);
    }
}
