package com.openforge.clarifier.generation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Generated artifact.
 *
 * @param rawOutput  model reply as received
 * @param structured parsed JSON object or array, empty when the reply held none
 * @param wordCount  whitespace-delimited tokens in {@code rawOutput}
 * @param model      model that produced the reply
 */
public record GenerationResult(
        String rawOutput,
        Optional<JsonNode> structured,
        int wordCount,
        String model
) {}
