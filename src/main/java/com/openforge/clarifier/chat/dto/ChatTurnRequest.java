package com.openforge.clarifier.chat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.clarifier.domain.Domain;
import com.openforge.clarifier.domain.Intensity;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/chat.
 *
 * @param sessionId   absent to start a new session
 * @param domain      required when starting a session, ignored afterwards
 * @param generateNow true to end questioning and produce the artifact
 * @param intensity   questioning style; the session keeps the last one given
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ChatTurnRequest(

        @Pattern(regexp = "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$",
                 message = "sessionId must be a UUID")
        @JsonProperty("sessionId")   String    sessionId,

        @NotNull(message = "message is required")
        @Size(min = 1, max = 10000, message = "message must be between 1 and 10000 characters")
        @JsonProperty("message")     String    message,

        @JsonProperty("domain")      Domain    domain,
        @JsonProperty("generateNow") Boolean   generateNow,
        @JsonProperty("intensity")   Intensity intensity
) {

    public boolean isNewSession() {
        return sessionId == null || sessionId.isBlank();
    }

    public boolean wantsGeneration() {
        return Boolean.TRUE.equals(generateNow);
    }
}
