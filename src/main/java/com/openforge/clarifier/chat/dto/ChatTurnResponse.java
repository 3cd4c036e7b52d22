package com.openforge.clarifier.chat.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.clarifier.domain.SessionStatus;

/**
 * Success body of POST /api/chat. Optional fields are omitted when null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ChatTurnResponse(
        @JsonProperty("sessionId")            String        sessionId,
        @JsonProperty("responseMessage")      String        responseMessage,
        @JsonProperty("isCompleted")          boolean       isCompleted,
        @JsonProperty("status")               SessionStatus status,
        @JsonProperty("questionCount")        Integer       questionCount,
        @JsonProperty("canGenerate")          Boolean       canGenerate,
        @JsonProperty("suggestedTermination") Boolean       suggestedTermination,
        @JsonProperty("finalOutput")          FinalOutput   finalOutput
) {

    public static ChatTurnResponse questioning(String sessionId, String reply, int questionCount,
                                               boolean canGenerate, boolean suggestedTermination) {
        return new ChatTurnResponse(sessionId, reply, false, SessionStatus.QUESTIONING,
                questionCount, canGenerate, suggestedTermination, null);
    }

    public static ChatTurnResponse completed(String sessionId, String summary, int questionCount,
                                             FinalOutput finalOutput) {
        return new ChatTurnResponse(sessionId, summary, true, SessionStatus.COMPLETED,
                questionCount, true, null, finalOutput);
    }
}
