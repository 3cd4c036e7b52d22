package com.openforge.clarifier.chat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * @param generatedIdeas parsed JSON (object or array) when the model returned any, else the raw text
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record FinalOutput(
        @JsonProperty("brief")          String brief,
        @JsonProperty("generatedIdeas") Object generatedIdeas
) {}
