package com.openforge.clarifier.chat.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.clarifier.error.ErrorCode;
import com.openforge.clarifier.ratelimit.RateLimitResult;

/**
 * Error body shared by every failure of the chat endpoint.
 *
 * @param error   user-facing message of the code
 * @param details diagnostic text, if any
 * @param message quota guidance on rate-limit responses
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ErrorResponse(
        @JsonProperty("error")     String  error,
        @JsonProperty("code")      String  code,
        @JsonProperty("details")   String  details,
        @JsonProperty("message")   String  message,
        @JsonProperty("remaining") Integer remaining,
        @JsonProperty("limit")     Integer limit,
        @JsonProperty("tier")      String  tier
) {

    public static ErrorResponse of(ErrorCode code, String details) {
        return new ErrorResponse(code.message(), code.name(), details, null, null, null, null);
    }

    public static ErrorResponse rateLimited(RateLimitResult result) {
        return new ErrorResponse(
                ErrorCode.RATE_LIMIT_EXCEEDED.message(),
                ErrorCode.RATE_LIMIT_EXCEEDED.name(),
                null,
                "You have used %d of %d sessions on the %s tier.".formatted(
                        result.limit() - result.remaining(), result.limit(), result.tier().value()),
                result.remaining(),
                result.limit(),
                result.tier().value());
    }
}
