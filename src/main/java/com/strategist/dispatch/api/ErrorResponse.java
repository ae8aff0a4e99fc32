package com.strategist.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Error body returned by the plan API.
 */
public record ErrorResponse(
    String error,
    @JsonProperty("offending_ids") List<String> offendingIds
) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, List.of());
    }
}
