package com.parkthrive.crmops.http;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Final result of an executed request after all retries.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApiResponse {

    Status status;
    int httpStatus;
    JsonNode body;
    String errorMessage;

    public enum Status {
        /** 2xx; body may be absent (204, or undecodable body of a write) */
        SUCCESS,
        /** non-retryable 4xx/5xx */
        FAILURE,
        /** 2xx read whose body could not be decoded */
        MALFORMED
    }

    public static ApiResponse success(int httpStatus, JsonNode body) {
        return new ApiResponse(Status.SUCCESS, httpStatus, body, null);
    }

    public static ApiResponse failure(int httpStatus, String errorMessage) {
        return new ApiResponse(Status.FAILURE, httpStatus, null, errorMessage);
    }

    public static ApiResponse malformed(int httpStatus) {
        return new ApiResponse(Status.MALFORMED, httpStatus, null, "Error decoding API response");
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Optional<JsonNode> payload() {
        return Optional.ofNullable(body);
    }
}
