package com.parkthrive.crmops.crm;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Result of a create or update call. A 2xx with an empty or undecodable body is still ok.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WriteResult {

    boolean ok;
    int httpStatus;
    String errorMessage;
    JsonNode body;

    public static WriteResult ok(int httpStatus, JsonNode body) {
        return new WriteResult(true, httpStatus, null, body);
    }

    public static WriteResult failed(int httpStatus, String errorMessage) {
        return new WriteResult(false, httpStatus, errorMessage, null);
    }

    public Optional<JsonNode> body() {
        return Optional.ofNullable(body);
    }

    /** Id of the created object, when the response carries one */
    public Optional<String> createdId() {
        return body().map(b -> b.path("id")).filter(JsonNode::isTextual).map(JsonNode::asText);
    }
}
