package com.parkthrive.crmops.resolve;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.crm.CrmAddress;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.SearchResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Finds the lead of the secondary account that shares a cross reference value and returns its
 * address. Only the first search hit is used. No hit, or a hit without addresses, is a
 * "no data" result rather than an error.
 */
@Slf4j
public class CrossAccountLookup {

    static final int SEARCH_LIMIT = 10;

    private final CrmClient secondary;
    private final ObjectMapper objectMapper;

    public CrossAccountLookup(CrmClient secondary, ObjectMapper objectMapper) {
        this.secondary = secondary;
        this.objectMapper = objectMapper;
    }

    /**
     * Address of the first secondary lead whose {@code fieldId} starts with {@code value}:
     * its {@code business} address if it has one, otherwise its first address.
     */
    public Optional<String> findAddress(String fieldId, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }

        SearchResult result = secondary.search(searchQuery(fieldId, value));
        if (!result.isOk()) {
            log.error("Search of {} account by {} failed: HTTP {}",
                    secondary.getAccount(), value, result.getHttpStatus());
            return Optional.empty();
        }
        if (result.getItems().isEmpty()) {
            return Optional.empty();
        }

        String matchId = result.getItems().get(0).getId();
        Optional<CrmRecord> match = secondary.getLead(matchId).record();
        if (match.isEmpty()) {
            log.error("Failed to get lead details of {} in {} account", matchId, secondary.getAccount());
            return Optional.empty();
        }

        return pickAddress(match.get().getAddresses()).map(CrmAddress::toSingleLine);
    }

    static Optional<CrmAddress> pickAddress(List<CrmAddress> addresses) {
        return addresses.stream()
                .filter(CrmAddress::isBusiness)
                .findFirst()
                .or(() -> addresses.stream().findFirst());
    }

    ObjectNode searchQuery(String fieldId, String value) {
        ObjectNode condition = objectMapper.createObjectNode();
        condition.putObject("condition")
                .put("mode", "beginning_of_words")
                .put("type", "text")
                .put("value", value);
        condition.putObject("field")
                .put("custom_field_id", fieldId)
                .put("type", "custom_field");
        condition.put("negate", false);
        condition.put("type", "field_condition");

        ObjectNode objectType = objectMapper.createObjectNode()
                .put("negate", false)
                .put("object_type", "lead")
                .put("type", "object_type");

        ObjectNode query = objectMapper.createObjectNode();
        query.put("limit", SEARCH_LIMIT);
        ObjectNode root = query.putObject("query");
        root.put("negate", false);
        ArrayNode queries = root.putArray("queries");
        queries.add(objectType);
        queries.add(and(and(condition)));
        root.put("type", "and");
        query.putNull("results_limit");
        query.putArray("sort");
        return query;
    }

    private ObjectNode and(ObjectNode inner) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("negate", false);
        node.putArray("queries").add(inner);
        node.put("type", "and");
        return node;
    }
}
