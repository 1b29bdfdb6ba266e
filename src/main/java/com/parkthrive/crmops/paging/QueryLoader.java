package com.parkthrive.crmops.paging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.config.FatalConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads search query documents and prepares per-run copies of them.
 */
@Slf4j
@Component
public class QueryLoader {

    private final ObjectMapper objectMapper;

    public QueryLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new FatalConfigException("Query file not found: " + path.toAbsolutePath());
        }
        try {
            JsonNode node = objectMapper.readTree(path.toFile());
            if (!(node instanceof ObjectNode)) {
                throw new FatalConfigException("Query file is not a JSON object: " + path);
            }
            log.debug("Loaded query {}", path);
            return (ObjectNode) node;
        } catch (IOException e) {
            throw new FatalConfigException("Error loading query " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Copy of {@code query} that returns the given lead fields when it does not select any itself.
     */
    public ObjectNode withDefaultLeadFields(ObjectNode query, List<String> fields) {
        ObjectNode copy = query.deepCopy();
        if (!copy.has("_fields")) {
            ArrayNode lead = copy.putObject("_fields").putArray("lead");
            fields.forEach(lead::add);
        }
        return copy;
    }

    /**
     * Copy of {@code query} whose first field condition on {@code customFieldId} matches only
     * {@code objectId}. Conditions are searched depth first through nested {@code queries}.
     */
    public ObjectNode withObjectIds(ObjectNode query, String customFieldId, String objectId) {
        ObjectNode copy = query.deepCopy();
        JsonNode root = copy.get("query");
        if (root == null || !replaceObjectIds(root, customFieldId, objectId)) {
            log.warn("No condition on {} found in query; it is used unchanged", customFieldId);
        }
        return copy;
    }

    private boolean replaceObjectIds(JsonNode node, String customFieldId, String objectId) {
        if ("field_condition".equals(node.path("type").asText())
                && customFieldId.equals(node.path("field").path("custom_field_id").asText())
                && node.path("condition").isObject()) {
            ((ObjectNode) node.get("condition")).putArray("object_ids").add(objectId);
            return true;
        }
        for (JsonNode child : node.path("queries")) {
            if (replaceObjectIds(child, customFieldId, objectId)) {
                return true;
            }
        }
        return false;
    }
}
