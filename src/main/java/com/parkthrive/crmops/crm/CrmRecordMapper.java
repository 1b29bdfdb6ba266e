package com.parkthrive.crmops.crm;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link CrmRecord}s out of CRM JSON. Custom fields arrive as top level
 * {@code custom.cf_...} keys; JSON {@code null} is treated as "not set".
 */
@Component
public class CrmRecordMapper {

    static final String CUSTOM_PREFIX = "custom.";

    public CrmRecord fromJson(JsonNode node) {
        CrmRecord.CrmRecordBuilder builder = CrmRecord.builder()
                .id(text(node, "id"))
                .name(text(node, "name"))
                .displayName(text(node, "display_name"))
                .statusId(text(node, "status_id"))
                .statusLabel(text(node, "status_label"))
                .leadId(text(node, "lead_id"))
                .valueFormatted(text(node, "value_formatted"))
                .source(node);

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().startsWith(CUSTOM_PREFIX) && !field.getValue().isNull()) {
                builder.customField(field.getKey().substring(CUSTOM_PREFIX.length()), asString(field.getValue()));
            }
        }

        JsonNode named = node.path("custom");
        if (named.isObject()) {
            named.fields().forEachRemaining(e -> {
                if (!e.getValue().isNull()) {
                    builder.namedField(e.getKey(), asString(e.getValue()));
                }
            });
        }

        for (JsonNode child : node.path("opportunities")) {
            builder.child(fromJson(child));
        }
        for (JsonNode contact : node.path("contacts")) {
            builder.contact(fromJson(contact));
        }
        for (JsonNode address : node.path("addresses")) {
            builder.address(toAddress(address));
        }
        for (JsonNode email : node.path("emails")) {
            String value = text(email, "email");
            if (value != null && !value.isEmpty()) {
                builder.email(value);
            }
        }
        return builder.build();
    }

    public List<CrmRecord> fromArray(JsonNode array) {
        List<CrmRecord> records = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode item : array) {
                records.add(fromJson(item));
            }
        }
        return records;
    }

    private CrmAddress toAddress(JsonNode node) {
        return CrmAddress.builder()
                .label(text(node, "label"))
                .address1(text(node, "address_1"))
                .address2(text(node, "address_2"))
                .city(text(node, "city"))
                .state(text(node, "state"))
                .zipcode(text(node, "zipcode"))
                .country(text(node, "country"))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : asString(value);
    }

    /**
     * Multi-value custom fields come back as arrays; they are joined with commas.
     */
    private static String asString(JsonNode value) {
        if (value.isArray()) {
            List<String> parts = new ArrayList<>();
            value.forEach(v -> parts.add(v.asText()));
            return String.join(",", parts);
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
