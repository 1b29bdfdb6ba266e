package com.parkthrive.crmops.crm;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A lead, opportunity, contact or any other object returned by the CRM.
 * <p>
 * {@code customFields} is keyed by custom field id and only holds fields present in the
 * response: an absent key means "not set", an empty string is a set but empty value.
 * {@code namedFields} is the same data keyed by field label, as returned in the
 * {@code custom} object of lead details.
 */
@Value
@Builder(toBuilder = true)
public class CrmRecord {

    String id;
    String name;
    String displayName;
    String statusId;
    String statusLabel;
    String leadId;
    String valueFormatted;

    @Singular("customField")
    Map<String, String> customFields;

    @Singular("namedField")
    Map<String, String> namedFields;

    /** Nested opportunities, in listed order */
    @Singular("child")
    List<CrmRecord> children;

    @Singular("contact")
    List<CrmRecord> contacts;

    @Singular("address")
    List<CrmAddress> addresses;

    @Singular("email")
    List<String> emails;

    /** The JSON object this record was read from */
    JsonNode source;

    public Optional<String> custom(String fieldId) {
        return Optional.ofNullable(customFields.get(fieldId));
    }

    public Optional<String> named(String label) {
        return Optional.ofNullable(namedFields.get(label));
    }

    public boolean hasCustom(String fieldId) {
        return customFields.containsKey(fieldId);
    }

    public String label() {
        if (displayName != null && !displayName.isEmpty()) {
            return displayName;
        }
        return name != null ? name : id;
    }
}
