package com.parkthrive.crmops.crm;

import com.parkthrive.crmops.config.CampaignProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps each {@link CampaignField} to the custom field id configured for it.
 */
@Slf4j
@Component
public class FieldRegistry {

    private final Map<CampaignField, String> ids;

    public FieldRegistry(CampaignProperties properties) {
        this.ids = new EnumMap<>(CampaignField.class);
        properties.getFields().forEach((field, id) -> {
            if (id != null && !id.isBlank()) {
                ids.put(field, id.trim());
            }
        });
    }

    public boolean isConfigured(CampaignField field) {
        return ids.containsKey(field);
    }

    public String id(CampaignField field) {
        String id = ids.get(field);
        if (id == null) {
            throw new IllegalStateException("No custom field id configured for " + field);
        }
        return id;
    }

    /** Key used when writing the field: {@code custom.<id>} */
    public String writeKey(CampaignField field) {
        return CrmRecordMapper.CUSTOM_PREFIX + id(field);
    }

    public Optional<String> read(CrmRecord record, CampaignField field) {
        return record.custom(id(field));
    }

    /**
     * Returns the fields among {@code required} that have no configured id.
     */
    public List<String> missing(Collection<CampaignField> required) {
        List<String> problems = new ArrayList<>();
        for (CampaignField field : required) {
            if (!isConfigured(field)) {
                problems.add("crm.campaign.fields." + field.name().toLowerCase().replace('_', '-') + " is not set");
            }
        }
        return problems;
    }

    /**
     * Checks the configured ids of {@code required} against the custom field lists of the account(s).
     * A schema that cannot be fetched is logged and skipped.
     */
    public List<String> validateAgainstSchema(Collection<CampaignField> required, CrmClient primary, CrmClient secondary) {
        List<String> problems = new ArrayList<>();
        Map<String, Set<String>> schemaCache = new HashMap<>();

        for (CampaignField field : required) {
            if (!isConfigured(field)) {
                continue;
            }
            CrmClient client = field.isSecondaryAccount() ? secondary : primary;
            if (client == null) {
                continue;
            }

            String cacheKey = client.getAccount() + "/" + field.getScope().objectType();
            Set<String> known = schemaCache.computeIfAbsent(cacheKey, k -> fetchSchema(client, field.getScope()));
            if (known.isEmpty()) {
                continue;
            }
            if (!known.contains(id(field))) {
                problems.add(String.format("Custom field %s (%s) not found in %s %s schema",
                        field, id(field), client.getAccount(), field.getScope().objectType()));
            }
        }
        return problems;
    }

    private Set<String> fetchSchema(CrmClient client, CampaignField.FieldScope scope) {
        SearchResult result = client.listCustomFields(scope);
        if (!result.isOk()) {
            log.warn("Could not load {} custom fields of {} account (HTTP {}), skipping validation",
                    scope.objectType(), client.getAccount(), result.getHttpStatus());
            return Set.of();
        }
        Set<String> known = new HashSet<>();
        result.getItems().forEach(item -> known.add(item.getId()));
        log.debug("Loaded {} {} custom fields of {} account", known.size(), scope.objectType(), client.getAccount());
        return known;
    }
}
