package com.parkthrive.crmops.campaign;

import com.parkthrive.crmops.config.CampaignProperties;
import com.parkthrive.crmops.crm.CrmRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stage ids, labels and letter templates bound from {@code crm.campaign}.
 */
@Component
public class StageCatalog {

    private final Map<StageKey, Stage> stages = new EnumMap<>(StageKey.class);
    private final Map<StageKey, String> templates = new EnumMap<>(StageKey.class);

    public StageCatalog(CampaignProperties properties) {
        properties.getStages().forEach((key, definition) -> {
            if (definition != null && definition.getId() != null && !definition.getId().isBlank()) {
                stages.put(key, new Stage(key, definition.getId().trim(), definition.getLabel()));
            }
        });
        properties.getTemplates().forEach((key, template) -> {
            if (template != null && !template.isBlank()) {
                templates.put(key, template.trim());
            }
        });
    }

    public Stage get(StageKey key) {
        Stage stage = stages.get(key);
        if (stage == null) {
            throw new IllegalStateException("Stage " + key + " is not configured");
        }
        return stage;
    }

    public Optional<Stage> find(StageKey key) {
        return Optional.ofNullable(stages.get(key));
    }

    public Optional<String> template(StageKey key) {
        return Optional.ofNullable(templates.get(key));
    }

    /**
     * The configured stage {@code record} is in, if any.
     */
    public Optional<StageKey> stageOf(CrmRecord record) {
        return stages.values().stream()
                .filter(stage -> stage.matches(record))
                .map(Stage::getKey)
                .findFirst();
    }

    public List<String> missingStages(Collection<StageKey> required) {
        List<String> problems = new ArrayList<>();
        for (StageKey key : required) {
            if (!stages.containsKey(key)) {
                problems.add("crm.campaign.stages." + property(key) + ".id is not set");
            }
        }
        return problems;
    }

    public List<String> missingTemplates(Collection<StageKey> required) {
        List<String> problems = new ArrayList<>();
        for (StageKey key : required) {
            if (!templates.containsKey(key)) {
                problems.add("crm.campaign.templates." + property(key) + " is not set");
            }
        }
        return problems;
    }

    private static String property(StageKey key) {
        return key.name().toLowerCase().replace('_', '-');
    }
}
