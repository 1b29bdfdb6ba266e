package com.parkthrive.crmops.config;

import com.parkthrive.crmops.campaign.StageKey;
import com.parkthrive.crmops.crm.CampaignField;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "crm.campaign")
public class CampaignProperties {

    /**
     * Custom field ids keyed by semantic name
     * Example: crm.campaign.fields.mailer-dates=cf_JWPY...
     */
    private Map<CampaignField, String> fields = new EnumMap<>(CampaignField.class);

    /**
     * Stage (status) ids and labels keyed by campaign position
     */
    private Map<StageKey, StageDefinition> stages = new EnumMap<>(StageKey.class);

    /**
     * Letter template id written when a record enters the keyed stage
     */
    private Map<StageKey, String> templates = new EnumMap<>(StageKey.class);

    /**
     * Query document path per workflow name
     * Example: crm.campaign.queries.round-1=./queries/round_1_query.json
     */
    private Map<String, String> queries = new HashMap<>();

    /**
     * Format of dates written to CRM fields
     */
    private String dateFormat = "MM/dd/yyyy";

    /**
     * Check configured field ids against the remote schema before a run
     */
    private boolean validateFields = true;

    /**
     * Title prefix of the note attached when a lead is moved to the error stage
     */
    private String errorNoteTitle = "PostGrid Error";

    @Data
    public static class StageDefinition {
        private String id;
        private String label;
    }
}
