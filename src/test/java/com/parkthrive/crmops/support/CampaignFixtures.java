package com.parkthrive.crmops.support;

import com.parkthrive.crmops.campaign.StageKey;
import com.parkthrive.crmops.config.CampaignProperties;
import com.parkthrive.crmops.crm.CampaignField;
import com.parkthrive.crmops.crm.CrmRecord;

/**
 * Campaign configuration and records shared by the tests.
 */
public final class CampaignFixtures {

    public static final String HOLD = "stat_hold";
    public static final String UNPAID = "stat_unpaid";
    public static final String ROUND_1 = "stat_r1";
    public static final String ROUND_2 = "stat_r2";
    public static final String ROUND_3 = "stat_r3";
    public static final String LEAD_ERROR = "stat_error";

    public static final String MAILER_DATES = "cf_mailer";
    public static final String TEMPLATE = "cf_template";
    public static final String LAST_MAIL_DATE = "cf_last_mail";
    public static final String CITATION_DATE = "cf_citation_date";
    public static final String CITATION_NUMBER = "cf_citation_number";
    public static final String CITATION_TIME = "cf_citation_time";
    public static final String CITATION_IMAGE_URL = "cf_image_url";
    public static final String FINE_AMOUNT = "cf_fine";
    public static final String SERVICE_FEE = "cf_fee";
    public static final String LOT_ADDRESS = "cf_lot_address";
    public static final String LOT_UID = "cf_lot_uid";
    public static final String SECONDARY_LOT_UID = "cf_pt_lot_uid";
    public static final String SALES_OWNER = "cf_owner";
    public static final String SEND_DATE = "cf_send_date";

    private CampaignFixtures() {
    }

    public static CampaignProperties campaignProperties() {
        CampaignProperties properties = new CampaignProperties();
        stage(properties, StageKey.HOLD, HOLD, "Hold");
        stage(properties, StageKey.UNPAID, UNPAID, "Unpaid");
        stage(properties, StageKey.ROUND_1, ROUND_1, "Stage 1");
        stage(properties, StageKey.ROUND_2, ROUND_2, "Stage 2");
        stage(properties, StageKey.ROUND_3, ROUND_3, "Stage 3");
        stage(properties, StageKey.LEAD_ERROR, LEAD_ERROR, "Error");

        properties.getTemplates().put(StageKey.ROUND_1, "template_r1");
        properties.getTemplates().put(StageKey.ROUND_2, "template_r2");
        properties.getTemplates().put(StageKey.ROUND_3, "template_r3");

        properties.getFields().put(CampaignField.MAILER_DATES, MAILER_DATES);
        properties.getFields().put(CampaignField.TEMPLATE, TEMPLATE);
        properties.getFields().put(CampaignField.LAST_MAIL_DATE, LAST_MAIL_DATE);
        properties.getFields().put(CampaignField.CITATION_DATE, CITATION_DATE);
        properties.getFields().put(CampaignField.CITATION_NUMBER, CITATION_NUMBER);
        properties.getFields().put(CampaignField.CITATION_TIME, CITATION_TIME);
        properties.getFields().put(CampaignField.CITATION_IMAGE_URL, CITATION_IMAGE_URL);
        properties.getFields().put(CampaignField.FINE_AMOUNT, FINE_AMOUNT);
        properties.getFields().put(CampaignField.SERVICE_FEE, SERVICE_FEE);
        properties.getFields().put(CampaignField.LOT_ADDRESS, LOT_ADDRESS);
        properties.getFields().put(CampaignField.LOT_UID, LOT_UID);
        properties.getFields().put(CampaignField.SECONDARY_LOT_UID, SECONDARY_LOT_UID);
        properties.getFields().put(CampaignField.SALES_OWNER, SALES_OWNER);
        properties.getFields().put(CampaignField.POSTGRID_SEND_DATE, SEND_DATE);
        return properties;
    }

    public static CrmRecord opportunity(String id, String statusId) {
        return CrmRecord.builder().id(id).statusId(statusId).build();
    }

    public static CrmRecord lead(String id, CrmRecord... opportunities) {
        CrmRecord.CrmRecordBuilder lead = CrmRecord.builder().id(id).displayName("Lead " + id);
        for (CrmRecord opportunity : opportunities) {
            lead.child(opportunity);
        }
        return lead.build();
    }

    private static void stage(CampaignProperties properties, StageKey key, String id, String label) {
        CampaignProperties.StageDefinition definition = new CampaignProperties.StageDefinition();
        definition.setId(id);
        definition.setLabel(label);
        properties.getStages().put(key, definition);
    }
}
