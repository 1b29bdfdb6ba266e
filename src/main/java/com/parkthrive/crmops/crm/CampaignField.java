package com.parkthrive.crmops.crm;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Semantic names of the custom fields the workflows read or write.
 * External ids are bound from configuration through {@link FieldRegistry}.
 */
@Getter
@RequiredArgsConstructor
public enum CampaignField {

    CITATION_NUMBER(FieldScope.OPPORTUNITY, false),
    CITATION_DATE(FieldScope.OPPORTUNITY, false),
    CITATION_TIME(FieldScope.OPPORTUNITY, false),
    LOT_ADDRESS(FieldScope.OPPORTUNITY, false),
    LOT_UID(FieldScope.OPPORTUNITY, false),
    CITATION_IMAGE_URL(FieldScope.OPPORTUNITY, false),
    FINE_AMOUNT(FieldScope.OPPORTUNITY, false),
    SERVICE_FEE(FieldScope.OPPORTUNITY, false),
    MAILER_DATES(FieldScope.OPPORTUNITY, false),
    TEMPLATE(FieldScope.OPPORTUNITY, false),
    LAST_MAIL_DATE(FieldScope.LEAD, false),
    POSTGRID_SEND_DATE(FieldScope.LEAD, false),
    SALES_OWNER(FieldScope.LEAD, false),
    SECONDARY_LOT_UID(FieldScope.LEAD, true);

    private final FieldScope scope;

    /**
     * True when the field lives in the secondary account's schema
     */
    private final boolean secondaryAccount;

    public enum FieldScope {
        LEAD("lead"),
        OPPORTUNITY("opportunity");

        private final String objectType;

        FieldScope(String objectType) {
            this.objectType = objectType;
        }

        public String objectType() {
            return objectType;
        }
    }
}
