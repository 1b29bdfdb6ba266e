package com.parkthrive.crmops.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "crm.find-owner")
public class FindOwnerProperties {

    private int targetLeads = 300;
    private String query = "./queries/find_owner.json";

    /**
     * Directory the hand-off CSV is written to
     */
    private String exportDirectory = ".";

    /**
     * Lead and contact that receive the hand-off email
     */
    private String recipientLeadId;
    private String recipientContactId;
    private String fallbackRecipientEmail;

    private String senderName;
    private String senderEmail;
    private String recipientGreetingName;
    private String signature = "";
}
