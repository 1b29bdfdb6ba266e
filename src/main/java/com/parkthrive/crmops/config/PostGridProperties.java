package com.parkthrive.crmops.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "crm.postgrid")
public class PostGridProperties {

    private String baseUrl = "https://api.postgrid.com/print-mail/v1";
    private String apiKey;

    /**
     * Vendor contact id used as the return address of every letter
     */
    private String fromContactId;

    private String size = "us_letter";
    private String addressPlacement = "top_first_page";
    private boolean doubleSided = false;
    private boolean color = true;
    private String mailingClass = "first_class";
    private String defaultCountryCode = "US";
}
