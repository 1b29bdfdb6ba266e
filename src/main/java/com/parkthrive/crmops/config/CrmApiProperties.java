package com.parkthrive.crmops.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Slf4j
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "crm.api")
public class CrmApiProperties {

    /**
     * CRM REST API base URL
     * Example: https://api.close.com/api/v1
     */
    private String baseUrl = "https://api.close.com/api/v1";

    /**
     * API key of the primary account (all campaign workflows)
     */
    private String primaryApiKey;

    /**
     * API key of the secondary account (lot address lookups only)
     */
    private String secondaryApiKey;

    private int connectTimeoutMs = 10000;
    private int readTimeoutMs = 60000;

    @PostConstruct
    public void validate() {
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("crm.api.connect-timeout-ms must be > 0");
        }
        if (readTimeoutMs <= 0) {
            throw new IllegalArgumentException("crm.api.read-timeout-ms must be > 0");
        }

        log.info("CRM client config: baseUrl={}, connect={}ms, read={}ms",
                baseUrl, connectTimeoutMs, readTimeoutMs);
    }
}
