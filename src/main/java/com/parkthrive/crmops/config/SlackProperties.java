package com.parkthrive.crmops.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "crm.slack")
public class SlackProperties {

    private boolean enabled = false;
    private String apiUrl = "https://slack.com/api/chat.postMessage";
    private String botToken;
    private String channelId;

    /**
     * Optional user group mentioned at the start of every message
     */
    private String userGroupId;
}
