package com.parkthrive.crmops.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.parkthrive.crmops.config.SlackProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@Service
@ConditionalOnProperty(name = "crm.slack.enabled", havingValue = "true")
public class SlackNotificationService implements NotificationService {

    private final SlackProperties properties;
    private final RestTemplate restTemplate;

    @Autowired
    public SlackNotificationService(SlackProperties properties) {
        this(properties, new RestTemplate());
    }

    SlackNotificationService(SlackProperties properties, RestTemplate restTemplate) {
        this.properties = properties;
        this.restTemplate = restTemplate;
        log.info("Slack notification ENABLED: channelId={}", properties.getChannelId());
    }

    @Override
    public boolean sendTeamMessage(String text, boolean mentionTeam) {
        try {
            ResponseEntity<JsonNode> response = postMessage(formatMessage(text, mentionTeam));
            JsonNode body = response.getBody();
            if (!response.getStatusCode().is2xxSuccessful() || body == null || !body.path("ok").asBoolean(false)) {
                log.error("Slack rejected message: HTTP {} - {}", response.getStatusCode().value(), body);
                return false;
            }
            log.info("Message sent to Slack channel {}", properties.getChannelId());
            return true;
        } catch (Exception e) {
            log.error("Failed to send message to Slack: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    String formatMessage(String text, boolean mentionTeam) {
        String group = properties.getUserGroupId();
        if (mentionTeam && group != null && !group.isBlank()) {
            return "<!subteam^" + group + "> " + text;
        }
        return text;
    }

    private ResponseEntity<JsonNode> postMessage(String text) {
        Map<String, Object> body = new HashMap<>();
        body.put("channel", properties.getChannelId());
        body.put("text", text);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getBotToken());

        return restTemplate.postForEntity(properties.getApiUrl(), new HttpEntity<>(body, headers), JsonNode.class);
    }
}
