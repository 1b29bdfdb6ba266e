package com.parkthrive.crmops.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@ConditionalOnMissingBean(SlackNotificationService.class)
public class NoOpNotificationService implements NotificationService {

    public NoOpNotificationService() {
        log.info("Slack notification DISABLED, team messages will only be logged");
    }

    @Override
    public boolean sendTeamMessage(String text, boolean mentionTeam) {
        log.warn("Team message (no notification configured): {}", text);
        return false;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
