package com.parkthrive.crmops.notification;

public interface NotificationService {

    /**
     * Post a message to the team channel, optionally mentioning the configured user group.
     * Never throws; returns whether the message was accepted.
     */
    boolean sendTeamMessage(String text, boolean mentionTeam);

    /**
     * Is notification service active?
     */
    boolean isEnabled();
}
