package com.wgbot.application.ports;

/**
 * Outbound plain-text messages to chat users and admins.
 */
public interface NotifierPort {

    /**
     * @param destinationId chat-platform id of the recipient
     * @throws NotificationException when the message could not be delivered
     */
    void notify(long destinationId, String text);
}
