package com.wgbot.infrastructure.notification;

import com.wgbot.application.ports.NotifierPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when no bot token is configured: messages only go to the log.
 */
public class LoggingNotifier implements NotifierPort {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(long destinationId, String text) {
        log.info("[notify {}] {}", destinationId, text);
    }
}
