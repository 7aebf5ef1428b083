package com.agentflow.core.notification;

import com.agentflow.core.model.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: writes notifications to the application log.
 */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void deliver(Notification notification) {
        log.info("[{}] {}: {}", notification.type(), notification.subject(), notification.message());
    }
}
