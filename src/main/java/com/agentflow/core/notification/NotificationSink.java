package com.agentflow.core.notification;

import com.agentflow.core.model.Notification;

/**
 * Outbound delivery of operator notifications (e-mail, chat, websocket...).
 * Fire-and-forget: a sink that throws only loses that one delivery.
 */
@FunctionalInterface
public interface NotificationSink {

    void deliver(Notification notification);
}
