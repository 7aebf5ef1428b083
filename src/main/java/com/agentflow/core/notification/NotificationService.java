package com.agentflow.core.notification;

import com.agentflow.core.events.EventBus;
import com.agentflow.core.events.OrchestrationEvent;
import com.agentflow.core.model.Notification;
import com.agentflow.core.store.OrchestrationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records operator notifications and hands them to the {@link NotificationSink}.
 * <p>
 * The record is stored first; delivery failures are logged and leave it
 * marked unsent.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final OrchestrationStore store;
    private final NotificationSink sink;
    private final EventBus eventBus;
    private final Clock clock;

    public NotificationService(OrchestrationStore store, NotificationSink sink, EventBus eventBus, Clock clock) {
        this.store = store;
        this.sink = sink;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public Notification notify(String type, String subject, String message, Long recipientAgentId,
                               Map<String, Object> metadata) {
        Notification notification = store.createNotification(
                Notification.create(type, subject, message, recipientAgentId, metadata, clock.instant()));

        try {
            sink.deliver(notification);
            notification = store.markNotificationSent(notification.id());
        } catch (RuntimeException e) {
            log.warn("Delivery of notification {} ({}) failed: {}", notification.id(), type, e.getMessage(), e);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("notificationId", notification.id());
        payload.put("type", type);
        payload.put("subject", subject);
        payload.put("sent", notification.sent());
        Object taskId = metadata == null ? null : metadata.get("taskId");
        eventBus.publish(OrchestrationEvent.NOTIFICATION, taskId instanceof Number n ? n.longValue() : null, payload);
        return notification;
    }
}
