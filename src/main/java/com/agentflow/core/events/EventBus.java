package com.agentflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub channel for orchestration events.
 * <p>
 * Supports per-task subscriptions and global subscriptions that receive all
 * events. Delivery is synchronous and best-effort: there is no acknowledgement,
 * and a subscriber that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Clock clock;

    /** Per-task subscribers keyed by task id. */
    private final ConcurrentHashMap<Long, CopyOnWriteArrayList<Consumer<OrchestrationEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<OrchestrationEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    @Autowired
    public EventBus(Clock clock) {
        this.clock = clock;
    }

    public EventBus() {
        this(Clock.systemUTC());
    }

    /**
     * Publishes an event to all matching subscribers (task-specific and global).
     */
    public void publish(OrchestrationEvent event) {
        log.debug("Publishing event: {} for task {}", event.eventType(), event.taskId());

        if (event.taskId() != null) {
            List<Consumer<OrchestrationEvent>> subs = taskSubscribers.get(event.taskId());
            if (subs != null) {
                for (Consumer<OrchestrationEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<OrchestrationEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Convenience for publishing an event stamped with the current time.
     */
    public void publish(String eventType, Long taskId, Map<String, Object> payload) {
        publish(new OrchestrationEvent(eventType, taskId, payload, clock.instant()));
    }

    /**
     * Subscribes to events about one task.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(long taskId, Consumer<OrchestrationEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to task {}", taskId);
        return () -> {
            CopyOnWriteArrayList<Consumer<OrchestrationEvent>> subs = taskSubscribers.get(taskId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribes to every event.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<OrchestrationEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<OrchestrationEvent> subscriber, OrchestrationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
